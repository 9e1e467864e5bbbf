package com.bftchain.persistence;

import com.bftchain.validator.ValidatorSet;

import lombok.Value;

/**
 * Durable outcome of the last commit: enough to resume at the next height
 * without ever deciding a committed height again.
 */
@Value
public class CommitRecord {
    long height;
    String blockId;
    ValidatorSet nextValidatorSet;
}
