package com.bftchain.model;

public enum VoteType {
    PREVOTE,
    PRECOMMIT
}
