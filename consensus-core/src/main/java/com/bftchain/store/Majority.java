package com.bftchain.store;

import lombok.Value;

/**
 * A block, or nil, backed by more than two thirds of the voting power.
 */
@Value
public class Majority {
    String blockId; // null when the quorum is for nil
    long power;

    public boolean isNil() {
        return blockId == null;
    }
}
