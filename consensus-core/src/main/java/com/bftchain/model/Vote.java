package com.bftchain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class Vote {
    private String validatorId;
    private String blockId; // null for a nil vote
    private long height;
    private int round;
    private VoteType type;
    private long timestamp;
    private byte[] signature;

    public static Vote unsigned(String validatorId, String blockId, long height, int round, VoteType type,
            long timestamp) {
        return new Vote(validatorId, blockId, height, round, type, timestamp, null);
    }

    public boolean isNil() {
        return blockId == null;
    }

    @Override
    public String toString() {
        return "Vote [" + type + " h=" + height + " r=" + round + " from=" + validatorId + " block="
                + (blockId == null ? "nil" : blockId) + "]";
    }
}
