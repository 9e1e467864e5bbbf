package com.bftchain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class Proposal {
    private long height;
    private int round;
    private String proposerId;
    private String blockId;
    private Block block; // the payload blockId refers to
    private long timestamp;
    private byte[] signature;

    @Override
    public String toString() {
        return "Proposal [h=" + height + " r=" + round + " proposer=" + proposerId + " block=" + blockId + "]";
    }
}
