package com.bftchain.state;

import com.bftchain.model.Block;

import lombok.Data;

/**
 * Mutable state of one engine. Written only by the engine's event loop;
 * fields are volatile so status queries from other threads see recent values.
 */
@Data
public class ConsensusState {
    private volatile long height = 1;
    private volatile int round = 0;
    private volatile Step step = Step.PROPOSE;

    // block this validator precommitted and is bound to at this height
    private volatile Block lockedBlock = null;
    private volatile int lockedRound = -1;

    // latest block seen with a 2/3+ prevote quorum at this height
    private volatile Block validBlock = null;
    private volatile int validRound = -1;

    private volatile long lastCommittedHeight = 0;
    private volatile String lastCommittedBlockId = null;

    public String getLockedBlockId() {
        Block block = lockedBlock;
        return block == null ? null : block.getBlockId();
    }

    public String getValidBlockId() {
        Block block = validBlock;
        return block == null ? null : block.getBlockId();
    }

    /**
     * Resets the per-height fields for a new height.
     */
    public void startHeight(long newHeight) {
        height = newHeight;
        round = 0;
        step = Step.PROPOSE;
        lockedBlock = null;
        lockedRound = -1;
        validBlock = null;
        validRound = -1;
    }
}
