package com.bftchain.engine;

import com.bftchain.model.Block;

/**
 * Observer of engine progress. Called on the engine's event loop, so
 * implementations must return quickly.
 */
public interface ConsensusListener {

    default void onNewRound(long height, int round) {
    }

    default void onCommitted(long height, Block block) {
    }

    /**
     * The application refused a block that gathered a commit quorum. The
     * engine carries on with the next round of the same height.
     */
    default void onCommitFailed(long height, int round, Block block, Exception error) {
    }
}
