package com.bftchain.app;

import com.bftchain.model.Block;

/**
 * The application whose blocks consensus orders. Called from the consensus
 * event loop only.
 */
public interface BlockApplication {
    /**
     * Builds a fresh block for a round this node proposes in
     *
     * @param height          height of the block
     * @param proposerId      local validator id
     * @param previousBlockId id of the block committed at height - 1, null at
     *                        height 1
     */
    Block createBlock(long height, String proposerId, String previousBlockId);

    /**
     * Application level validity of a proposed block. A block that fails gets
     * a nil prevote.
     */
    boolean validateBlock(Block block);

    /**
     * Called exactly once per height, in increasing height order, when a
     * block gathered 2/3+ precommits
     *
     * @throws BlockApplicationException if the block could not be applied; the
     *                                   engine retries the height in a new round
     */
    void onCommit(long height, String blockId, Block block) throws BlockApplicationException;
}
