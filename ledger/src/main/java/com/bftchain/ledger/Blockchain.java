package com.bftchain.ledger;

import java.util.Optional;

import com.bftchain.model.Block;

/**
 * Committed blocks, one per height starting at 1.
 */
public interface Blockchain {
    /**
     * Appends the block for the next height.
     *
     * @throws IllegalStateException if the block does not extend the current
     *                               tip
     */
    void append(Block block);

    Optional<Block> getBlock(long height);

    Optional<Block> getBlockById(String blockId);

    Optional<Block> getLatestBlock();

    /**
     * Height of the latest block, 0 for an empty chain
     */
    long getHeight();

    boolean containsTransaction(String transactionId);

    void addListener(ChainListener listener);

    void removeListener(ChainListener listener);
}
