package com.bftchain.ledger;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import com.bftchain.app.BlockApplication;
import com.bftchain.app.BlockApplicationException;
import com.bftchain.model.Block;

import lombok.extern.slf4j.Slf4j;

/**
 * Builds blocks out of the transaction pool and appends committed blocks to
 * the chain.
 */
@Slf4j
public class LedgerApplication implements BlockApplication {
    private final TransactionPool pool;
    private final Blockchain chain;
    private final int maxBlockTransactions;

    public LedgerApplication(TransactionPool pool, Blockchain chain, int maxBlockTransactions) {
        if (maxBlockTransactions <= 0) {
            throw new IllegalArgumentException("maxBlockTransactions must be positive: " + maxBlockTransactions);
        }
        this.pool = pool;
        this.chain = chain;
        this.maxBlockTransactions = maxBlockTransactions;
    }

    @Override
    public Block createBlock(long height, String proposerId, String previousBlockId) {
        List<String> payloads = new ArrayList<>();
        for (Transaction tx : pool.reap(maxBlockTransactions)) {
            // may have been committed by another proposer's block meanwhile
            if (!chain.containsTransaction(tx.getId())) {
                payloads.add(tx.getPayload());
            }
        }
        log.debug("Creating block for height {} with {} transactions", height, payloads.size());
        return new Block(height, previousBlockId, proposerId, System.currentTimeMillis(), payloads);
    }

    @Override
    public boolean validateBlock(Block block) {
        long expectedHeight = chain.getHeight() + 1;
        if (block.getHeight() != expectedHeight) {
            log.debug("Block {} has height {}, expected {}", block.getBlockId(), block.getHeight(), expectedHeight);
            return false;
        }
        String tip = chain.getLatestBlock().map(Block::getBlockId).orElse(null);
        if (!Objects.equals(tip, block.getPreviousBlockId())) {
            log.debug("Block {} does not extend {}", block.getBlockId(), tip);
            return false;
        }
        List<String> txs = block.getTransactions();
        if (txs == null) {
            return false;
        }
        if (txs.size() > maxBlockTransactions) {
            log.debug("Block {} carries {} transactions, limit is {}", block.getBlockId(), txs.size(),
                    maxBlockTransactions);
            return false;
        }
        Set<String> seen = new HashSet<>();
        for (String payload : txs) {
            if (payload == null || payload.isEmpty()) {
                return false;
            }
            String id = Transaction.idOf(payload);
            if (!seen.add(id)) {
                log.debug("Block {} repeats transaction {}", block.getBlockId(), id);
                return false;
            }
            if (chain.containsTransaction(id)) {
                log.debug("Block {} replays committed transaction {}", block.getBlockId(), id);
                return false;
            }
        }
        return true;
    }

    @Override
    public void onCommit(long height, String blockId, Block block) throws BlockApplicationException {
        try {
            chain.append(block);
        } catch (IllegalStateException e) {
            throw new BlockApplicationException("Cannot append block " + blockId + " at height " + height, e);
        }
        List<String> ids = new ArrayList<>(block.getTransactions().size());
        for (String payload : block.getTransactions()) {
            ids.add(Transaction.idOf(payload));
        }
        int removed = pool.removeAll(ids);
        log.info("Applied block {} at height {}: {} transactions, {} pruned from pool", blockId, height,
                ids.size(), removed);
    }

    /**
     * Queues a client payload unless it is already on the chain.
     */
    public SubmitResult submit(String payload) {
        Transaction tx;
        try {
            tx = new Transaction(payload);
        } catch (IllegalArgumentException e) {
            return SubmitResult.rejected(null, e.getMessage());
        }
        if (chain.containsTransaction(tx.getId())) {
            return SubmitResult.rejected(tx.getId(), "Transaction already committed");
        }
        return pool.add(tx);
    }

    public TransactionPool getPool() {
        return pool;
    }

    public Blockchain getChain() {
        return chain;
    }
}
