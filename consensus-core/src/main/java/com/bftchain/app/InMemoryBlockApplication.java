package com.bftchain.app;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import com.bftchain.model.Block;

import lombok.extern.slf4j.Slf4j;

/**
 * Application that only records what was committed. Blocks carry a single
 * marker transaction so blocks of different rounds differ.
 */
@Slf4j
public class InMemoryBlockApplication implements BlockApplication {
    private final List<Block> committed = new CopyOnWriteArrayList<>();
    private volatile boolean failCommits = false;

    @Override
    public Block createBlock(long height, String proposerId, String previousBlockId) {
        List<String> txs = new ArrayList<>();
        txs.add("block-" + height + "-by-" + proposerId + "-" + System.nanoTime());
        return new Block(height, previousBlockId, proposerId, System.currentTimeMillis(), txs);
    }

    @Override
    public boolean validateBlock(Block block) {
        Block last = getLastCommitted();
        long expectedHeight = last == null ? 1 : last.getHeight() + 1;
        String expectedParent = last == null ? null : last.getBlockId();
        if (block.getHeight() != expectedHeight) {
            log.debug("Block {} has height {}, expected {}", block.getBlockId(), block.getHeight(), expectedHeight);
            return false;
        }
        if (expectedParent == null ? block.getPreviousBlockId() != null
                : !expectedParent.equals(block.getPreviousBlockId())) {
            log.debug("Block {} does not extend {}", block.getBlockId(), expectedParent);
            return false;
        }
        return true;
    }

    @Override
    public void onCommit(long height, String blockId, Block block) throws BlockApplicationException {
        if (failCommits) {
            throw new BlockApplicationException("Commits disabled at height " + height);
        }
        long expected = committed.size() + 1L;
        if (height != expected) {
            throw new BlockApplicationException("Out of order commit: got " + height + ", expected " + expected);
        }
        committed.add(block);
    }

    /**
     * Makes every following commit throw, to exercise the engine's retry path
     */
    public void setFailCommits(boolean failCommits) {
        this.failCommits = failCommits;
    }

    public List<Block> getCommitted() {
        return Collections.unmodifiableList(committed);
    }

    public Block getLastCommitted() {
        return committed.isEmpty() ? null : committed.get(committed.size() - 1);
    }
}
