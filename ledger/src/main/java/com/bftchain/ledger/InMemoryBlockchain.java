package com.bftchain.ledger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;

import com.bftchain.model.Block;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class InMemoryBlockchain implements Blockchain {

    private final List<Block> blocks = new ArrayList<>();
    private final Map<String, Block> blocksById = new HashMap<>();
    private final Set<String> transactionIds = new HashSet<>();
    private final Set<ChainListener> listeners = new CopyOnWriteArraySet<>();

    @Override
    public void append(Block block) {
        ChainEvent event;
        synchronized (this) {
            long expectedHeight = blocks.size() + 1L;
            if (block.getHeight() != expectedHeight) {
                throw new IllegalStateException(
                        "Block " + block.getBlockId() + " has height " + block.getHeight() + ", expected "
                                + expectedHeight);
            }
            String tip = blocks.isEmpty() ? null : blocks.get(blocks.size() - 1).getBlockId();
            if (!Objects.equals(tip, block.getPreviousBlockId())) {
                throw new IllegalStateException(
                        "Block " + block.getBlockId() + " links to " + block.getPreviousBlockId() + ", tip is " + tip);
            }
            blocks.add(block);
            blocksById.put(block.getBlockId(), block);
            for (String payload : block.getTransactions()) {
                transactionIds.add(Transaction.idOf(payload));
            }
            event = new ChainEvent(block.getHeight(), block.getBlockId(), block.getPreviousBlockId(),
                    block.getTransactions().size());
        }
        notifyListeners(event);
    }

    @Override
    public synchronized Optional<Block> getBlock(long height) {
        if (height < 1 || height > blocks.size()) {
            return Optional.empty();
        }
        return Optional.of(blocks.get((int) (height - 1)));
    }

    @Override
    public synchronized Optional<Block> getBlockById(String blockId) {
        return Optional.ofNullable(blocksById.get(blockId));
    }

    @Override
    public synchronized Optional<Block> getLatestBlock() {
        return blocks.isEmpty() ? Optional.empty() : Optional.of(blocks.get(blocks.size() - 1));
    }

    @Override
    public synchronized long getHeight() {
        return blocks.size();
    }

    @Override
    public synchronized boolean containsTransaction(String transactionId) {
        return transactionIds.contains(transactionId);
    }

    @Override
    public void addListener(ChainListener listener) {
        if (listener != null) {
            listeners.add(listener);
        }
    }

    @Override
    public void removeListener(ChainListener listener) {
        if (listener != null) {
            listeners.remove(listener);
        }
    }

    private void notifyListeners(ChainEvent event) {
        for (ChainListener listener : listeners) {
            try {
                listener.onBlockAppended(event);
            } catch (RuntimeException e) {
                log.warn("Chain listener {} failed on {}", listener, event, e);
            }
        }
    }
}
