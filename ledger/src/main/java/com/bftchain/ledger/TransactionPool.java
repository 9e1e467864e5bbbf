package com.bftchain.ledger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.extern.slf4j.Slf4j;

/**
 * Bounded FIFO of transactions waiting for a block. Transactions are keyed by
 * id, so resubmitting a pending payload is rejected.
 */
@Slf4j
public class TransactionPool {
    public static final int DEFAULT_CAPACITY = 10_000;

    private final int capacity;
    private final Map<String, Transaction> pending = new LinkedHashMap<>();

    public TransactionPool() {
        this(DEFAULT_CAPACITY);
    }

    public TransactionPool(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Pool capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    public synchronized SubmitResult add(Transaction tx) {
        if (tx == null) {
            return SubmitResult.rejected(null, "Transaction cannot be null");
        }
        if (pending.containsKey(tx.getId())) {
            return SubmitResult.rejected(tx.getId(), "Transaction already pending");
        }
        if (pending.size() >= capacity) {
            log.warn("Transaction pool full ({}), rejecting {}", capacity, tx.getId());
            return SubmitResult.rejected(tx.getId(), "Transaction pool is full");
        }
        pending.put(tx.getId(), tx);
        return SubmitResult.accepted(tx.getId());
    }

    /**
     * Oldest pending transactions, at most {@code max}. They stay in the pool
     * until {@link #removeAll(Collection)} is called for a committed block.
     */
    public synchronized List<Transaction> reap(int max) {
        List<Transaction> reaped = new ArrayList<>(Math.min(max, pending.size()));
        Iterator<Transaction> it = pending.values().iterator();
        while (it.hasNext() && reaped.size() < max) {
            reaped.add(it.next());
        }
        return reaped;
    }

    public synchronized int removeAll(Collection<String> ids) {
        int removed = 0;
        for (String id : ids) {
            if (pending.remove(id) != null) {
                removed++;
            }
        }
        return removed;
    }

    public synchronized boolean contains(String id) {
        return pending.containsKey(id);
    }

    public synchronized int size() {
        return pending.size();
    }

    public int getCapacity() {
        return capacity;
    }
}
