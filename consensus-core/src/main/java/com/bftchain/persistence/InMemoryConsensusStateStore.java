package com.bftchain.persistence;

import java.util.Optional;

public class InMemoryConsensusStateStore implements ConsensusStateStore {
    private volatile CommitRecord record;
    private volatile int saveCount;

    @Override
    public void initialize() {
        // Nothing to do
    }

    @Override
    public synchronized void save(CommitRecord record) {
        this.record = record;
        saveCount++;
    }

    @Override
    public Optional<CommitRecord> load() {
        return Optional.ofNullable(record);
    }

    @Override
    public void close() {
        // Nothing to do
    }

    public int getSaveCount() {
        return saveCount;
    }
}
