package com.bftchain.persistence;

import java.io.IOException;
import java.util.Optional;

public interface ConsensusStateStore {
    /**
     * Initializes the store, creating directories and files as needed
     *
     * @throws IOException if an I/O error occurs
     */
    void initialize() throws IOException;

    /**
     * Atomically replaces the persisted commit record. Either the old or the
     * new record is visible after a crash, never a mix.
     *
     * @param record the record to save
     * @throws IOException if an I/O error occurs
     */
    void save(CommitRecord record) throws IOException;

    /**
     * Loads the last saved record
     *
     * @return the record, or empty if nothing was ever committed
     * @throws IOException             if an I/O error occurs
     * @throws CorruptedStateException if a record exists but cannot be parsed
     */
    Optional<CommitRecord> load() throws IOException;

    /**
     * Cleans up resources used by the store
     *
     * @throws IOException if an I/O error occurs
     */
    void close() throws IOException;
}
