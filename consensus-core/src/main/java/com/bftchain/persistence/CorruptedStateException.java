package com.bftchain.persistence;

/**
 * Persisted consensus state exists but cannot be read back. Starting from it
 * would risk deciding an already committed height again, so this is fatal.
 */
public class CorruptedStateException extends RuntimeException {

    public CorruptedStateException(String message) {
        super(message);
    }

    public CorruptedStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
