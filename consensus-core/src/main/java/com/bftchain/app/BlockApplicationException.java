package com.bftchain.app;

public class BlockApplicationException extends Exception {

    public BlockApplicationException(String message) {
        super(message);
    }

    public BlockApplicationException(String message, Throwable cause) {
        super(message, cause);
    }
}
