package com.whereq.gridx.exception;

/**
 * Base class of the GridX error taxonomy
 */
public class GridxException extends RuntimeException {
    public GridxException(String message) {
        super(message);
    }

    public GridxException(String message, Throwable cause) {
        super(message, cause);
    }
}
