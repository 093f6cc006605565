package com.whereq.gridx.exception;

/**
 * Exception thrown when a named worker is not registered
 */
public class WorkerNotFoundException extends GridxException {
    public WorkerNotFoundException(String name) {
        super("Worker '" + name + "' not found");
    }
}
