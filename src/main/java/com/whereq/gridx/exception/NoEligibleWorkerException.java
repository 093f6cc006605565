package com.whereq.gridx.exception;

/**
 * Exception thrown when no registered worker is currently reachable
 */
public class NoEligibleWorkerException extends GridxException {
    public NoEligibleWorkerException() {
        super("No workers available");
    }
}
