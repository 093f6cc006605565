package com.whereq.gridx.analysis.python;

import lombok.Getter;

/**
 * Raised when a submission cannot be parsed as Python source
 */
@Getter
public class PythonSyntaxException extends Exception {

    private final int line;

    public PythonSyntaxException(String message, int line) {
        super(message);
        this.line = line;
    }
}
