package com.whereq.gridx.analysis.python;

public enum TokenType {
    NAME,
    NUMBER,
    STRING,
    OP
}
