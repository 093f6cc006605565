package com.whereq.gridx.analysis.python;

import lombok.Value;

@Value
public class Token {
    TokenType type;
    String text;
    int line;

    public boolean is(String value) {
        return text.equals(value);
    }

    public boolean isOp(String value) {
        return type == TokenType.OP && text.equals(value);
    }

    public boolean isName(String value) {
        return type == TokenType.NAME && text.equals(value);
    }

    @Override
    public String toString() {
        return text;
    }
}
