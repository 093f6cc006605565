package com.whereq.gridx.analysis.python;

import java.util.List;
import java.util.Locale;

/**
 * Recognizes loops whose exit condition can never become false.
 */
final class LoopConditions {

    private LoopConditions() {
    }

    /**
     * {@code while} with a constant truthy test, or {@code for} over an
     * endless iterator such as {@code itertools.count()}
     */
    static boolean isUnconditioned(Statement loop) {
        List<Token> header = loop.getTokens();
        int start = header.get(0).isName("async") ? 2 : 1;
        if (loop.getKind() == StatementKind.WHILE) {
            return isAlwaysTrue(header.subList(start, header.size()));
        }
        if (loop.getKind() == StatementKind.FOR) {
            return isEndlessIterable(header.subList(start, header.size()));
        }
        return false;
    }

    static boolean isAlwaysTrue(List<Token> expression) {
        List<Token> tokens = unwrap(expression);
        if (tokens.isEmpty()) {
            return false;
        }
        if (tokens.get(0).isName("not")) {
            return isAlwaysFalse(tokens.subList(1, tokens.size()));
        }
        if (tokens.size() != 1) {
            return false;
        }
        Token token = tokens.get(0);
        return token.isName("True") || (token.getType() == TokenType.NUMBER && !isZero(token.getText()));
    }

    static boolean isAlwaysFalse(List<Token> expression) {
        List<Token> tokens = unwrap(expression);
        if (tokens.isEmpty()) {
            return false;
        }
        if (tokens.get(0).isName("not")) {
            return isAlwaysTrue(tokens.subList(1, tokens.size()));
        }
        if (tokens.size() != 1) {
            return false;
        }
        Token token = tokens.get(0);
        return token.isName("False") || token.isName("None")
            || (token.getType() == TokenType.NUMBER && isZero(token.getText()));
    }

    private static boolean isEndlessIterable(List<Token> target) {
        int in = -1;
        for (int i = 0; i < target.size(); i++) {
            if (target.get(i).isName("in")) {
                in = i;
                break;
            }
        }
        if (in < 0) {
            return false;
        }
        StringBuilder iterable = new StringBuilder();
        for (Token token : target.subList(in + 1, target.size())) {
            iterable.append(token.getText());
        }
        String text = iterable.toString();
        return text.startsWith("itertools.count(")
            || text.startsWith("itertools.cycle(")
            || text.startsWith("count(")
            || text.startsWith("cycle(");
    }

    /**
     * Strips redundant parentheses enclosing the whole expression
     */
    private static List<Token> unwrap(List<Token> tokens) {
        List<Token> current = tokens;
        while (current.size() >= 2
            && current.get(0).isOp("(")
            && current.get(current.size() - 1).isOp(")")
            && closesAtEnd(current)) {
            current = current.subList(1, current.size() - 1);
        }
        return current;
    }

    private static boolean closesAtEnd(List<Token> tokens) {
        int depth = 0;
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.isOp("(") || token.isOp("[") || token.isOp("{")) {
                depth++;
            } else if (token.isOp(")") || token.isOp("]") || token.isOp("}")) {
                depth--;
                if (depth == 0 && i < tokens.size() - 1) {
                    return false;
                }
            }
        }
        return true;
    }

    private static boolean isZero(String literal) {
        String text = literal.toLowerCase(Locale.ROOT).replace("_", "");
        if (text.startsWith("0x") || text.startsWith("0o") || text.startsWith("0b")) {
            text = text.substring(2);
        } else {
            int exponent = text.indexOf('e');
            if (exponent >= 0) {
                text = text.substring(0, exponent);
            }
        }
        for (char c : text.toCharArray()) {
            if (Character.digit(c, 16) > 0) {
                return false;
            }
        }
        return true;
    }
}
