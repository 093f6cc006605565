package com.whereq.gridx.analysis.python;

import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Node of the statement tree. Compound statements keep their header tokens
 * (up to the colon) and a body; simple statements keep all their tokens.
 */
@Getter
public class Statement {

    private final StatementKind kind;
    private final int line;
    private final List<Token> tokens;
    private final List<Statement> body = new ArrayList<>();

    public Statement(StatementKind kind, int line, List<Token> tokens) {
        this.kind = kind;
        this.line = line;
        this.tokens = tokens;
    }

    public boolean isLoop() {
        return kind.isLoop();
    }

    /**
     * This statement and everything nested below it, depth first
     */
    public Stream<Statement> walk() {
        return Stream.concat(Stream.of(this), body.stream().flatMap(Statement::walk));
    }

    /**
     * Deepest chain of loops starting at this statement, counting itself
     */
    public int loopDepth() {
        int nested = body.stream().mapToInt(Statement::loopDepth).max().orElse(0);
        return isLoop() ? nested + 1 : nested;
    }

    public boolean containsBreak() {
        return body.stream().flatMap(Statement::walk).anyMatch(s -> s.getKind() == StatementKind.BREAK);
    }
}
