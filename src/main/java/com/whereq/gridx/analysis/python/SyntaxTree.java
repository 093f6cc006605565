package com.whereq.gridx.analysis.python;

import java.util.List;
import java.util.stream.Stream;

/**
 * Parsed module: the top level statements
 */
public class SyntaxTree {

    private final List<Statement> statements;

    public SyntaxTree(List<Statement> statements) {
        this.statements = List.copyOf(statements);
    }

    public List<Statement> getStatements() {
        return statements;
    }

    public Stream<Statement> walk() {
        return statements.stream().flatMap(Statement::walk);
    }
}
