package com.whereq.gridx.analysis.python;

import java.util.Map;
import java.util.Optional;

public enum StatementKind {
    // compound statements
    IF, ELIF, ELSE, WHILE, FOR, TRY, EXCEPT, FINALLY, WITH, DEF, CLASS, MATCH, CASE,
    // simple statements
    BREAK, CONTINUE, RETURN, RAISE, PASS, SIMPLE;

    private static final Map<String, StatementKind> COMPOUND_KEYWORDS = Map.ofEntries(
        Map.entry("if", IF),
        Map.entry("elif", ELIF),
        Map.entry("else", ELSE),
        Map.entry("while", WHILE),
        Map.entry("for", FOR),
        Map.entry("try", TRY),
        Map.entry("except", EXCEPT),
        Map.entry("finally", FINALLY),
        Map.entry("with", WITH),
        Map.entry("def", DEF),
        Map.entry("class", CLASS));

    private static final Map<String, StatementKind> SIMPLE_KEYWORDS = Map.of(
        "break", BREAK,
        "continue", CONTINUE,
        "return", RETURN,
        "raise", RAISE,
        "pass", PASS);

    public static Optional<StatementKind> compound(String keyword) {
        return Optional.ofNullable(COMPOUND_KEYWORDS.get(keyword));
    }

    public static StatementKind simple(String keyword) {
        return SIMPLE_KEYWORDS.getOrDefault(keyword, SIMPLE);
    }

    public boolean isLoop() {
        return this == WHILE || this == FOR;
    }
}
