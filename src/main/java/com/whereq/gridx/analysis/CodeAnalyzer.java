package com.whereq.gridx.analysis;

/**
 * Static admission check for one source language.
 * Implementations never throw for malformed input: unparsable text yields a
 * single high severity syntax error and a rejecting verdict.
 */
public interface CodeAnalyzer {

    /**
     * Language key this analyzer handles, e.g. "python"
     */
    String language();

    /**
     * Analyze a submission
     *
     * @param code source text, possibly garbage
     * @return verdict with ordered issues
     */
    AnalysisReport analyze(String code);
}
