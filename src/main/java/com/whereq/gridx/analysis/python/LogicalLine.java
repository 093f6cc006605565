package com.whereq.gridx.analysis.python;

import lombok.Value;

import java.util.List;

/**
 * One logical source line: physical lines joined by brackets or backslashes,
 * with its indentation width (tabs expand to multiples of 8)
 */
@Value
public class LogicalLine {
    int line;
    int indent;
    List<Token> tokens;
}
