package com.whereq.gridx.analysis.python;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Splits Python source into logical lines of tokens.
 * Comments, blank lines and line continuations are consumed here; bracket
 * balance, string termination, literal shape and character validity are
 * checked here as well.
 */
public class PythonTokenizer {

    private static final Set<String> THREE_CHAR_OPS = Set.of("**=", "//=", ">>=", "<<=", "...");

    private static final Set<String> TWO_CHAR_OPS = Set.of(
        "**", "//", "<<", ">>", "<=", ">=", "==", "!=", "->", ":=",
        "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "@=");

    private static final int MAX_NESTED_BRACKETS = 200;

    private static final String ONE_CHAR_OPS = "+-*/%@&|^~<>()[]{},:;.=";

    private static final Set<String> STRING_PREFIXES = Set.of(
        "r", "u", "b", "f", "br", "rb", "fr", "rf");

    private final String source;
    private final List<LogicalLine> lines = new ArrayList<>();
    private final Deque<Token> brackets = new ArrayDeque<>();

    private int pos;
    private int line = 1;
    private boolean atLineStart = true;
    private int currentIndent;
    private int currentLine;
    private List<Token> current = new ArrayList<>();

    private PythonTokenizer(String source) {
        this.source = source;
    }

    public static List<LogicalLine> tokenize(String source) throws PythonSyntaxException {
        return new PythonTokenizer(source).run();
    }

    private List<LogicalLine> run() throws PythonSyntaxException {
        int length = source.length();
        while (pos < length) {
            if (atLineStart && brackets.isEmpty()) {
                readIndentation();
                continue;
            }
            char c = source.charAt(pos);
            if (c == ' ' || c == '\t' || c == '\f' || c == '\r') {
                pos++;
            } else if (c == '\n') {
                pos++;
                if (brackets.isEmpty()) {
                    endLogicalLine();
                    atLineStart = true;
                }
                line++;
            } else if (c == '#') {
                skipComment();
            } else if (c == '\\') {
                readContinuation();
            } else if (c == '"' || c == '\'') {
                readString(pos);
            } else if (Character.isDigit(c) || (c == '.' && pos + 1 < length && Character.isDigit(source.charAt(pos + 1)))) {
                readNumber();
            } else if (c == '_' || Character.isUnicodeIdentifierStart(c)) {
                readNameOrPrefixedString();
            } else {
                readOperator(c);
            }
        }
        if (!brackets.isEmpty()) {
            Token open = brackets.peek();
            throw new PythonSyntaxException("'" + open.getText() + "' was never closed", open.getLine());
        }
        endLogicalLine();
        return lines;
    }

    private void readIndentation() {
        int width = 0;
        int length = source.length();
        while (pos < length) {
            char c = source.charAt(pos);
            if (c == ' ') {
                width++;
            } else if (c == '\t') {
                width = (width / 8 + 1) * 8;
            } else if (c == '\f') {
                width = 0;
            } else {
                break;
            }
            pos++;
        }
        if (pos >= length) {
            return;
        }
        char c = source.charAt(pos);
        if (c == '#') {
            skipComment();
            return;
        }
        if (c == '\n' || c == '\r') {
            if (c == '\n') {
                line++;
            }
            pos++;
            return;
        }
        currentIndent = width;
        currentLine = line;
        atLineStart = false;
    }

    private void skipComment() {
        while (pos < source.length() && source.charAt(pos) != '\n') {
            pos++;
        }
    }

    private void readContinuation() throws PythonSyntaxException {
        int next = pos + 1;
        if (next < source.length() && source.charAt(next) == '\r') {
            next++;
        }
        if (next >= source.length()) {
            throw new PythonSyntaxException("unexpected EOF while parsing", line);
        }
        if (source.charAt(next) != '\n') {
            throw new PythonSyntaxException("unexpected character after line continuation character", line);
        }
        pos = next + 1;
        line++;
    }

    private void readNameOrPrefixedString() throws PythonSyntaxException {
        int start = pos;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '_' || Character.isUnicodeIdentifierPart(c)) {
                pos++;
            } else {
                break;
            }
        }
        String name = source.substring(start, pos);
        if (pos < source.length()
            && (source.charAt(pos) == '"' || source.charAt(pos) == '\'')
            && STRING_PREFIXES.contains(name.toLowerCase(Locale.ROOT))) {
            readString(start);
            return;
        }
        add(TokenType.NAME, name, line);
    }

    /**
     * Reads a string literal whose quote starts at {@code pos}; {@code start}
     * points at the prefix, if any
     */
    private void readString(int start) throws PythonSyntaxException {
        int startLine = line;
        int length = source.length();
        char quote = source.charAt(pos);
        boolean triple = pos + 2 < length
            && source.charAt(pos + 1) == quote
            && source.charAt(pos + 2) == quote;
        pos += triple ? 3 : 1;
        while (true) {
            if (pos >= length) {
                if (triple) {
                    throw new PythonSyntaxException(
                        "unterminated triple-quoted string literal (detected at line " + line + ")", startLine);
                }
                throw new PythonSyntaxException(
                    "unterminated string literal (detected at line " + line + ")", startLine);
            }
            char c = source.charAt(pos);
            if (c == '\\') {
                if (pos + 1 < length && source.charAt(pos + 1) == '\n') {
                    line++;
                }
                pos += 2;
            } else if (c == '\n') {
                if (!triple) {
                    throw new PythonSyntaxException(
                        "unterminated string literal (detected at line " + line + ")", startLine);
                }
                line++;
                pos++;
            } else if (c == quote) {
                if (!triple) {
                    pos++;
                    break;
                }
                if (pos + 2 < length && source.charAt(pos + 1) == quote && source.charAt(pos + 2) == quote) {
                    pos += 3;
                    break;
                }
                pos++;
            } else {
                pos++;
            }
        }
        add(TokenType.STRING, source.substring(start, Math.min(pos, length)), startLine);
    }

    private void readNumber() throws PythonSyntaxException {
        int start = pos;
        int length = source.length();
        char first = source.charAt(pos);
        if (first == '0' && pos + 1 < length && "xXoObB".indexOf(source.charAt(pos + 1)) >= 0) {
            pos += 2;
            while (pos < length && (Character.digit(source.charAt(pos), 16) >= 0 || source.charAt(pos) == '_')) {
                pos++;
            }
        } else {
            consumeDigits();
            if (pos < length && source.charAt(pos) == '.') {
                pos++;
                consumeDigits();
            }
            if (pos < length && (source.charAt(pos) == 'e' || source.charAt(pos) == 'E')) {
                pos++;
                if (pos < length && (source.charAt(pos) == '+' || source.charAt(pos) == '-')) {
                    pos++;
                }
                int exponentStart = pos;
                consumeDigits();
                if (exponentStart == pos) {
                    throw new PythonSyntaxException("invalid decimal literal", line);
                }
            }
            if (pos < length && (source.charAt(pos) == 'j' || source.charAt(pos) == 'J')) {
                pos++;
            }
        }
        if (pos < length) {
            char next = source.charAt(pos);
            if (next == '_' || Character.isUnicodeIdentifierPart(next) && !Character.isIdentifierIgnorable(next)) {
                throw new PythonSyntaxException("invalid decimal literal", line);
            }
        }
        add(TokenType.NUMBER, source.substring(start, pos), line);
    }

    private void consumeDigits() {
        while (pos < source.length() && (Character.isDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
            pos++;
        }
    }

    private void readOperator(char c) throws PythonSyntaxException {
        String op = null;
        if (pos + 3 <= source.length() && THREE_CHAR_OPS.contains(source.substring(pos, pos + 3))) {
            op = source.substring(pos, pos + 3);
        } else if (pos + 2 <= source.length() && TWO_CHAR_OPS.contains(source.substring(pos, pos + 2))) {
            op = source.substring(pos, pos + 2);
        } else if (ONE_CHAR_OPS.indexOf(c) >= 0) {
            op = String.valueOf(c);
        }
        if (op == null) {
            throw invalidCharacter(c);
        }
        Token token = new Token(TokenType.OP, op, line);
        trackBracket(token);
        current.add(token);
        pos += op.length();
    }

    private void trackBracket(Token token) throws PythonSyntaxException {
        String text = token.getText();
        if (text.equals("(") || text.equals("[") || text.equals("{")) {
            if (brackets.size() >= MAX_NESTED_BRACKETS) {
                throw new PythonSyntaxException("too many nested parentheses", token.getLine());
            }
            brackets.push(token);
            return;
        }
        if (!text.equals(")") && !text.equals("]") && !text.equals("}")) {
            return;
        }
        if (brackets.isEmpty()) {
            throw new PythonSyntaxException("unmatched '" + text + "'", token.getLine());
        }
        Token open = brackets.pop();
        if (!closes(open.getText(), text)) {
            String message = "closing parenthesis '" + text + "' does not match opening parenthesis '"
                + open.getText() + "'";
            if (open.getLine() != token.getLine()) {
                message += " on line " + open.getLine();
            }
            throw new PythonSyntaxException(message, token.getLine());
        }
    }

    private static boolean closes(String open, String close) {
        return (open.equals("(") && close.equals(")"))
            || (open.equals("[") && close.equals("]"))
            || (open.equals("{") && close.equals("}"));
    }

    private PythonSyntaxException invalidCharacter(char c) {
        if (Character.isISOControl(c) || !Character.isDefined(c) || Character.getType(c) == Character.FORMAT) {
            return new PythonSyntaxException(
                String.format("invalid non-printable character U+%04X", (int) c), line);
        }
        return new PythonSyntaxException(
            String.format("invalid character '%c' (U+%04X)", c, (int) c), line);
    }

    private void add(TokenType type, String text, int tokenLine) {
        current.add(new Token(type, text, tokenLine));
    }

    private void endLogicalLine() {
        if (!current.isEmpty()) {
            lines.add(new LogicalLine(currentLine, currentIndent, List.copyOf(current)));
            current = new ArrayList<>();
        }
    }
}
