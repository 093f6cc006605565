package com.whereq.gridx.analysis.python;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Builds a statement tree from Python source.
 * <p>
 * Indentation blocks, clause order and compound headers are resolved here;
 * every simple statement and header is then checked against the full
 * statement and expression grammar by {@link PythonGrammar}. Only statements
 * are kept in the tree, expressions stay as token lists.
 */
public class PythonParser {

    static final Set<String> KEYWORDS = Set.of(
        "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class",
        "continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
        "if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise",
        "return", "try", "while", "with", "yield");

    private static final int MAX_INDENT_LEVELS = 100;

    private static final Set<String> SOFT_KEYWORDS = Set.of("match", "case", "type");

    private static final Set<String> LEADING_OPS = Set.of("(", "[", "{", "-", "+", "~", "*", "**", "@", "...");

    private static final Set<String> DANGLING_OPS = Set.of(
        "=", "+=", "-=", "*=", "/=", "//=", "%=", "**=", "@=", "&=", "|=", "^=", ">>=", "<<=",
        "+", "-", "*", "/", "//", "%", "**", "@", "&", "|", "^", "~", "<", ">", "<=", ">=",
        "==", "!=", "<<", ">>", ".", ":=", "->", ":");

    private static final Set<String> DANGLING_KEYWORDS = Set.of("and", "or", "not", "in", "is", "if", "else", "lambda");

    private static final Set<StatementKind> ELIF_FOLLOWS = EnumSet.of(StatementKind.IF, StatementKind.ELIF);
    private static final Set<StatementKind> ELSE_FOLLOWS = EnumSet.of(
        StatementKind.IF, StatementKind.ELIF, StatementKind.FOR, StatementKind.WHILE, StatementKind.EXCEPT);
    private static final Set<StatementKind> EXCEPT_FOLLOWS = EnumSet.of(StatementKind.TRY, StatementKind.EXCEPT);
    private static final Set<StatementKind> FINALLY_FOLLOWS = EnumSet.of(
        StatementKind.TRY, StatementKind.EXCEPT, StatementKind.ELSE);

    private static final class Block {
        final int indent;
        final List<Statement> statements;

        Block(int indent, List<Statement> statements) {
            this.indent = indent;
            this.statements = statements;
        }
    }

    public SyntaxTree parse(String source) throws PythonSyntaxException {
        List<LogicalLine> lines = PythonTokenizer.tokenize(source);
        List<Statement> module = new ArrayList<>();
        Deque<Block> blocks = new ArrayDeque<>();
        blocks.push(new Block(0, module));
        Statement awaitingBody = null;
        int lastLine = 1;

        for (LogicalLine logical : lines) {
            lastLine = logical.getLine();
            if (awaitingBody != null) {
                if (logical.getIndent() <= blocks.peek().indent) {
                    throw missingBlock(awaitingBody, logical.getLine());
                }
                if (blocks.size() > MAX_INDENT_LEVELS) {
                    throw new PythonSyntaxException("too many levels of indentation", logical.getLine());
                }
                blocks.push(new Block(logical.getIndent(), awaitingBody.getBody()));
                awaitingBody = null;
            } else if (logical.getIndent() > blocks.peek().indent) {
                throw new PythonSyntaxException("unexpected indent", logical.getLine());
            } else {
                while (logical.getIndent() < blocks.peek().indent) {
                    checkClosed(blocks.pop().statements, logical.getLine());
                }
                if (logical.getIndent() != blocks.peek().indent) {
                    throw new PythonSyntaxException("unindent does not match any outer indentation level",
                        logical.getLine());
                }
            }
            List<Statement> siblings = blocks.peek().statements;
            int before = siblings.size();
            awaitingBody = parseLine(logical, siblings);
            if (before > 0 && siblings.size() > before) {
                checkSuccessor(siblings.get(before - 1), siblings.get(before), logical.getLine());
            }
        }
        if (awaitingBody != null) {
            throw missingBlock(awaitingBody, lastLine + 1);
        }
        for (Block block : blocks) {
            checkClosed(block.statements, lastLine + 1);
        }
        return new SyntaxTree(module);
    }

    private static PythonSyntaxException missingBlock(Statement header, int line) {
        String keyword = header.getTokens().isEmpty() ? "compound" : header.getTokens().get(0).getText();
        if (keyword.equals("async") && header.getTokens().size() > 1) {
            keyword = header.getTokens().get(1).getText();
        }
        return new PythonSyntaxException("expected an indented block after '" + keyword
            + "' statement on line " + header.getLine(), line);
    }

    private static void checkClosed(List<Statement> statements, int line) throws PythonSyntaxException {
        if (!statements.isEmpty()) {
            checkSuccessor(statements.get(statements.size() - 1), null, line);
        }
    }

    /**
     * A try needs an except or finally clause after its body, and a decorator
     * needs a def, a class or another decorator
     *
     * @param next the following sibling, or null when the block ends
     */
    private static void checkSuccessor(Statement previous, Statement next, int line) throws PythonSyntaxException {
        if (previous.getKind() == StatementKind.TRY && (next == null
            || (next.getKind() != StatementKind.EXCEPT && next.getKind() != StatementKind.FINALLY))) {
            throw new PythonSyntaxException("expected 'except' or 'finally' block", line);
        }
        if (isDecorator(previous) && (next == null || !(isDecorator(next)
            || next.getKind() == StatementKind.DEF || next.getKind() == StatementKind.CLASS))) {
            throw new PythonSyntaxException("invalid syntax", line);
        }
    }

    private static boolean isDecorator(Statement statement) {
        return statement.getKind() == StatementKind.SIMPLE && statement.getTokens().get(0).isOp("@");
    }

    /**
     * Parses one logical line into {@code target}
     *
     * @return the compound statement still waiting for an indented body, or null
     */
    private Statement parseLine(LogicalLine logical, List<Statement> target) throws PythonSyntaxException {
        List<Token> tokens = logical.getTokens();
        checkJuxtaposition(tokens);
        Optional<StatementKind> compound = compoundKind(tokens);
        if (compound.isEmpty()) {
            target.addAll(parseSimpleStatements(tokens, logical.getLine()));
            return null;
        }

        StatementKind kind = compound.get();
        int colon = headerColon(tokens);
        if (colon < 0) {
            throw new PythonSyntaxException("expected ':'", tokens.get(tokens.size() - 1).getLine());
        }
        List<Token> header = tokens.subList(0, colon);
        validateHeader(kind, header, logical.getLine());
        PythonGrammar.checkHeader(kind, header);
        checkClauseOrder(kind, target, logical.getLine());

        Statement statement = new Statement(kind, logical.getLine(), List.copyOf(header));
        target.add(statement);

        List<Token> inline = tokens.subList(colon + 1, tokens.size());
        if (inline.isEmpty()) {
            return statement;
        }
        if (compoundKind(inline).isPresent()) {
            throw new PythonSyntaxException("invalid syntax", inline.get(0).getLine());
        }
        statement.getBody().addAll(parseSimpleStatements(inline, logical.getLine()));
        return null;
    }

    private static Optional<StatementKind> compoundKind(List<Token> tokens) {
        Token first = tokens.get(0);
        if (first.getType() != TokenType.NAME) {
            return Optional.empty();
        }
        String keyword = first.getText();
        if (keyword.equals("async") && tokens.size() > 1) {
            String next = tokens.get(1).getText();
            if (next.equals("def") || next.equals("for") || next.equals("with")) {
                return StatementKind.compound(next);
            }
            return Optional.empty();
        }
        if ((keyword.equals("match") || keyword.equals("case")) && isSoftCompound(tokens)) {
            return Optional.of(keyword.equals("match") ? StatementKind.MATCH : StatementKind.CASE);
        }
        return StatementKind.compound(keyword);
    }

    /**
     * "match"/"case" start a compound statement only when followed by a
     * subject and a header colon, e.g. "match x:" but not "match = 1"
     */
    private static boolean isSoftCompound(List<Token> tokens) {
        if (tokens.size() < 3 || !tokens.get(tokens.size() - 1).isOp(":")) {
            return false;
        }
        Token second = tokens.get(1);
        if (second.getType() == TokenType.OP) {
            return second.isOp("(") || second.isOp("[") || second.isOp("{") || second.isOp("-")
                || second.isOp("*");
        }
        return true;
    }

    /**
     * Index of the colon ending a compound header, skipping nested brackets and
     * lambda parameter lists; -1 when absent
     */
    private static int headerColon(List<Token> tokens) {
        int depth = 0;
        int lambdas = 0;
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.getType() == TokenType.OP) {
                switch (token.getText()) {
                    case "(", "[", "{" -> depth++;
                    case ")", "]", "}" -> depth--;
                    case ":" -> {
                        if (depth == 0) {
                            if (lambdas == 0) {
                                return i;
                            }
                            lambdas--;
                        }
                    }
                    default -> {
                    }
                }
            } else if (depth == 0 && token.isName("lambda")) {
                lambdas++;
            }
        }
        return -1;
    }

    private static void validateHeader(StatementKind kind, List<Token> header, int line) throws PythonSyntaxException {
        List<Token> rest = header.get(0).isName("async") ? header.subList(2, header.size()) : header.subList(1, header.size());
        switch (kind) {
            case ELSE, TRY, FINALLY -> {
                if (!rest.isEmpty()) {
                    throw new PythonSyntaxException("expected ':'", line);
                }
            }
            case IF, ELIF, WHILE, WITH, MATCH, CASE -> {
                if (rest.isEmpty()) {
                    throw new PythonSyntaxException("invalid syntax", line);
                }
                checkDangling(rest, line);
            }
            case FOR -> {
                int in = indexOfTopLevel(rest, "in");
                if (in <= 0 || in == rest.size() - 1) {
                    throw new PythonSyntaxException("invalid syntax", line);
                }
                checkDangling(rest, line);
            }
            case DEF -> {
                if (rest.size() < 3 || rest.get(0).getType() != TokenType.NAME
                    || KEYWORDS.contains(rest.get(0).getText()) || !rest.get(1).isOp("(")) {
                    throw new PythonSyntaxException("invalid syntax", line);
                }
            }
            case CLASS -> {
                if (rest.isEmpty() || rest.get(0).getType() != TokenType.NAME
                    || KEYWORDS.contains(rest.get(0).getText())) {
                    throw new PythonSyntaxException("invalid syntax", line);
                }
            }
            default -> {
            }
        }
    }

    private static int indexOfTopLevel(List<Token> tokens, String name) {
        int depth = 0;
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.isOp("(") || token.isOp("[") || token.isOp("{")) {
                depth++;
            } else if (token.isOp(")") || token.isOp("]") || token.isOp("}")) {
                depth--;
            } else if (depth == 0 && token.isName(name)) {
                return i;
            }
        }
        return -1;
    }

    private static void checkClauseOrder(StatementKind kind, List<Statement> siblings, int line)
        throws PythonSyntaxException {
        Set<StatementKind> allowed = switch (kind) {
            case ELIF -> ELIF_FOLLOWS;
            case ELSE -> ELSE_FOLLOWS;
            case EXCEPT -> EXCEPT_FOLLOWS;
            case FINALLY -> FINALLY_FOLLOWS;
            default -> null;
        };
        if (allowed == null) {
            return;
        }
        if (siblings.isEmpty() || !allowed.contains(siblings.get(siblings.size() - 1).getKind())) {
            throw new PythonSyntaxException("invalid syntax", line);
        }
    }

    private static List<Statement> parseSimpleStatements(List<Token> tokens, int line) throws PythonSyntaxException {
        List<Statement> statements = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i <= tokens.size(); i++) {
            boolean end = i == tokens.size();
            if (!end) {
                Token token = tokens.get(i);
                if (token.isOp("(") || token.isOp("[") || token.isOp("{")) {
                    depth++;
                } else if (token.isOp(")") || token.isOp("]") || token.isOp("}")) {
                    depth--;
                }
                if (!(depth == 0 && token.isOp(";"))) {
                    continue;
                }
            }
            List<Token> part = tokens.subList(start, i);
            if (part.isEmpty()) {
                if (!end || statements.isEmpty()) {
                    throw new PythonSyntaxException("invalid syntax", line);
                }
            } else {
                statements.add(simpleStatement(part));
            }
            start = i + 1;
        }
        return statements;
    }

    private static Statement simpleStatement(List<Token> tokens) throws PythonSyntaxException {
        Token first = tokens.get(0);
        if (first.getType() == TokenType.OP && !LEADING_OPS.contains(first.getText())) {
            throw new PythonSyntaxException("invalid syntax", first.getLine());
        }
        if (first.getType() == TokenType.NAME && StatementKind.compound(first.getText()).isPresent()) {
            throw new PythonSyntaxException("invalid syntax", first.getLine());
        }
        if (first.isName("in") || first.isName("is") || first.isName("and") || first.isName("or")
            || first.isName("as")) {
            throw new PythonSyntaxException("invalid syntax", first.getLine());
        }
        if (!first.isName("from")) {
            // "from m import *" ends in an operator
            checkDangling(tokens, first.getLine());
        }
        PythonGrammar.checkSimpleStatement(tokens);
        StatementKind kind = first.getType() == TokenType.NAME
            ? StatementKind.simple(first.getText())
            : StatementKind.SIMPLE;
        return new Statement(kind, first.getLine(), List.copyOf(tokens));
    }

    private static void checkDangling(List<Token> tokens, int line) throws PythonSyntaxException {
        Token last = tokens.get(tokens.size() - 1);
        boolean dangling = (last.getType() == TokenType.OP && DANGLING_OPS.contains(last.getText()))
            || (last.getType() == TokenType.NAME && DANGLING_KEYWORDS.contains(last.getText()));
        if (dangling) {
            throw new PythonSyntaxException("invalid syntax", last.getLine());
        }
    }

    /**
     * Two operands in a row ("print x", "int main", "1 2") are never valid
     */
    private static void checkJuxtaposition(List<Token> tokens) throws PythonSyntaxException {
        for (int i = 1; i < tokens.size(); i++) {
            Token previous = tokens.get(i - 1);
            Token token = tokens.get(i);
            if (!isOperand(previous) || !isOperand(token)) {
                continue;
            }
            if (previous.getType() == TokenType.STRING && token.getType() == TokenType.STRING) {
                continue;
            }
            if (isSoftKeyword(previous) || isSoftKeyword(token)) {
                continue;
            }
            String hint = previous.isName("print") || previous.isName("exec")
                ? "Missing parentheses in call to '" + previous.getText() + "'"
                : "invalid syntax. Perhaps you forgot a comma?";
            throw new PythonSyntaxException(hint, token.getLine());
        }
    }

    private static boolean isOperand(Token token) {
        return switch (token.getType()) {
            case NUMBER, STRING -> true;
            case NAME -> !KEYWORDS.contains(token.getText())
                || token.is("True") || token.is("False") || token.is("None");
            default -> false;
        };
    }

    private static boolean isSoftKeyword(Token token) {
        return token.getType() == TokenType.NAME && SOFT_KEYWORDS.contains(token.getText());
    }
}
