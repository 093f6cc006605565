package com.whereq.gridx.analysis.python;

import java.util.List;
import java.util.Set;

/**
 * Recursive-descent check of one simple statement or compound header against
 * the Python 3 statement and expression grammar.
 * <p>
 * Nothing is built: each expression rule only reports what kind of node it
 * would have produced, which is enough to tell assignment and deletion
 * targets apart from values.
 */
final class PythonGrammar {

    private static final int MAX_NESTING = 200;

    private static final String[][] BINARY_LEVELS = {
        {"|"}, {"^"}, {"&"}, {"<<", ">>"}, {"+", "-"}, {"*", "/", "//", "%", "@"}};

    private static final Set<String> COMPARISON_OPS = Set.of("==", "!=", "<", ">", "<=", ">=");

    private static final Set<String> AUGMENTED_OPS = Set.of(
        "+=", "-=", "*=", "/=", "//=", "%=", "**=", "@=", "&=", "|=", "^=", ">>=", "<<=");

    private static final Set<String> EXPRESSION_START_OPS = Set.of("(", "[", "{", "-", "+", "~", "*", "...");

    private static final Set<String> EXPRESSION_START_KEYWORDS = Set.of(
        "True", "False", "None", "not", "lambda", "await");

    /**
     * What an expression would evaluate to, as far as assignment cares
     */
    enum Node {
        NAME, ATTRIBUTE, SUBSCRIPT, STARRED, SEQUENCE, LITERAL, CALL, EXPRESSION;

        boolean isTarget() {
            return this == NAME || this == ATTRIBUTE || this == SUBSCRIPT || this == STARRED || this == SEQUENCE;
        }

        boolean isSingleTarget() {
            return this == NAME || this == ATTRIBUTE || this == SUBSCRIPT;
        }

        String describe() {
            return switch (this) {
                case LITERAL -> "literal";
                case CALL -> "function call";
                default -> "expression";
            };
        }
    }

    private final List<Token> tokens;
    private int pos;
    private int nesting;

    private PythonGrammar(List<Token> tokens) {
        this.tokens = tokens;
    }

    static void checkSimpleStatement(List<Token> tokens) throws PythonSyntaxException {
        new PythonGrammar(tokens).simpleStatement();
    }

    /**
     * @param header the compound statement's tokens up to, not including, its colon
     */
    static void checkHeader(StatementKind kind, List<Token> header) throws PythonSyntaxException {
        new PythonGrammar(header).header(kind);
    }

    // statements

    private void simpleStatement() throws PythonSyntaxException {
        Token first = peek();
        if (first.isOp("@")) {
            pos++;
            namedExpression();
            end();
            return;
        }
        if (first.getType() == TokenType.NAME) {
            switch (first.getText()) {
                case "pass", "break", "continue" -> {
                    pos++;
                    end();
                    return;
                }
                case "return" -> {
                    pos++;
                    if (!atEnd()) {
                        starExpressions();
                    }
                    end();
                    return;
                }
                case "raise" -> {
                    pos++;
                    if (!atEnd()) {
                        expression();
                        if (acceptName("from")) {
                            expression();
                        }
                    }
                    end();
                    return;
                }
                case "global", "nonlocal" -> {
                    pos++;
                    do {
                        name();
                    } while (acceptOp(","));
                    end();
                    return;
                }
                case "assert" -> {
                    pos++;
                    expression();
                    if (acceptOp(",")) {
                        expression();
                    }
                    end();
                    return;
                }
                case "del" -> {
                    pos++;
                    Node targets = starExpressions();
                    if (!targets.isTarget() || targets == Node.STARRED) {
                        throw new PythonSyntaxException("cannot delete " + targets.describe(), first.getLine());
                    }
                    end();
                    return;
                }
                case "import" -> {
                    pos++;
                    do {
                        dottedName();
                        if (acceptName("as")) {
                            name();
                        }
                    } while (acceptOp(","));
                    end();
                    return;
                }
                case "from" -> {
                    importFrom();
                    return;
                }
                case "type" -> {
                    if (isTypeAlias()) {
                        typeAlias();
                        return;
                    }
                }
                default -> {
                }
            }
        }
        expressionStatement();
    }

    private void expressionStatement() throws PythonSyntaxException {
        Node value = atName("yield") ? yieldExpression() : starExpressions();
        if (atEnd()) {
            return;
        }
        Token op = peek();
        if (op.isOp("=")) {
            while (acceptOp("=")) {
                requireAssignable(value, op);
                value = atName("yield") ? yieldExpression() : starExpressions();
            }
        } else if (op.isOp(":")) {
            if (!value.isSingleTarget()) {
                throw new PythonSyntaxException("illegal target for annotation", op.getLine());
            }
            pos++;
            expression();
            if (acceptOp("=")) {
                if (atName("yield")) {
                    yieldExpression();
                } else {
                    starExpressions();
                }
            }
        } else if (op.getType() == TokenType.OP && AUGMENTED_OPS.contains(op.getText())) {
            if (!value.isSingleTarget()) {
                throw new PythonSyntaxException("'" + value.describe()
                    + "' is an illegal expression for augmented assignment", op.getLine());
            }
            pos++;
            if (atName("yield")) {
                yieldExpression();
            } else {
                starExpressions();
            }
        }
        end();
    }

    private static void requireAssignable(Node target, Token op) throws PythonSyntaxException {
        if (target == Node.STARRED) {
            throw new PythonSyntaxException("starred assignment target must be in a list or tuple", op.getLine());
        }
        if (!target.isTarget()) {
            throw new PythonSyntaxException("cannot assign to " + target.describe() + " here."
                + " Maybe you meant '==' instead of '='?", op.getLine());
        }
    }

    private void importFrom() throws PythonSyntaxException {
        pos++;
        int dots = 0;
        while (atOp(".") || atOp("...")) {
            pos++;
            dots++;
        }
        if (!atName("import") || dots == 0) {
            dottedName();
        }
        expectName("import");
        if (acceptOp("*")) {
            end();
            return;
        }
        boolean parenthesized = acceptOp("(");
        do {
            if (parenthesized && atOp(")")) {
                break;
            }
            name();
            if (acceptName("as")) {
                name();
            }
        } while (acceptOp(","));
        if (parenthesized) {
            expectOp(")");
        }
        end();
    }

    private boolean isTypeAlias() {
        return tokens.size() > 2 && isIdentifier(tokens.get(1))
            && (tokens.get(2).isOp("=") || tokens.get(2).isOp("["));
    }

    private void typeAlias() throws PythonSyntaxException {
        pos++;
        name();
        if (atOp("[")) {
            typeParameters();
        }
        expectOp("=");
        expression();
        end();
    }

    private void header(StatementKind kind) throws PythonSyntaxException {
        acceptName("async");
        pos++;
        switch (kind) {
            case IF, ELIF, WHILE -> namedExpression();
            case FOR -> {
                int line = line();
                Node target = targetList();
                if (!target.isTarget() || target == Node.STARRED) {
                    throw new PythonSyntaxException("cannot assign to " + target.describe(), line);
                }
                expectName("in");
                starExpressions();
            }
            case WITH -> withItems();
            case EXCEPT -> {
                boolean group = acceptOp("*");
                if (group || !atEnd()) {
                    expression();
                    if (acceptName("as")) {
                        name();
                    }
                }
            }
            case DEF -> {
                name();
                if (atOp("[")) {
                    typeParameters();
                }
                expectOp("(");
                parameters(true, ")");
                expectOp(")");
                if (acceptOp("->")) {
                    expression();
                }
            }
            case CLASS -> {
                name();
                if (atOp("[")) {
                    typeParameters();
                }
                if (acceptOp("(")) {
                    arguments();
                }
            }
            case MATCH -> {
                starNamedExpression();
                while (acceptOp(",")) {
                    if (atEnd()) {
                        break;
                    }
                    starNamedExpression();
                }
            }
            case CASE -> {
                patterns();
                if (acceptName("if")) {
                    namedExpression();
                }
            }
            default -> {
            }
        }
        end();
    }

    private void withItems() throws PythonSyntaxException {
        if (atOp("(") && matchingClose(pos) == tokens.size() - 1) {
            pos++;
            do {
                if (atOp(")")) {
                    break;
                }
                withItem();
            } while (acceptOp(","));
            expectOp(")");
            return;
        }
        do {
            withItem();
        } while (acceptOp(","));
    }

    private void withItem() throws PythonSyntaxException {
        expression();
        if (acceptName("as")) {
            int line = line();
            Node target = starTarget();
            if (!target.isTarget() || target == Node.STARRED) {
                throw new PythonSyntaxException("cannot assign to " + target.describe(), line);
            }
        }
    }

    private int matchingClose(int open) {
        int depth = 0;
        for (int i = open; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.isOp("(") || token.isOp("[") || token.isOp("{")) {
                depth++;
            } else if ((token.isOp(")") || token.isOp("]") || token.isOp("}")) && --depth == 0) {
                return i;
            }
        }
        return -1;
    }

    private void typeParameters() throws PythonSyntaxException {
        expectOp("[");
        do {
            if (atOp("]")) {
                break;
            }
            if (!acceptOp("**")) {
                acceptOp("*");
            }
            name();
            if (acceptOp(":")) {
                expression();
            }
            if (acceptOp("=")) {
                expression();
            }
        } while (acceptOp(","));
        expectOp("]");
    }

    /**
     * Parameter list of a def (with annotations) or a lambda, up to {@code close}
     */
    private void parameters(boolean annotated, String close) throws PythonSyntaxException {
        do {
            if (atOp(close)) {
                return;
            }
            if (acceptOp("/")) {
                continue;
            }
            if (acceptOp("**")) {
                name();
                annotation(annotated);
            } else if (acceptOp("*")) {
                if (!atOp(",") && !atOp(close)) {
                    name();
                    if (annotated && acceptOp(":")) {
                        acceptOp("*");
                        expression();
                    }
                }
            } else {
                name();
                annotation(annotated);
                if (acceptOp("=")) {
                    expression();
                }
            }
        } while (acceptOp(","));
    }

    private void annotation(boolean annotated) throws PythonSyntaxException {
        if (annotated && acceptOp(":")) {
            expression();
        }
    }

    // match patterns

    private void patterns() throws PythonSyntaxException {
        maybeStarPattern();
        while (acceptOp(",")) {
            if (atEnd() || atName("if")) {
                break;
            }
            maybeStarPattern();
        }
    }

    private void maybeStarPattern() throws PythonSyntaxException {
        if (acceptOp("*")) {
            name();
        } else {
            asPattern();
        }
    }

    private void asPattern() throws PythonSyntaxException {
        do {
            closedPattern();
        } while (acceptOp("|"));
        if (acceptName("as")) {
            name();
        }
    }

    private void closedPattern() throws PythonSyntaxException {
        Token token = peek();
        if (token == null) {
            throw invalid(null);
        }
        if (token.getType() == TokenType.NUMBER || token.getType() == TokenType.STRING || token.isOp("-")) {
            literalPattern();
            return;
        }
        if (token.isName("True") || token.isName("False") || token.isName("None")) {
            pos++;
            return;
        }
        if (isIdentifier(token)) {
            name();
            while (acceptOp(".")) {
                name();
            }
            if (acceptOp("(")) {
                do {
                    if (atOp(")")) {
                        break;
                    }
                    if (isIdentifier(peek()) && pos + 1 < tokens.size() && tokens.get(pos + 1).isOp("=")) {
                        pos += 2;
                    }
                    asPattern();
                } while (acceptOp(","));
                expectOp(")");
            }
            return;
        }
        if (token.isOp("(") || token.isOp("[")) {
            String close = token.isOp("(") ? ")" : "]";
            pos++;
            enter();
            do {
                if (atOp(close)) {
                    break;
                }
                maybeStarPattern();
            } while (acceptOp(","));
            expectOp(close);
            nesting--;
            return;
        }
        if (token.isOp("{")) {
            pos++;
            enter();
            do {
                if (atOp("}")) {
                    break;
                }
                if (acceptOp("**")) {
                    name();
                } else {
                    if (isIdentifier(peek())) {
                        name();
                        while (acceptOp(".")) {
                            name();
                        }
                    } else if (!acceptName("True") && !acceptName("False") && !acceptName("None")) {
                        literalPattern();
                    }
                    expectOp(":");
                    asPattern();
                }
            } while (acceptOp(","));
            expectOp("}");
            nesting--;
            return;
        }
        throw invalid(token);
    }

    private void literalPattern() throws PythonSyntaxException {
        if (!atEnd() && peek().getType() == TokenType.STRING) {
            while (!atEnd() && peek().getType() == TokenType.STRING) {
                pos++;
            }
            return;
        }
        acceptOp("-");
        expectNumber();
        if (acceptOp("+") || acceptOp("-")) {
            expectNumber();
        }
    }

    // expressions

    private Node starExpressions() throws PythonSyntaxException {
        Node first = starExpression();
        if (!atOp(",")) {
            return first;
        }
        Node sequence = first.isTarget() ? Node.SEQUENCE : first;
        while (acceptOp(",")) {
            if (atEnd() || !startsExpression(peek())) {
                break;
            }
            sequence = combine(sequence, starExpression());
        }
        return sequence;
    }

    private Node starExpression() throws PythonSyntaxException {
        if (acceptOp("*")) {
            return bitwiseOr().isTarget() ? Node.STARRED : Node.EXPRESSION;
        }
        return expression();
    }

    private Node starNamedExpression() throws PythonSyntaxException {
        if (acceptOp("*")) {
            return bitwiseOr().isTarget() ? Node.STARRED : Node.EXPRESSION;
        }
        return namedExpression();
    }

    private Node namedExpression() throws PythonSyntaxException {
        if (isIdentifier(peek()) && pos + 1 < tokens.size() && tokens.get(pos + 1).isOp(":=")) {
            pos += 2;
            expression();
            return Node.EXPRESSION;
        }
        return expression();
    }

    private Node expression() throws PythonSyntaxException {
        enter();
        try {
            if (acceptName("lambda")) {
                parameters(false, ":");
                expectOp(":");
                expression();
                return Node.EXPRESSION;
            }
            Node node = disjunction();
            if (acceptName("if")) {
                disjunction();
                expectName("else");
                expression();
                return Node.EXPRESSION;
            }
            return node;
        } finally {
            nesting--;
        }
    }

    private Node yieldExpression() throws PythonSyntaxException {
        expectName("yield");
        if (acceptName("from")) {
            expression();
        } else if (!atEnd() && startsExpression(peek())) {
            starExpressions();
        }
        return Node.EXPRESSION;
    }

    private Node disjunction() throws PythonSyntaxException {
        Node node = conjunction();
        while (acceptName("or")) {
            conjunction();
            node = Node.EXPRESSION;
        }
        return node;
    }

    private Node conjunction() throws PythonSyntaxException {
        Node node = inversion();
        while (acceptName("and")) {
            inversion();
            node = Node.EXPRESSION;
        }
        return node;
    }

    private Node inversion() throws PythonSyntaxException {
        if (acceptName("not")) {
            enter();
            inversion();
            nesting--;
            return Node.EXPRESSION;
        }
        return comparison();
    }

    private Node comparison() throws PythonSyntaxException {
        Node node = binary(0);
        while (!atEnd()) {
            Token token = peek();
            if (token.getType() == TokenType.OP && COMPARISON_OPS.contains(token.getText())) {
                pos++;
            } else if (token.isName("in")) {
                pos++;
            } else if (token.isName("not") && pos + 1 < tokens.size() && tokens.get(pos + 1).isName("in")) {
                pos += 2;
            } else if (token.isName("is")) {
                pos++;
                acceptName("not");
            } else {
                break;
            }
            binary(0);
            node = Node.EXPRESSION;
        }
        return node;
    }

    private Node bitwiseOr() throws PythonSyntaxException {
        return binary(0);
    }

    private Node binary(int level) throws PythonSyntaxException {
        if (level == BINARY_LEVELS.length) {
            return factor();
        }
        Node node = binary(level + 1);
        while (atAnyOp(BINARY_LEVELS[level])) {
            pos++;
            binary(level + 1);
            node = Node.EXPRESSION;
        }
        return node;
    }

    private Node factor() throws PythonSyntaxException {
        if (acceptOp("+") || acceptOp("-") || acceptOp("~")) {
            enter();
            factor();
            nesting--;
            return Node.EXPRESSION;
        }
        Node node = acceptName("await") ? awaited() : primary();
        if (acceptOp("**")) {
            enter();
            factor();
            nesting--;
            return Node.EXPRESSION;
        }
        return node;
    }

    private Node awaited() throws PythonSyntaxException {
        primary();
        return Node.EXPRESSION;
    }

    private Node primary() throws PythonSyntaxException {
        Node node = atom();
        while (!atEnd()) {
            if (acceptOp(".")) {
                name();
                node = Node.ATTRIBUTE;
            } else if (acceptOp("(")) {
                arguments();
                node = Node.CALL;
            } else if (acceptOp("[")) {
                slices();
                node = Node.SUBSCRIPT;
            } else {
                break;
            }
        }
        return node;
    }

    private Node atom() throws PythonSyntaxException {
        Token token = peek();
        if (token == null) {
            throw invalid(null);
        }
        switch (token.getType()) {
            case NUMBER -> {
                pos++;
                return Node.LITERAL;
            }
            case STRING -> {
                while (!atEnd() && peek().getType() == TokenType.STRING) {
                    pos++;
                }
                return Node.LITERAL;
            }
            case NAME -> {
                if (token.is("True") || token.is("False") || token.is("None")) {
                    pos++;
                    return Node.LITERAL;
                }
                name();
                return Node.NAME;
            }
            default -> {
            }
        }
        if (acceptOp("...")) {
            return Node.LITERAL;
        }
        if (!token.isOp("(") && !token.isOp("[") && !token.isOp("{")) {
            throw invalid(token);
        }
        pos++;
        enter();
        try {
            if (token.isOp("(")) {
                return parenthesized();
            }
            return token.isOp("[") ? list() : braced();
        } finally {
            nesting--;
        }
    }

    private Node parenthesized() throws PythonSyntaxException {
        if (acceptOp(")")) {
            return Node.SEQUENCE;
        }
        if (atName("yield")) {
            yieldExpression();
            expectOp(")");
            return Node.EXPRESSION;
        }
        Node first = starNamedExpression();
        if (atComprehension()) {
            comprehension();
            expectOp(")");
            return Node.EXPRESSION;
        }
        if (!atOp(",")) {
            expectOp(")");
            return first;
        }
        Node tuple = elements(first, ")");
        expectOp(")");
        return tuple;
    }

    private Node list() throws PythonSyntaxException {
        if (acceptOp("]")) {
            return Node.SEQUENCE;
        }
        Node first = starNamedExpression();
        if (atComprehension()) {
            comprehension();
            expectOp("]");
            return Node.EXPRESSION;
        }
        Node list = elements(first, "]");
        expectOp("]");
        return list;
    }

    /**
     * Dict or set display, after the opening brace
     */
    private Node braced() throws PythonSyntaxException {
        if (acceptOp("}")) {
            return Node.LITERAL;
        }
        boolean dict;
        if (acceptOp("**")) {
            bitwiseOr();
            dict = true;
        } else {
            starNamedExpression();
            dict = acceptOp(":");
            if (dict) {
                expression();
            }
        }
        if (atComprehension()) {
            comprehension();
            expectOp("}");
            return Node.EXPRESSION;
        }
        while (acceptOp(",")) {
            if (atOp("}")) {
                break;
            }
            if (!dict) {
                starNamedExpression();
            } else if (acceptOp("**")) {
                bitwiseOr();
            } else {
                expression();
                expectOp(":");
                expression();
            }
        }
        expectOp("}");
        return Node.LITERAL;
    }

    /**
     * Remaining comma-separated elements of a tuple or list display
     */
    private Node elements(Node first, String close) throws PythonSyntaxException {
        Node sequence = first.isTarget() ? Node.SEQUENCE : first;
        while (acceptOp(",")) {
            if (atOp(close)) {
                break;
            }
            sequence = combine(sequence, starNamedExpression());
        }
        return sequence;
    }

    private static Node combine(Node sequence, Node element) {
        if (sequence != Node.SEQUENCE) {
            return sequence;
        }
        return element.isTarget() ? Node.SEQUENCE : element;
    }

    private boolean atComprehension() {
        return atName("for") || (atName("async") && pos + 1 < tokens.size() && tokens.get(pos + 1).isName("for"));
    }

    private void comprehension() throws PythonSyntaxException {
        while (atComprehension()) {
            acceptName("async");
            pos++;
            int line = line();
            Node target = targetList();
            if (!target.isTarget() || target == Node.STARRED) {
                throw new PythonSyntaxException("cannot assign to " + target.describe(), line);
            }
            expectName("in");
            disjunction();
            while (acceptName("if")) {
                disjunction();
            }
        }
    }

    /**
     * Targets of a for clause; stops before "in"
     */
    private Node targetList() throws PythonSyntaxException {
        Node first = starTarget();
        if (!atOp(",")) {
            return first;
        }
        Node sequence = first.isTarget() ? Node.SEQUENCE : first;
        while (acceptOp(",")) {
            if (atEnd() || !startsExpression(peek())) {
                break;
            }
            sequence = combine(sequence, starTarget());
        }
        return sequence;
    }

    private Node starTarget() throws PythonSyntaxException {
        if (acceptOp("*")) {
            return bitwiseOr().isTarget() ? Node.STARRED : Node.EXPRESSION;
        }
        return bitwiseOr();
    }

    /**
     * Call arguments, after the opening parenthesis, through the closing one
     */
    private void arguments() throws PythonSyntaxException {
        do {
            if (atOp(")")) {
                break;
            }
            if (acceptOp("*") || acceptOp("**")) {
                expression();
            } else if (isIdentifier(peek()) && pos + 1 < tokens.size() && tokens.get(pos + 1).isOp("=")) {
                pos += 2;
                expression();
            } else {
                namedExpression();
                if (atComprehension()) {
                    comprehension();
                }
            }
        } while (acceptOp(","));
        expectOp(")");
    }

    /**
     * Subscript contents, after the opening bracket, through the closing one
     */
    private void slices() throws PythonSyntaxException {
        slice();
        while (acceptOp(",")) {
            if (atOp("]")) {
                break;
            }
            slice();
        }
        expectOp("]");
    }

    private void slice() throws PythonSyntaxException {
        if (acceptOp("*")) {
            bitwiseOr();
            return;
        }
        if (!atOp(":")) {
            namedExpression();
            if (!atOp(":")) {
                return;
            }
        }
        expectOp(":");
        if (!atOp(":") && !atOp(",") && !atOp("]")) {
            expression();
        }
        if (acceptOp(":") && !atOp(",") && !atOp("]")) {
            expression();
        }
    }

    // tokens

    private void enter() throws PythonSyntaxException {
        if (++nesting > MAX_NESTING) {
            throw new PythonSyntaxException("too many nested parentheses", line());
        }
    }

    private void name() throws PythonSyntaxException {
        Token token = peek();
        if (!isIdentifier(token)) {
            throw invalid(token);
        }
        pos++;
    }

    private void dottedName() throws PythonSyntaxException {
        name();
        while (acceptOp(".")) {
            name();
        }
    }

    private static boolean isIdentifier(Token token) {
        return token != null && token.getType() == TokenType.NAME && !PythonParser.KEYWORDS.contains(token.getText());
    }

    private static boolean startsExpression(Token token) {
        return switch (token.getType()) {
            case NUMBER, STRING -> true;
            case NAME -> isIdentifier(token) || EXPRESSION_START_KEYWORDS.contains(token.getText());
            case OP -> EXPRESSION_START_OPS.contains(token.getText());
        };
    }

    private void expectNumber() throws PythonSyntaxException {
        Token token = peek();
        if (token == null || token.getType() != TokenType.NUMBER) {
            throw invalid(token);
        }
        pos++;
    }

    private void expectOp(String op) throws PythonSyntaxException {
        if (!acceptOp(op)) {
            throw invalid(peek());
        }
    }

    private void expectName(String keyword) throws PythonSyntaxException {
        if (!acceptName(keyword)) {
            throw invalid(peek());
        }
    }

    private boolean acceptOp(String op) {
        if (atOp(op)) {
            pos++;
            return true;
        }
        return false;
    }

    private boolean acceptName(String keyword) {
        if (atName(keyword)) {
            pos++;
            return true;
        }
        return false;
    }

    private boolean atOp(String op) {
        return !atEnd() && tokens.get(pos).isOp(op);
    }

    private boolean atAnyOp(String[] ops) {
        for (String op : ops) {
            if (atOp(op)) {
                return true;
            }
        }
        return false;
    }

    private boolean atName(String keyword) {
        return !atEnd() && tokens.get(pos).isName(keyword);
    }

    private boolean atEnd() {
        return pos >= tokens.size();
    }

    /**
     * Current token, or null past the end
     */
    private Token peek() {
        return atEnd() ? null : tokens.get(pos);
    }

    private void end() throws PythonSyntaxException {
        if (!atEnd()) {
            throw invalid(peek());
        }
    }

    private PythonSyntaxException invalid(Token token) {
        return new PythonSyntaxException("invalid syntax", token != null ? token.getLine() : line());
    }

    /**
     * Line of the current token, or of the last one past the end
     */
    private int line() {
        return atEnd() ? tokens.get(tokens.size() - 1).getLine() : tokens.get(pos).getLine();
    }
}
