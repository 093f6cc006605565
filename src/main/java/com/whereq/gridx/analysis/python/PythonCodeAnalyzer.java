package com.whereq.gridx.analysis.python;

import com.whereq.gridx.analysis.AnalysisReport;
import com.whereq.gridx.analysis.CodeAnalyzer;
import com.whereq.gridx.analysis.CodeIssue;
import com.whereq.gridx.analysis.IssueKind;
import com.whereq.gridx.analysis.Severity;
import com.whereq.gridx.config.GridxProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Static admission check for Python submissions.
 * <p>
 * Runs in four passes over the source: parse, a line scan for unconditioned
 * loop idioms and unguarded recursion, a line scan for resource heavy calls,
 * and a walk of the statement tree for deep nesting and unconditioned loops
 * without a break. The loop passes overlap, so one loop may be reported
 * twice. Code is admitted only when no high severity issue was found.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Component
public class PythonCodeAnalyzer implements CodeAnalyzer {

    public static final String LANGUAGE = "python";

    private static final List<Pattern> LOOP_PATTERNS = List.of(
        Pattern.compile("\\bwhile\\s+True\\s*:"),
        Pattern.compile("\\bwhile\\s+1\\s*:"),
        Pattern.compile("\\bwhile\\s+not\\s+False\\s*:"),
        Pattern.compile("\\bfor\\s+\\w+\\s+in\\s+itertools\\.count\\(\\)\\s*:"));

    private static final Pattern LOOP_ESCAPE = Pattern.compile("\\b(?:break|return)\\b");

    private static final Pattern RANGE_CALL = Pattern.compile("\\brange\\(([^()]*)\\)");
    private static final Pattern UNBOUNDED_READ = Pattern.compile("\\.read\\(\\s*\\)");
    private static final Pattern NETWORK_CALL = Pattern.compile(
        "\\brequests\\.(?:get|post|put|patch|delete|head|request)\\(|\\burllib\\.request\\b|\\burlopen\\(");
    private static final Pattern SUBPROCESS_CALL = Pattern.compile("\\bsubprocess\\.");
    private static final Pattern LIST_REPEAT = Pattern.compile("\\[[^\\[\\]]*\\]\\s*\\*\\s*([\\d_]+(?:\\s*\\*\\*?\\s*[\\d_]+)*)");
    private static final Pattern ARRAY_ALLOC = Pattern.compile(
        "\\b(?:numpy|np)\\.(?:zeros|ones|empty|full)\\(\\s*\\(?\\s*([\\d_]+(?:\\s*\\*\\*?\\s*[\\d_]+)*)");
    private static final Pattern BUFFER_ALLOC = Pattern.compile(
        "\\b(?:bytearray|bytes)\\(\\s*([\\d_]+(?:\\s*\\*\\*?\\s*[\\d_]+)*)\\s*\\)");
    private static final Pattern BOUND_EXPRESSION = Pattern.compile("[\\d_]+(?:\\s*\\*\\*?\\s*[\\d_]+)*");
    private static final Pattern FACTOR = Pattern.compile("(\\d+)(?:\\*\\*(\\d+))?");

    private static final String UNBOUNDED_LOOP_HINT_RANGE =
        "Consider using 'for i in range(max_iterations)' with a reasonable limit";
    private static final String UNBOUNDED_LOOP_HINT_COUNTER =
        "Add a counter variable and check it in the while condition";
    private static final String LARGE_RANGE_HINT_BATCH =
        "For large ranges, consider using generators or batch processing";
    private static final String LARGE_RANGE_HINT_PROGRESS =
        "Add progress monitoring: if i % 1000 == 0: print(f'Progress: {i}')";

    private final PythonParser parser = new PythonParser();
    private final GridxProperties.AnalyzerConfig config;

    public PythonCodeAnalyzer(GridxProperties properties) {
        this.config = properties.getAnalyzer();
    }

    @Override
    public String language() {
        return LANGUAGE;
    }

    @Override
    public AnalysisReport analyze(String code) {
        String source = code == null ? "" : code.replace("\r\n", "\n");

        SyntaxTree tree;
        try {
            tree = parser.parse(source);
        } catch (PythonSyntaxException e) {
            return syntaxError(e.getMessage(), e.getLine());
        } catch (RuntimeException e) {
            log.warn("Parser failed on submission, treating it as a syntax error", e);
            return syntaxError("invalid syntax", 0);
        }

        String[] lines = source.split("\n", -1);
        Set<String> suggestions = new LinkedHashSet<>();
        List<CodeIssue> issues = new ArrayList<>();
        issues.addAll(scanLoops(lines, suggestions));
        issues.addAll(scanRecursion(tree));
        issues.addAll(scanResources(lines, suggestions));
        issues.addAll(walkTree(tree, suggestions));

        AnalysisReport report = AnalysisReport.of(LANGUAGE, issues, new ArrayList<>(suggestions));
        log.debug("Analyzed {} line(s): {} issue(s), admitted={}",
            lines.length, issues.size(), report.isShouldExecute());
        return report;
    }

    private static AnalysisReport syntaxError(String message, int line) {
        CodeIssue issue = CodeIssue.builder()
            .kind(IssueKind.SYNTAX_ERROR)
            .severity(Severity.HIGH)
            .line(line)
            .message("Syntax error: " + message)
            .suggestion("Fix syntax errors before execution")
            .build();
        return AnalysisReport.of(LANGUAGE, List.of(issue), List.of());
    }

    // ----- line scan: unconditioned loops -----

    private List<CodeIssue> scanLoops(String[] lines, Set<String> suggestions) {
        List<CodeIssue> issues = new ArrayList<>();
        for (int i = 0; i < lines.length; i++) {
            String text = stripComment(lines[i]);
            for (Pattern pattern : LOOP_PATTERNS) {
                Matcher matcher = pattern.matcher(text);
                if (!matcher.find()) {
                    continue;
                }
                suggestions.add(UNBOUNDED_LOOP_HINT_RANGE);
                suggestions.add(UNBOUNDED_LOOP_HINT_COUNTER);

                StringBuilder body = new StringBuilder(text.substring(matcher.end()));
                int end = blockEnd(lines, i);
                for (int j = i + 1; j < end; j++) {
                    body.append('\n').append(stripComment(lines[j]));
                }
                boolean escapes = LOOP_ESCAPE.matcher(body).find();
                issues.add(CodeIssue.builder()
                    .kind(IssueKind.INFINITE_LOOP)
                    .severity(escapes ? Severity.MEDIUM : Severity.HIGH)
                    .line(i + 1)
                    .message(escapes
                        ? "Loop with 'while True' pattern detected (has break/return)"
                        : "Potential infinite loop detected with no break condition")
                    .suggestion(escapes
                        ? "Consider using a more explicit condition"
                        : "Add a break condition or use a different loop structure")
                    .build());
            }
        }
        return issues;
    }

    /**
     * Index of the first line after the block opened at {@code start}: the
     * next non-blank line indented no deeper than the header
     */
    private static int blockEnd(String[] lines, int start) {
        int headerIndent = indentOf(lines[start]);
        for (int i = start + 1; i < lines.length; i++) {
            String stripped = lines[i].strip();
            if (stripped.isEmpty() || stripped.startsWith("#")) {
                continue;
            }
            if (indentOf(lines[i]) <= headerIndent) {
                return i;
            }
        }
        return lines.length;
    }

    private static int indentOf(String line) {
        int width = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == ' ') {
                width++;
            } else if (c == '\t') {
                width = (width / 8 + 1) * 8;
            } else {
                break;
            }
        }
        return width;
    }

    /**
     * Drops a trailing comment, ignoring '#' inside single line string literals
     */
    static String stripComment(String line) {
        char quote = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '#') {
                return line.substring(0, i);
            }
        }
        return line;
    }

    // ----- recursion -----

    /**
     * A function that calls itself from its top level body is unbounded unless
     * an earlier statement can leave it first.
     */
    private List<CodeIssue> scanRecursion(SyntaxTree tree) {
        List<CodeIssue> issues = new ArrayList<>();
        tree.walk()
            .filter(statement -> statement.getKind() == StatementKind.DEF)
            .forEach(def -> checkRecursion(def).ifPresent(issues::add));
        return issues;
    }

    private Optional<CodeIssue> checkRecursion(Statement def) {
        List<Token> header = def.getTokens();
        int nameIndex = header.get(0).isName("async") ? 2 : 1;
        String name = header.get(nameIndex).getText();

        boolean baseCase = false;
        for (Statement statement : def.getBody()) {
            if (statement.getBody().isEmpty() && isSimple(statement) && callsItself(statement.getTokens(), name)) {
                boolean high = !baseCase;
                return Optional.of(CodeIssue.builder()
                    .kind(IssueKind.INFINITE_LOOP)
                    .severity(high ? Severity.HIGH : Severity.MEDIUM)
                    .line(statement.getLine())
                    .message(high
                        ? "Recursive function '" + name + "' has no visible base case"
                        : "Recursive call to '" + name + "' detected (has base case)")
                    .suggestion(high
                        ? "Add a base case that returns before the recursive call"
                        : "Make sure the recursion depth stays bounded")
                    .build());
            }
            baseCase |= statement.walk().anyMatch(s ->
                (s.getKind() == StatementKind.RETURN || s.getKind() == StatementKind.RAISE)
                    && !callsItself(s.getTokens(), name));
        }
        return Optional.empty();
    }

    private static boolean isSimple(Statement statement) {
        return switch (statement.getKind()) {
            case SIMPLE, RETURN, RAISE -> true;
            default -> false;
        };
    }

    private static boolean callsItself(List<Token> tokens, String name) {
        for (int i = 0; i + 1 < tokens.size(); i++) {
            if (!tokens.get(i).isName(name) || !tokens.get(i + 1).isOp("(")) {
                continue;
            }
            if (i == 0 || !tokens.get(i - 1).isOp(".")) {
                return true;
            }
            if (i >= 2 && tokens.get(i - 2).isName("self")) {
                return true;
            }
        }
        return false;
    }

    // ----- line scan: resources -----

    private List<CodeIssue> scanResources(String[] lines, Set<String> suggestions) {
        List<CodeIssue> issues = new ArrayList<>();
        for (int i = 0; i < lines.length; i++) {
            String text = stripComment(lines[i]);
            if (text.isBlank()) {
                continue;
            }
            int line = i + 1;

            Matcher range = RANGE_CALL.matcher(text);
            while (range.find()) {
                OptionalDouble bound = rangeBound(range.group(1));
                if (bound.isPresent() && bound.getAsDouble() > config.getLargeRangeThreshold()) {
                    suggestions.add(LARGE_RANGE_HINT_BATCH);
                    suggestions.add(LARGE_RANGE_HINT_PROGRESS);
                    issues.add(resourceIssue(line,
                        "Large iteration count (" + format(bound.getAsDouble()) + ") in range()",
                        "Consider adding progress monitoring or limits"));
                }
            }
            if (UNBOUNDED_READ.matcher(text).find()) {
                issues.add(resourceIssue(line, "Unbounded read() call",
                    "Read in chunks or pass a size limit to read()"));
            }
            if (NETWORK_CALL.matcher(text).find()) {
                issues.add(resourceIssue(line, "Network request detected",
                    "Set a timeout on network calls"));
            }
            if (SUBPROCESS_CALL.matcher(text).find()) {
                issues.add(resourceIssue(line, "Subprocess invocation detected",
                    "Make sure the child process is bounded by a timeout"));
            }
            for (Pattern allocation : List.of(LIST_REPEAT, ARRAY_ALLOC, BUFFER_ALLOC)) {
                Matcher matcher = allocation.matcher(text);
                while (matcher.find()) {
                    OptionalDouble size = evaluate(matcher.group(1));
                    if (size.isPresent() && size.getAsDouble() >= config.getLargeAllocationThreshold()) {
                        issues.add(resourceIssue(line,
                            "Large fixed-size allocation (" + format(size.getAsDouble()) + " elements)",
                            "Allocate incrementally or process the data in chunks"));
                    }
                }
            }
        }
        return issues;
    }

    private static CodeIssue resourceIssue(int line, String message, String suggestion) {
        return CodeIssue.builder()
            .kind(IssueKind.RESOURCE_HEAVY)
            .severity(Severity.MEDIUM)
            .line(line)
            .message(message)
            .suggestion(suggestion)
            .build();
    }

    /**
     * Iteration count of range(stop) or range(start, stop[, step]); the stop
     * argument is what matters for the literal forms that show up in practice
     */
    private static OptionalDouble rangeBound(String arguments) {
        String[] parts = arguments.split(",");
        String stop = parts.length >= 2 ? parts[1] : parts[0];
        return evaluate(stop.strip());
    }

    /**
     * Evaluates integer literal products such as "10**6", "1_000 * 1_000";
     * anything else is not a constant and yields empty
     */
    static OptionalDouble evaluate(String expression) {
        String compact = expression.replace("_", "").replaceAll("\\s+", "");
        if (compact.isEmpty() || !BOUND_EXPRESSION.matcher(compact).matches()) {
            return OptionalDouble.empty();
        }
        double value = 1;
        int index = 0;
        Matcher factor = FACTOR.matcher(compact);
        while (index < compact.length() && factor.find(index) && factor.start() == index) {
            double base = Double.parseDouble(factor.group(1));
            if (factor.group(2) != null) {
                base = Math.pow(base, Double.parseDouble(factor.group(2)));
            }
            value *= base;
            index = factor.end();
            if (index < compact.length() && compact.charAt(index) == '*') {
                index++;
            }
        }
        return index == compact.length() ? OptionalDouble.of(value) : OptionalDouble.empty();
    }

    private static String format(double value) {
        return value < 1e15 ? String.valueOf((long) value) : String.format("%.3g", value);
    }

    // ----- tree walk -----

    private List<CodeIssue> walkTree(SyntaxTree tree, Set<String> suggestions) {
        List<CodeIssue> issues = new ArrayList<>();
        tree.walk().filter(Statement::isLoop).forEach(loop -> {
            int depth = loop.loopDepth();
            if (depth > config.getMaxLoopNesting()) {
                issues.add(CodeIssue.builder()
                    .kind(IssueKind.WARNING)
                    .severity(Severity.MEDIUM)
                    .line(loop.getLine())
                    .message("Deeply nested loops (" + depth + " levels) detected")
                    .suggestion("Consider refactoring to reduce nesting")
                    .build());
            }
            if (LoopConditions.isUnconditioned(loop) && !loop.containsBreak()) {
                suggestions.add(UNBOUNDED_LOOP_HINT_RANGE);
                suggestions.add(UNBOUNDED_LOOP_HINT_COUNTER);
                issues.add(CodeIssue.builder()
                    .kind(IssueKind.INFINITE_LOOP)
                    .severity(Severity.HIGH)
                    .line(loop.getLine())
                    .message("while True loop without break statement")
                    .suggestion("Add break condition to prevent infinite loop")
                    .build());
            }
        });
        return issues;
    }
}
