package com.whereq.gridx.analysis.python;

import com.whereq.gridx.analysis.AnalysisReport;
import com.whereq.gridx.analysis.CodeIssue;
import com.whereq.gridx.analysis.IssueKind;
import com.whereq.gridx.analysis.Severity;
import com.whereq.gridx.config.GridxProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class PythonCodeAnalyzerTest {

    private final PythonCodeAnalyzer analyzer = new PythonCodeAnalyzer(new GridxProperties());

    @Test
    void admitsPlainCode() {
        AnalysisReport report = analyzer.analyze("""
            def add(a, b):
                return a + b

            print(add(1, 2))
            """);

        assertThat(report.isShouldExecute()).isTrue();
        assertThat(report.getIssues()).isEmpty();
        assertThat(report.getSuggestions()).isEmpty();
        assertThat(report.getLanguage()).isEqualTo("python");
    }

    @Test
    void emptySubmissionIsAdmitted() {
        assertThat(analyzer.analyze("").isShouldExecute()).isTrue();
        assertThat(analyzer.analyze(null).isShouldExecute()).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "while True:\n    x = 1\n",
        "while 1:\n    pass\n",
        "while not False:\n    print('again')\n",
        "import itertools\nfor i in itertools.count():\n    print(i)\n",
        "while (True):\n    pass\n",
    })
    void rejectsUnconditionedLoopsWithoutExit(String code) {
        AnalysisReport report = analyzer.analyze(code);

        assertThat(report.isShouldExecute()).isFalse();
        assertThat(report.getIssues())
            .filteredOn(CodeIssue::isHigh)
            .isNotEmpty()
            .allSatisfy(issue -> assertThat(issue.getKind()).isEqualTo(IssueKind.INFINITE_LOOP));
        assertThat(report.getSuggestions())
            .contains("Consider using 'for i in range(max_iterations)' with a reasonable limit");
    }

    @Test
    void reportsBothLoopPassesForWhileTrue() {
        AnalysisReport report = analyzer.analyze("while True:\n    x = 1\n");

        assertThat(report.getIssues()).extracting(CodeIssue::getMessage).containsExactly(
            "Potential infinite loop detected with no break condition",
            "while True loop without break statement");
        assertThat(report.getIssues()).extracting(CodeIssue::getLine).containsOnly(1);
        assertThat(report.getSummary().getHighSeverity()).isEqualTo(2);
    }

    @Test
    void loopWithBreakIsOnlyAMediumFinding() {
        AnalysisReport report = analyzer.analyze("""
            count = 0
            while True:
                count += 1
                if count > 10:
                    break
            """);

        assertThat(report.isShouldExecute()).isTrue();
        assertThat(report.getIssues()).singleElement().satisfies(issue -> {
            assertThat(issue.getSeverity()).isEqualTo(Severity.MEDIUM);
            assertThat(issue.getLine()).isEqualTo(2);
            assertThat(issue.getMessage()).isEqualTo("Loop with 'while True' pattern detected (has break/return)");
        });
    }

    @Test
    void breakInCommentDoesNotCount() {
        AnalysisReport report = analyzer.analyze("while True:\n    x = 1  # break here later\n");

        assertThat(report.isShouldExecute()).isFalse();
    }

    @Test
    void commentedOutLoopIsIgnored() {
        AnalysisReport report = analyzer.analyze("# while True:\nx = 1\n");

        assertThat(report.getIssues()).isEmpty();
    }

    @Test
    void syntaxErrorYieldsExactlyOneIssue() {
        AnalysisReport report = analyzer.analyze("x = 1\nprint 'hello'\nwhile True:\n    pass\n");

        assertThat(report.isShouldExecute()).isFalse();
        assertThat(report.getIssues()).singleElement().satisfies(issue -> {
            assertThat(issue.getKind()).isEqualTo(IssueKind.SYNTAX_ERROR);
            assertThat(issue.getSeverity()).isEqualTo(Severity.HIGH);
            assertThat(issue.getLine()).isEqualTo(2);
            assertThat(issue.getMessage()).isEqualTo("Syntax error: Missing parentheses in call to 'print'");
            assertThat(issue.getSuggestion()).isEqualTo("Fix syntax errors before execution");
        });
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "x = = 1",
        "x = 1 +* 2",
        "1 = x",
        "x + 1 = 2",
        "import",
        "del",
        "from import x",
        "x = [1, 2,, 3]",
        "x = {1: }",
        "f(**)",
        "[i for i in]",
        "pass pass",
        "async x = 1",
        "try:\n    pass\n",
        "@cache\nx = 1\n",
    })
    void malformedStatementsAreRejected(String code) {
        AnalysisReport report = analyzer.analyze(code);

        assertThat(report.isShouldExecute()).isFalse();
        assertThat(report.getIssues()).singleElement().satisfies(issue -> {
            assertThat(issue.getKind()).isEqualTo(IssueKind.SYNTAX_ERROR);
            assertThat(issue.getSeverity()).isEqualTo(Severity.HIGH);
        });
    }

    @Test
    void windowsLineEndingsAreAccepted() {
        AnalysisReport report = analyzer.analyze("if x:\r\n    y = 1\r\n");

        assertThat(report.isShouldExecute()).isTrue();
    }

    @Test
    void recursionWithoutBaseCaseIsRejected() {
        AnalysisReport report = analyzer.analyze("""
            def forever(n):
                return forever(n + 1)
            """);

        assertThat(report.isShouldExecute()).isFalse();
        assertThat(report.getIssues()).singleElement().satisfies(issue -> {
            assertThat(issue.getMessage()).isEqualTo("Recursive function 'forever' has no visible base case");
            assertThat(issue.getLine()).isEqualTo(2);
        });
    }

    @Test
    void recursionWithBaseCaseIsAdmitted() {
        AnalysisReport report = analyzer.analyze("""
            def fact(n):
                if n <= 1:
                    return 1
                return n * fact(n - 1)

            print(fact(5))
            """);

        assertThat(report.isShouldExecute()).isTrue();
        assertThat(report.getIssues()).singleElement()
            .extracting(CodeIssue::getMessage)
            .isEqualTo("Recursive call to 'fact' detected (has base case)");
    }

    @Test
    void methodCallWithSameNameIsNotRecursion() {
        AnalysisReport report = analyzer.analyze("""
            def append(items, value):
                items.append(value)
            """);

        assertThat(report.getIssues()).isEmpty();
    }

    @Test
    void largeRangeIsAResourceFinding() {
        AnalysisReport report = analyzer.analyze("for i in range(10**7):\n    pass\n");

        assertThat(report.isShouldExecute()).isTrue();
        assertThat(report.getIssues()).singleElement().satisfies(issue -> {
            assertThat(issue.getKind()).isEqualTo(IssueKind.RESOURCE_HEAVY);
            assertThat(issue.getSeverity()).isEqualTo(Severity.MEDIUM);
            assertThat(issue.getMessage()).isEqualTo("Large iteration count (10000000) in range()");
        });
        assertThat(report.getSuggestions())
            .containsExactly("For large ranges, consider using generators or batch processing",
                "Add progress monitoring: if i % 1000 == 0: print(f'Progress: {i}')");
    }

    @Test
    void smallRangeIsNotReported() {
        assertThat(analyzer.analyze("for i in range(0, 1_000):\n    pass\n").getIssues()).isEmpty();
    }

    @Test
    void flagsIoAndProcessCalls() {
        AnalysisReport report = analyzer.analyze("""
            import requests, subprocess
            data = open("big.bin").read()
            page = requests.get("http://example.com")
            subprocess.run(["ls"])
            buffer = [0] * 10_000_000
            """);

        assertThat(report.isShouldExecute()).isTrue();
        assertThat(report.getIssues()).extracting(CodeIssue::getMessage).containsExactly(
            "Unbounded read() call",
            "Network request detected",
            "Subprocess invocation detected",
            "Large fixed-size allocation (10000000 elements)");
        assertThat(report.getIssues()).extracting(CodeIssue::getLine).containsExactly(2, 3, 4, 5);
    }

    @Test
    void deeplyNestedLoopsAreAWarning() {
        AnalysisReport report = analyzer.analyze("""
            for i in range(3):
                for j in range(3):
                    for k in range(3):
                        print(i, j, k)
            """);

        assertThat(report.isShouldExecute()).isTrue();
        assertThat(report.getIssues()).singleElement().satisfies(issue -> {
            assertThat(issue.getKind()).isEqualTo(IssueKind.WARNING);
            assertThat(issue.getMessage()).isEqualTo("Deeply nested loops (3 levels) detected");
            assertThat(issue.getLine()).isEqualTo(1);
        });
    }

    @Test
    void nestingThresholdIsConfigurable() {
        GridxProperties properties = new GridxProperties();
        properties.getAnalyzer().setMaxLoopNesting(1);
        PythonCodeAnalyzer strict = new PythonCodeAnalyzer(properties);

        AnalysisReport report = strict.analyze("for i in x:\n    for j in y:\n        pass\n");

        assertThat(report.getIssues()).extracting(CodeIssue::getMessage)
            .containsExactly("Deeply nested loops (2 levels) detected");
    }

    @Test
    void evaluatesIntegerLiteralProducts() {
        assertThat(PythonCodeAnalyzer.evaluate("10**6")).hasValue(1_000_000);
        assertThat(PythonCodeAnalyzer.evaluate("1_000 * 1_000")).hasValue(1_000_000);
        assertThat(PythonCodeAnalyzer.evaluate("n")).isEmpty();
        assertThat(PythonCodeAnalyzer.evaluate("10 + 5")).isEmpty();
    }

    @Test
    void stripCommentKeepsHashInsideStrings() {
        assertThat(PythonCodeAnalyzer.stripComment("x = '#' # note")).isEqualTo("x = '#' ");
        assertThat(PythonCodeAnalyzer.stripComment("# all comment")).isEmpty();
    }

    @Test
    void neverThrowsOnGarbage() {
        Random random = new Random(42);
        String alphabet = "abcxyz019 \t\n:()[]{}'\"#\\=+-*/.,;@!$?\u0000\u00e9";
        for (int round = 0; round < 500; round++) {
            StringBuilder code = new StringBuilder();
            int length = random.nextInt(80);
            for (int i = 0; i < length; i++) {
                code.append(alphabet.charAt(random.nextInt(alphabet.length())));
            }
            String source = code.toString();

            assertThatCode(() -> {
                AnalysisReport report = analyzer.analyze(source);
                if (report.getIssues().stream().anyMatch(issue -> issue.getKind() == IssueKind.SYNTAX_ERROR)) {
                    assertThat(report.getIssues()).hasSize(1);
                    assertThat(report.isShouldExecute()).isFalse();
                }
            }).as("analyze(%s)", source).doesNotThrowAnyException();
        }
    }

    @Test
    void nulCharacterIsASyntaxError() {
        AnalysisReport report = analyzer.analyze("x = 1\u0000");

        assertThat(report.getIssues()).singleElement()
            .extracting(CodeIssue::getMessage)
            .isEqualTo("Syntax error: invalid non-printable character U+0000");
    }
}
