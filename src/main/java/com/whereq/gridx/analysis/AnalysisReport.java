package com.whereq.gridx.analysis;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Admission verdict of a static analysis run.
 * Execution is admitted only when no high severity issue was found.
 */
@Value
@Builder
public class AnalysisReport {

    String language;

    boolean shouldExecute;

    @Singular
    List<CodeIssue> issues;

    @Singular
    List<String> suggestions;

    public Summary getSummary() {
        return new Summary(
            issues.size(),
            count(Severity.HIGH),
            count(Severity.MEDIUM),
            count(Severity.LOW));
    }

    public long count(Severity severity) {
        return issues.stream().filter(issue -> issue.getSeverity() == severity).count();
    }

    public static AnalysisReport of(String language, List<CodeIssue> issues, List<String> suggestions) {
        boolean admitted = issues.stream().noneMatch(CodeIssue::isHigh);
        return AnalysisReport.builder()
            .language(language)
            .shouldExecute(admitted)
            .issues(issues)
            .suggestions(suggestions)
            .build();
    }

    @Value
    public static class Summary {
        long totalIssues;
        long highSeverity;
        long mediumSeverity;
        long lowSeverity;
    }
}
