package com.whereq.gridx.exception;

import com.whereq.gridx.analysis.AnalysisReport;
import com.whereq.gridx.analysis.Severity;
import lombok.Getter;

/**
 * Exception thrown when static analysis found a high severity issue
 */
@Getter
public class AnalysisRejectedException extends GridxException {

    private final AnalysisReport report;

    public AnalysisRejectedException(AnalysisReport report) {
        super("Rejected by static analysis: " + report.count(Severity.HIGH)
            + " high severity issue(s)");
        this.report = report;
    }
}
