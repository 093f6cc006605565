package com.whereq.gridx.service;

import com.whereq.gridx.analysis.AnalysisReport;
import com.whereq.gridx.analysis.CodeIssue;
import com.whereq.gridx.analysis.IssueKind;
import com.whereq.gridx.analysis.Severity;
import com.whereq.gridx.service.AdmissionController.AdmissionDecision;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AdmissionControllerTest {

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final AdmissionController admissionController = new AdmissionController();

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(admissionController, "meterRegistry", meterRegistry);
        admissionController.initialize();
    }

    private static AnalysisReport report(Severity severity) {
        CodeIssue issue = CodeIssue.builder()
            .kind(IssueKind.INFINITE_LOOP)
            .severity(severity)
            .line(1)
            .message("loop")
            .build();
        return AnalysisReport.of("python", List.of(issue), List.of());
    }

    @Test
    void admitsWhenNothingHighWasFound() {
        assertThat(admissionController.decide(report(Severity.MEDIUM), false)).isEqualTo(AdmissionDecision.ADMIT);
        assertThat(meterRegistry.counter("gridx.admission.admitted").count()).isEqualTo(1.0);
    }

    @Test
    void rejectsHighSeverityUnlessOverridden() {
        assertThat(admissionController.decide(report(Severity.HIGH), false)).isEqualTo(AdmissionDecision.REJECT);
        assertThat(admissionController.decide(report(Severity.HIGH), true))
            .isEqualTo(AdmissionDecision.ADMIT_WITH_OVERRIDE);

        assertThat(meterRegistry.counter("gridx.admission.rejected").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("gridx.admission.overridden").count()).isEqualTo(1.0);
    }
}
