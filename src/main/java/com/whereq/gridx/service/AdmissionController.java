package com.whereq.gridx.service;

import com.whereq.gridx.analysis.AnalysisReport;
import com.whereq.gridx.analysis.Severity;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;

/**
 * Admission control for code submissions
 * Decides whether a submission may reach a worker based on its static analysis
 */
@Slf4j
@Service
public class AdmissionController {

    @Autowired
    private MeterRegistry meterRegistry;

    private Counter admittedCounter;
    private Counter overriddenCounter;
    private Counter rejectedCounter;

    @PostConstruct
    public void initialize() {
        admittedCounter = Counter.builder("gridx.admission.admitted")
            .description("Number of submissions admitted by static analysis")
            .register(meterRegistry);

        overriddenCounter = Counter.builder("gridx.admission.overridden")
            .description("Number of risky submissions admitted on caller override")
            .register(meterRegistry);

        rejectedCounter = Counter.builder("gridx.admission.rejected")
            .description("Number of submissions rejected by static analysis")
            .register(meterRegistry);
    }

    /**
     * Decide on a submission
     *
     * @param report static analysis of the submission
     * @param allowRisky caller accepts high severity findings
     * @return admission decision
     */
    public AdmissionDecision decide(AnalysisReport report, boolean allowRisky) {
        if (report.isShouldExecute()) {
            admittedCounter.increment();
            log.debug("Submission admitted with {} issue(s)", report.getIssues().size());
            return AdmissionDecision.ADMIT;
        }
        if (allowRisky) {
            overriddenCounter.increment();
            log.warn("Submission with {} high severity issue(s) admitted on override",
                report.count(Severity.HIGH));
            return AdmissionDecision.ADMIT_WITH_OVERRIDE;
        }
        rejectedCounter.increment();
        log.info("Submission rejected: {} high severity issue(s)", report.count(Severity.HIGH));
        return AdmissionDecision.REJECT;
    }

    /**
     * Admission decision
     */
    public enum AdmissionDecision {
        /**
         * No high severity finding
         */
        ADMIT,

        /**
         * High severity findings, admitted because the caller asked for it
         */
        ADMIT_WITH_OVERRIDE,

        /**
         * High severity findings
         */
        REJECT
    }
}
