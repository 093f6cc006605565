package com.whereq.gridx.executor;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import com.whereq.gridx.model.JobResult;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Locale;

/**
 * Outcome of one remote execution request.
 * <p>
 * Every failure mode has its own {@link Outcome}; the dispatcher returns
 * these as values and never throws past its boundary.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DispatchResult {

    public enum Outcome {
        SUCCESS,
        /** No worker passed the liveness probe */
        NO_ELIGIBLE_WORKER,
        /** Named worker is not in the registry */
        WORKER_NOT_FOUND,
        CONNECTION_ERROR,
        TIMEOUT,
        /** Command ran and exited with a non-zero code */
        REMOTE_NON_ZERO_EXIT,
        /** Agent answered with an HTTP error */
        REMOTE_ERROR;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    Outcome outcome;

    String worker;

    String command;

    String output;

    String error;

    Integer exitCode;

    boolean autoSelected;

    long executionTimeMs;

    Instant completedAt;

    public boolean isSuccess() {
        return outcome == Outcome.SUCCESS;
    }

    public static DispatchResult success(String worker, String command, String output, String error,
                                         int exitCode, long executionTimeMs, Instant completedAt) {
        return DispatchResult.builder()
            .outcome(exitCode == 0 ? Outcome.SUCCESS : Outcome.REMOTE_NON_ZERO_EXIT)
            .worker(worker)
            .command(command)
            .output(output)
            .error(error)
            .exitCode(exitCode)
            .executionTimeMs(executionTimeMs)
            .completedAt(completedAt)
            .build();
    }

    public static DispatchResult failure(Outcome outcome, String worker, String command, String error,
                                         long executionTimeMs, Instant completedAt) {
        return DispatchResult.builder()
            .outcome(outcome)
            .worker(worker)
            .command(command)
            .error(error)
            .executionTimeMs(executionTimeMs)
            .completedAt(completedAt)
            .build();
    }

    public DispatchResult asAutoSelected() {
        return toBuilder().autoSelected(true).build();
    }

    /**
     * Human readable failure reason stored as a job's error
     */
    public String describeFailure() {
        String reason = error != null && !error.isBlank() ? error : null;
        return switch (outcome) {
            case SUCCESS -> "Succeeded";
            case NO_ELIGIBLE_WORKER -> "No workers available";
            case WORKER_NOT_FOUND -> "Worker '" + worker + "' not found";
            case CONNECTION_ERROR -> "Failed to reach worker '" + worker + "'" + (reason != null ? ": " + reason : "");
            case TIMEOUT -> "Command timed out on worker '" + worker + "'";
            case REMOTE_NON_ZERO_EXIT -> "Command exited with code " + exitCode + " on worker '" + worker + "'"
                + (reason != null ? ": " + reason : "");
            case REMOTE_ERROR -> "Worker '" + worker + "' returned an error" + (reason != null ? ": " + reason : "");
        };
    }

    public JobResult toJobResult() {
        return JobResult.builder()
            .worker(worker)
            .output(output)
            .error(error)
            .exitCode(exitCode)
            .autoSelected(autoSelected)
            .executionTimeMs(executionTimeMs)
            .completedAt(completedAt)
            .build();
    }
}
