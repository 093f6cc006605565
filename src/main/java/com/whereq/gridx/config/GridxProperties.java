package com.whereq.gridx.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for WhereQ GridX.
 *
 * @author WhereQ Inc.
 */
@Configuration
@ConfigurationProperties(prefix = "gridx")
@Data
public class GridxProperties {

    private JobsConfig jobs = new JobsConfig();

    private WorkersConfig workers = new WorkersConfig();

    private DispatchConfig dispatch = new DispatchConfig();

    private AnalyzerConfig analyzer = new AnalyzerConfig();

    private RequestLogConfig requestLog = new RequestLogConfig();

    @Data
    public static class JobsConfig {
        /**
         * Number of jobs executed concurrently.
         */
        private int poolSize = 5;

        /**
         * Terminal jobs older than this are removed by the retention sweep.
         */
        private Duration retentionMaxAge = Duration.ofHours(24);

        /**
         * Interrupt the pool thread of a cancelled or timed out job, closing
         * its in-flight worker connection.
         */
        private boolean interruptOnCancel = true;

        /**
         * User id recorded when a submission carries none.
         */
        private String defaultUser = "anonymous";
    }

    @Data
    public static class WorkersConfig {
        /**
         * Port the worker agent listens on.
         */
        private int agentPort = 7576;

        private Duration pingTimeout = Duration.ofSeconds(2);

        private Duration statusTimeout = Duration.ofSeconds(3);

        /**
         * Optional hub configuration file holding a "peers" object.
         */
        private String hubConfig;

        /**
         * Statically configured workers, keyed by name. Iteration order is
         * the registration order.
         */
        private Map<String, PeerConfig> peers = new LinkedHashMap<>();
    }

    @Data
    public static class PeerConfig {
        private String ip;
        private Integer cpus;
        private String memory;
        private int gpus = 0;
    }

    @Data
    public static class DispatchConfig {
        /**
         * Timeout used when a direct exec request carries none.
         */
        private Duration defaultTimeout = Duration.ofSeconds(30);

        /**
         * Upper bound for any caller supplied timeout; matches the agent's
         * own execution ceiling.
         */
        private Duration maxTimeout = Duration.ofMinutes(5);

        /**
         * Interpreter used to run submitted Python code on a worker.
         */
        private String pythonBinary = "python3";
    }

    @Data
    public static class AnalyzerConfig {
        /**
         * range() bounds above this are reported as resource heavy.
         */
        private long largeRangeThreshold = 100_000;

        /**
         * Loop nesting deeper than this is reported.
         */
        private int maxLoopNesting = 2;

        /**
         * Fixed-size allocations (list repetition, numpy arrays, byte
         * buffers) with at least this many elements are reported.
         */
        private long largeAllocationThreshold = 1_000_000;
    }

    @Data
    public static class RequestLogConfig {
        private int maxEntries = 200;
    }
}
