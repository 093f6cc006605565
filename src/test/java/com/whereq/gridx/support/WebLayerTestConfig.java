package com.whereq.gridx.support;

import com.whereq.gridx.config.GridxProperties;
import com.whereq.gridx.observability.RequestLog;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;

/**
 * Beans the request logging filter and the admin endpoints need in web slice tests
 */
@TestConfiguration
public class WebLayerTestConfig {

    public static final String NOW = "2024-05-01T10:00:00Z";

    @Bean
    public MutableClock clock() {
        return MutableClock.startingAt(NOW);
    }

    @Bean
    public GridxProperties gridxProperties() {
        return new GridxProperties();
    }

    @Bean
    public RequestLog requestLog(GridxProperties gridxProperties) {
        return new RequestLog(gridxProperties);
    }
}
