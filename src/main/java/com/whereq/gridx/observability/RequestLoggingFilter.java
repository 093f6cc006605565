package com.whereq.gridx.observability;

import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.time.Clock;

/**
 * Feeds every handled request into the {@link RequestLog}
 */
@Component
public class RequestLoggingFilter implements WebFilter {

    /**
     * Exchange attribute naming the worker a handler routed the request to
     */
    public static final String WORKER_ATTRIBUTE = RequestLoggingFilter.class.getName() + ".worker";

    private final RequestLog requestLog;
    private final Clock clock;

    public RequestLoggingFilter(RequestLog requestLog, Clock clock) {
        this.requestLog = requestLog;
        this.clock = clock;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().value();
        if (path.startsWith("/actuator")) {
            return chain.filter(exchange);
        }
        long start = clock.millis();
        return chain.filter(exchange)
            .doFinally(signal -> {
                HttpStatusCode status = exchange.getResponse().getStatusCode();
                boolean success = status == null || status.value() < 400;
                requestLog.record(RequestLogEntry.builder()
                    .timestamp(clock.instant())
                    .method(exchange.getRequest().getMethod().name())
                    .endpoint(path)
                    .worker(exchange.getAttribute(WORKER_ATTRIBUTE))
                    .durationMs(clock.millis() - start)
                    .success(success)
                    .build());
            });
    }
}
