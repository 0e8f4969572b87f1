package dev.catananti.notifier.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.server.WebFilter;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Access log for the local HTTP surface.
 */
@Configuration(proxyBeanMethods = false)
@Slf4j
public class RequestLoggingConfig {

    static final String REQUEST_ID_HEADER = "X-Request-Id";

    @Bean
    public WebFilter requestLoggingFilter() {
        return (exchange, chain) -> {
            Instant start = Instant.now();
            String method = exchange.getRequest().getMethod().name();
            String path = exchange.getRequest().getPath().value();

            String rawRequestId = exchange.getRequest().getHeaders().getFirst(REQUEST_ID_HEADER);
            String requestId = rawRequestId == null || rawRequestId.isBlank()
                    ? UUID.randomUUID().toString().substring(0, 8)
                    : sanitizeHeaderValue(rawRequestId);

            return chain.filter(exchange)
                    .doOnSuccess(done -> {
                        HttpStatusCode status = exchange.getResponse().getStatusCode();
                        logRequest(requestId, method, path, status == null ? 200 : status.value(),
                                Duration.between(start, Instant.now()));
                    })
                    .doOnError(error -> log.error("[{}] {} {} - ERROR {} in {}ms",
                            requestId, method, path, error.getMessage(), Duration.between(start, Instant.now()).toMillis()));
        };
    }

    private void logRequest(String requestId, String method, String path, int status, Duration duration) {
        if (path.startsWith("/actuator") || path.contains("/swagger") || path.startsWith("/v3/api-docs")
                || path.endsWith("/stream")) {
            log.trace("[{}] {} {} - {} in {}ms", requestId, method, path, status, duration.toMillis());
        } else if (status >= 400) {
            log.warn("[{}] {} {} - {} in {}ms", requestId, method, path, status, duration.toMillis());
        } else {
            log.info("[{}] {} {} - {} in {}ms", requestId, method, path, status, duration.toMillis());
        }
    }

    // strip newlines and non-printable chars so a header cannot forge log lines
    private String sanitizeHeaderValue(String value) {
        return value.replaceAll("[\\r\\n]", "").replaceAll("[^\\x20-\\x7E]", "");
    }
}
