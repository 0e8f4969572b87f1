package dev.catananti.notifier.config;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Centralised notifier settings: endpoints, timeouts, polling and reconnect policy.
 * Inject this component directly instead of reading properties in each service.
 *
 * <pre>
 * return webClient.get()
 *         .retrieve()
 *         .bodyToMono(JsonNode.class)
 *         .timeout(config.getApiTimeout());
 * </pre>
 */
@Component
@Getter
@Slf4j
public class NotifierConfig {

    private static final double RECONNECT_JITTER = 0.2;

    private final String apiBaseUrl;
    private final String apiToken;
    private final Duration apiTimeout;
    private final String cableUrl;
    private final Duration connectTimeout;
    private final Duration heartbeatTimeout;
    private final Duration pollingInterval;
    private final int pollingHoursWindow;
    private final Duration reconnectBaseDelay;
    private final Duration reconnectMaxDelay;
    private final int reconnectMaxAttempts;
    private final Duration dedupRetention;

    public NotifierConfig(
            @Value("${notifier.api.base-url:http://localhost:3000}") String apiBaseUrl,
            @Value("${notifier.api.token:}") String apiToken,
            @Value("${notifier.api.timeout-seconds:15}") int apiTimeoutSeconds,
            @Value("${notifier.cable.url:ws://localhost:3000/cable}") String cableUrl,
            @Value("${notifier.cable.connect-timeout-seconds:10}") int connectTimeoutSeconds,
            @Value("${notifier.cable.heartbeat-timeout-seconds:30}") int heartbeatTimeoutSeconds,
            @Value("${notifier.polling.interval-seconds:30}") int pollingIntervalSeconds,
            @Value("${notifier.polling.hours-window:24}") int pollingHoursWindow,
            @Value("${notifier.reconnect.base-delay-ms:1000}") long reconnectBaseDelayMs,
            @Value("${notifier.reconnect.max-delay-ms:30000}") long reconnectMaxDelayMs,
            @Value("${notifier.reconnect.max-attempts:10}") int reconnectMaxAttempts,
            @Value("${notifier.dedup.retention-minutes:60}") int dedupRetentionMinutes
    ) {
        this.apiBaseUrl = apiBaseUrl;
        this.apiToken = apiToken;
        this.apiTimeout = Duration.ofSeconds(apiTimeoutSeconds);
        this.cableUrl = cableUrl;
        this.connectTimeout = Duration.ofSeconds(connectTimeoutSeconds);
        this.heartbeatTimeout = Duration.ofSeconds(heartbeatTimeoutSeconds);
        this.pollingInterval = Duration.ofSeconds(pollingIntervalSeconds);
        this.pollingHoursWindow = pollingHoursWindow;
        this.reconnectBaseDelay = Duration.ofMillis(reconnectBaseDelayMs);
        this.reconnectMaxDelay = Duration.ofMillis(reconnectMaxDelayMs);
        this.reconnectMaxAttempts = reconnectMaxAttempts;
        this.dedupRetention = Duration.ofMinutes(dedupRetentionMinutes);
        log.info("Notifier configuration initialized (api={}, cable={}, polling every {}s)",
                apiBaseUrl, cableUrl, pollingIntervalSeconds);
    }

    public boolean hasApiToken() {
        return apiToken != null && !apiToken.isBlank();
    }

    /**
     * Delay before reconnect attempt {@code attempt} (zero based).
     * Exponential backoff capped at the max delay, with +/-20% jitter to avoid reconnect storms.
     */
    public Duration reconnectDelay(int attempt) {
        long base = reconnectBaseDelay.toMillis();
        long exponential = base << Math.min(attempt, 20);
        long capped = Math.min(reconnectMaxDelay.toMillis(), exponential);
        double jitter = 1 + ThreadLocalRandom.current().nextDouble(-RECONNECT_JITTER, RECONNECT_JITTER);
        return Duration.ofMillis(Math.max(0, Math.round(capped * jitter)));
    }
}
