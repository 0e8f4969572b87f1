package dev.catananti.notifier.service;

import com.fasterxml.jackson.databind.JsonNode;
import dev.catananti.notifier.config.NotifierConfig;
import dev.catananti.notifier.dto.AcknowledgeAllResponse;
import dev.catananti.notifier.dto.NotificationStatsResponse;
import dev.catananti.notifier.exception.NotificationApiException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriBuilder;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Client for the restaurant API notification endpoints.
 * <p>
 * Every call is scoped to the bound tenant through the {@code restaurant_id} query parameter,
 * bounded by a timeout and guarded by a circuit breaker so that the polling fallback does not
 * keep hammering an API that is down.
 * </p>
 */
@Service
@Slf4j
public class NotificationApiClient {

    private static final String BASE_PATH = "/notifications";

    private final WebClient webClient;
    private final Duration timeout;
    private final CircuitBreaker circuitBreaker;

    public NotificationApiClient(WebClient.Builder webClientBuilder, NotifierConfig config) {
        WebClient.Builder builder = webClientBuilder.baseUrl(config.getApiBaseUrl());
        if (config.hasApiToken()) {
            builder = builder.defaultHeaders(headers -> headers.setBearerAuth(config.getApiToken()));
        }
        this.webClient = builder.build();
        this.timeout = config.getApiTimeout();

        CircuitBreakerConfig cbConfig = CircuitBreakerConfig.custom()
                .failureRateThreshold(50)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .slidingWindowSize(10)
                .minimumNumberOfCalls(5)
                .ignoreExceptions(ClientErrorException.class)
                .build();
        this.circuitBreaker = CircuitBreaker.of("notification-api", cbConfig);
        log.info("Notification API circuit breaker initialised (failureRate=50%, window=10, waitOpen=30s)");
    }

    /**
     * Fetch unacknowledged notifications as a raw JSON tree; callers decide how to treat unexpected shapes.
     *
     * @param tenantId tenant scope, may be null
     * @param hours    look-back window in hours, may be null for the server default
     * @param type     notification type filter, may be null for all types
     */
    public Mono<JsonNode> fetchUnacknowledged(String tenantId, Integer hours, String type) {
        return call("fetch notifications", webClient.get()
                .uri(uri -> withParams(uri.path(BASE_PATH + "/unacknowledged"), tenantId)
                        .queryParamIfPresent("hours", Optional.ofNullable(hours))
                        .queryParamIfPresent("type", Optional.ofNullable(type))
                        .build())
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .onStatus(HttpStatusCode::isError, errorMapper("fetch notifications"))
                .bodyToMono(JsonNode.class));
    }

    public Mono<Void> acknowledge(String tenantId, long id) {
        return call("acknowledge notification", webClient.post()
                .uri(uri -> withParams(uri.path(BASE_PATH + "/{id}/acknowledge"), tenantId).build(id))
                .retrieve()
                .onStatus(HttpStatusCode::isError, errorMapper("acknowledge notification"))
                .toBodilessEntity()
                .then());
    }

    /**
     * Acknowledge every notification, or only those of {@code type} when it is not null.
     *
     * @return number of notifications the server acknowledged
     */
    public Mono<Integer> acknowledgeAll(String tenantId, String type) {
        Map<String, Object> body = new HashMap<>();
        if (type != null) {
            body.put("type", type);
        }
        return call("acknowledge all notifications", webClient.post()
                .uri(uri -> withParams(uri.path(BASE_PATH + "/acknowledge_all"), tenantId).build())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .onStatus(HttpStatusCode::isError, errorMapper("acknowledge all notifications"))
                .bodyToMono(AcknowledgeAllResponse.class)
                .map(AcknowledgeAllResponse::acknowledgedCount)
                .defaultIfEmpty(0));
    }

    public Mono<NotificationStatsResponse> fetchStats(String tenantId) {
        return call("fetch notification stats", webClient.get()
                .uri(uri -> withParams(uri.path(BASE_PATH + "/stats"), tenantId).build())
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .onStatus(HttpStatusCode::isError, errorMapper("fetch notification stats"))
                .bodyToMono(NotificationStatsResponse.class));
    }

    /**
     * Run an action such as {@code restock} on a notification. The server acknowledges the
     * notification as part of a successful action.
     */
    public Mono<JsonNode> takeAction(String tenantId, long id, String actionType, Map<String, Object> params) {
        Map<String, Object> body = new LinkedHashMap<>();
        if (params != null) {
            body.putAll(params);
        }
        body.put("action_type", actionType);
        return call("take action on notification", webClient.post()
                .uri(uri -> withParams(uri.path(BASE_PATH + "/{id}/take_action"), tenantId).build(id))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .onStatus(HttpStatusCode::isError, errorMapper("take action on notification"))
                .bodyToMono(JsonNode.class));
    }

    private <T> Mono<T> call(String operation, Mono<T> request) {
        return request
                .timeout(timeout)
                .transformDeferred(CircuitBreakerOperator.of(circuitBreaker))
                .doOnError(e -> log.debug("Notification API call '{}' failed: {}", operation, e.toString()))
                .onErrorMap(e -> !(e instanceof NotificationApiException), e -> new NotificationApiException(operation, e));
    }

    private static UriBuilder withParams(UriBuilder builder, String tenantId) {
        return tenantId == null ? builder : builder.queryParam("restaurant_id", tenantId);
    }

    private static Function<ClientResponse, Mono<? extends Throwable>> errorMapper(String operation) {
        return response -> response.bodyToMono(JsonNode.class)
                .map(NotificationApiClient::serverMessage)
                .onErrorResume(e -> Mono.just(""))
                .defaultIfEmpty("")
                .map(message -> {
                    int status = response.statusCode().value();
                    String text = message.isBlank() ? operation + " failed with status " + status : message;
                    return response.statusCode().is4xxClientError()
                            ? new ClientErrorException(operation, status, text)
                            : new NotificationApiException(operation, status, text);
                });
    }

    private static String serverMessage(JsonNode body) {
        if (body.hasNonNull("error")) {
            return body.get("error").asText();
        }
        if (body.hasNonNull("message")) {
            return body.get("message").asText();
        }
        return "";
    }

    /**
     * 4xx answers: the API is reachable, so they do not count against the circuit breaker.
     */
    static class ClientErrorException extends NotificationApiException {
        ClientErrorException(String operation, int status, String message) {
            super(operation, status, message);
        }
    }
}
