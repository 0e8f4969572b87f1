package dev.catananti.notifier.service;

import dev.catananti.notifier.config.NotifierConfig;
import dev.catananti.notifier.exception.NotificationApiException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("NotificationApiClient")
class NotificationApiClientTest {

    private final List<ClientRequest> requests = new ArrayList<>();
    private HttpStatus status;
    private String body;

    @BeforeEach
    void setUp() {
        requests.clear();
        status = HttpStatus.OK;
        body = "{}";
    }

    private NotificationApiClient client(String token) {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            return Mono.just(ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(body)
                    .build());
        });
        NotifierConfig config = new NotifierConfig("http://api.test", token, 15,
                "ws://api.test/cable", 10, 30, 30, 24, 1000, 30000, 10, 60);
        return new NotificationApiClient(builder, config);
    }

    private ClientRequest lastRequest() {
        assertThat(requests).isNotEmpty();
        return requests.get(requests.size() - 1);
    }

    @Nested
    @DisplayName("requests")
    class Requests {

        @Test
        @DisplayName("should fetch unacknowledged notifications scoped to the tenant")
        void fetchUnacknowledged_shouldBuildQuery() {
            body = "[{\"id\": 1, \"notification_type\": \"order\"}]";

            StepVerifier.create(client("secret").fetchUnacknowledged("rest-42", 24, "order"))
                    .assertNext(json -> assertThat(json.isArray()).isTrue())
                    .verifyComplete();

            ClientRequest request = lastRequest();
            assertThat(request.method()).isEqualTo(HttpMethod.GET);
            assertThat(request.url().getPath()).isEqualTo("/notifications/unacknowledged");
            assertThat(request.url().getQuery())
                    .contains("restaurant_id=rest-42")
                    .contains("hours=24")
                    .contains("type=order");
            assertThat(request.headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer secret");
        }

        @Test
        @DisplayName("should omit optional parameters and auth when absent")
        void fetchUnacknowledged_withoutOptionalParams() {
            body = "[]";

            StepVerifier.create(client("").fetchUnacknowledged(null, null, null))
                    .expectNextCount(1)
                    .verifyComplete();

            ClientRequest request = lastRequest();
            assertThat(request.url().getQuery()).isNull();
            assertThat(request.headers().containsKey(HttpHeaders.AUTHORIZATION)).isFalse();
        }

        @Test
        @DisplayName("should post acknowledgment for one notification")
        void acknowledge_shouldPost() {
            StepVerifier.create(client("secret").acknowledge("rest-42", 7)).verifyComplete();

            ClientRequest request = lastRequest();
            assertThat(request.method()).isEqualTo(HttpMethod.POST);
            assertThat(request.url().getPath()).isEqualTo("/notifications/7/acknowledge");
        }

        @Test
        @DisplayName("should read the acknowledged count")
        void acknowledgeAll_shouldReturnCount() {
            body = "{\"acknowledged_count\": 3}";

            StepVerifier.create(client("secret").acknowledgeAll("rest-42", "order"))
                    .expectNext(3)
                    .verifyComplete();

            assertThat(lastRequest().url().getPath()).isEqualTo("/notifications/acknowledge_all");
        }

        @Test
        @DisplayName("should map stats fields")
        void fetchStats_shouldMapFields() {
            body = """
                    {"order_count": 2, "low_stock_count": 1, "out_of_stock_count": 0, "total_count": 4,
                     "oldest_notification_date": "2024-05-01T12:00:00Z"}
                    """;

            StepVerifier.create(client("secret").fetchStats("rest-42"))
                    .assertNext(stats -> {
                        assertThat(stats.orderCount()).isEqualTo(2);
                        assertThat(stats.totalCount()).isEqualTo(4);
                        assertThat(stats.oldestNotificationDate()).isNotNull();
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should post actions to take_action")
        void takeAction_shouldPost() {
            body = "{\"success\": true}";

            StepVerifier.create(client("secret").takeAction("rest-42", 4, "restock", Map.of("quantity", 25)))
                    .assertNext(json -> assertThat(json.get("success").asBoolean()).isTrue())
                    .verifyComplete();

            ClientRequest request = lastRequest();
            assertThat(request.url().getPath()).isEqualTo("/notifications/4/take_action");
            assertThat(request.url().getQuery()).isEqualTo("restaurant_id=rest-42");
        }
    }

    @Nested
    @DisplayName("errors")
    class Errors {

        @Test
        @DisplayName("should surface the server error message and status")
        void errorStatus_shouldCarryMessage() {
            status = HttpStatus.UNPROCESSABLE_ENTITY;
            body = "{\"error\": \"Quantity must be positive\"}";

            StepVerifier.create(client("secret").takeAction("rest-42", 4, "restock", Map.of()))
                    .expectErrorSatisfies(error -> {
                        assertThat(error).isInstanceOf(NotificationApiException.class);
                        NotificationApiException api = (NotificationApiException) error;
                        assertThat(api.getStatus()).isEqualTo(422);
                        assertThat(api.getOperation()).isEqualTo("take action on notification");
                        assertThat(api.getMessage()).isEqualTo("Quantity must be positive");
                    })
                    .verify();
        }

        @Test
        @DisplayName("should describe the failure when the body has no message")
        void errorWithoutBody_shouldDescribeStatus() {
            status = HttpStatus.BAD_GATEWAY;
            body = "";

            StepVerifier.create(client("secret").fetchStats("rest-42"))
                    .expectErrorSatisfies(error -> assertThat(error)
                            .isInstanceOf(NotificationApiException.class)
                            .hasMessage("fetch notification stats failed with status 502"))
                    .verify();
        }

        @Test
        @DisplayName("should open the circuit after repeated server errors")
        void serverErrors_shouldOpenCircuit() {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
            NotificationApiClient client = client("secret");

            for (int i = 0; i < 5; i++) {
                StepVerifier.create(client.fetchStats("rest-42"))
                        .expectError(NotificationApiException.class)
                        .verify();
            }
            int sent = requests.size();

            StepVerifier.create(client.fetchStats("rest-42"))
                    .expectErrorSatisfies(error -> {
                        assertThat(error).isInstanceOf(NotificationApiException.class);
                        assertThat(error.getCause()).isInstanceOf(CallNotPermittedException.class);
                    })
                    .verify();
            assertThat(requests).hasSize(sent);
        }

        @Test
        @DisplayName("should not open the circuit on client errors")
        void clientErrors_shouldNotOpenCircuit() {
            status = HttpStatus.NOT_FOUND;
            NotificationApiClient client = client("secret");

            for (int i = 0; i < 8; i++) {
                StepVerifier.create(client.acknowledge("rest-42", i))
                        .expectErrorSatisfies(error -> assertThat(((NotificationApiException) error).getStatus()).isEqualTo(404))
                        .verify();
            }

            assertThat(requests).hasSize(8);
        }
    }
}
