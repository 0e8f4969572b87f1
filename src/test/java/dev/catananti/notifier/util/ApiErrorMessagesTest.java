package dev.catananti.notifier.util;

import dev.catananti.notifier.exception.NotificationApiException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ApiErrorMessages")
class ApiErrorMessagesTest {

    @ParameterizedTest(name = "status {0} -> {1}")
    @CsvSource({
            "401, 'session expired, please log in again'",
            "403, not allowed for this account",
            "404, notification not found",
            "429, 'too many requests, try again shortly'",
            "503, server error (503)"
    })
    @DisplayName("should map well-known statuses to friendly text")
    void status_shouldMapToFriendlyText(int status, String expected) {
        NotificationApiException error = new NotificationApiException("fetch notifications", status, "raw body");

        assertThat(ApiErrorMessages.describe(error, "Failed to fetch notifications"))
                .isEqualTo("Failed to fetch notifications: " + expected);
    }

    @Test
    @DisplayName("should use the server message for other client errors")
    void otherClientError_shouldUseServerMessage() {
        NotificationApiException error = new NotificationApiException("take action", 422, "Quantity must be positive");

        assertThat(ApiErrorMessages.describe(error, "Failed to take action"))
                .isEqualTo("Failed to take action: Quantity must be positive");
    }

    @Test
    @DisplayName("should unwrap timeouts wrapped by the API client")
    void wrappedTimeout_shouldSayTimedOut() {
        NotificationApiException error = new NotificationApiException("fetch stats", new TimeoutException("Did not observe any item"));

        assertThat(ApiErrorMessages.describe(error, "Failed to fetch stats"))
                .isEqualTo("Failed to fetch stats: request timed out");
    }

    @Test
    @DisplayName("should report an open circuit as temporarily unavailable")
    void openCircuit_shouldSayUnavailable() {
        CircuitBreaker breaker = CircuitBreaker.ofDefaults("test");
        breaker.transitionToOpenState();
        NotificationApiException error = new NotificationApiException("fetch notifications",
                CallNotPermittedException.createCallNotPermittedException(breaker));

        assertThat(ApiErrorMessages.describe(error, "Failed"))
                .isEqualTo("Failed: service temporarily unavailable");
    }

    @Test
    @DisplayName("should fall back to the plain prefix when there is no message")
    void noMessage_shouldReturnFallback() {
        assertThat(ApiErrorMessages.describe(new IllegalStateException(), "Failed to acknowledge"))
                .isEqualTo("Failed to acknowledge");
    }

    @Test
    @DisplayName("should truncate very long messages")
    void longMessage_shouldBeTruncated() {
        String message = "x".repeat(500);

        String described = ApiErrorMessages.describe(new RuntimeException(message), "Failed");

        assertThat(described).hasSize("Failed: ".length() + 200 + 3).endsWith("...");
    }
}
