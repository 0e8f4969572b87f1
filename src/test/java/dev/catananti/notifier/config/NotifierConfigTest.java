package dev.catananti.notifier.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("NotifierConfig")
class NotifierConfigTest {

    private static NotifierConfig config(String token) {
        return new NotifierConfig("http://api.test", token, 15,
                "ws://api.test/cable", 10, 30, 30, 24, 1000, 30000, 10, 60);
    }

    @Nested
    @DisplayName("reconnectDelay()")
    class ReconnectDelay {

        @ParameterizedTest(name = "attempt {0} -> ~{1}ms")
        @CsvSource({"0, 1000", "1, 2000", "2, 4000", "4, 16000", "5, 30000", "9, 30000", "40, 30000"})
        @DisplayName("should back off exponentially within 20% jitter and cap at the max delay")
        void shouldBackOff(int attempt, long expectedMillis) {
            NotifierConfig config = config("");
            for (int i = 0; i < 50; i++) {
                long delay = config.reconnectDelay(attempt).toMillis();
                assertThat(delay).isBetween(Math.round(expectedMillis * 0.8), Math.round(expectedMillis * 1.2));
            }
        }
    }

    @Test
    @DisplayName("hasApiToken() should ignore blank tokens")
    void hasApiToken() {
        assertThat(config("secret").hasApiToken()).isTrue();
        assertThat(config(" ").hasApiToken()).isFalse();
        assertThat(config(null).hasApiToken()).isFalse();
    }

    @Test
    @DisplayName("should convert configured units to durations")
    void shouldConvertUnits() {
        NotifierConfig config = config("secret");

        assertThat(config.getApiTimeout()).isEqualTo(Duration.ofSeconds(15));
        assertThat(config.getHeartbeatTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.getPollingInterval()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.getDedupRetention()).isEqualTo(Duration.ofMinutes(60));
        assertThat(config.getPollingHoursWindow()).isEqualTo(24);
    }
}
