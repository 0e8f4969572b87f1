package dev.catananti.notifier.health;

import dev.catananti.notifier.entity.DeliveryState;
import dev.catananti.notifier.entity.NotificationStats;
import dev.catananti.notifier.service.DeliveryManager;
import dev.catananti.notifier.service.NotificationStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Status;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("NotificationDeliveryHealthIndicator")
class NotificationDeliveryHealthIndicatorTest {

    @Mock
    private DeliveryManager deliveryManager;

    @Mock
    private NotificationStore notificationStore;

    @InjectMocks
    private NotificationDeliveryHealthIndicator indicator;

    private void given(DeliveryState state, String lastError) {
        when(deliveryManager.getState()).thenReturn(state);
        when(deliveryManager.getLastError()).thenReturn(lastError);
        lenient().when(deliveryManager.getTenantId()).thenReturn("rest-42");
        lenient().when(notificationStore.getStats())
                .thenReturn(NotificationStats.builder().orderCount(2).totalCount(3).build());
    }

    @Test
    @DisplayName("should report UP when live")
    void shouldReportUpWhenLive() {
        given(DeliveryState.LIVE, null);

        StepVerifier.create(indicator.health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.UP);
                    assertThat(health.getDetails())
                            .containsEntry("mode", "live")
                            .containsEntry("tenantId", "rest-42")
                            .containsEntry("unacknowledged", 3L)
                            .doesNotContainKey("lastError");
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("should report UP but degraded when polling")
    void shouldReportDegradedWhenPolling() {
        given(DeliveryState.POLLING, "Connection refused");

        StepVerifier.create(indicator.health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.UP);
                    assertThat(health.getDetails())
                            .containsEntry("mode", "polling")
                            .containsEntry("degraded", true)
                            .containsEntry("lastError", "Connection refused");
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("should report DOWN when connecting after an error")
    void shouldReportDownWhenConnectingWithError() {
        given(DeliveryState.CONNECTING, "Cable handshake timed out after 10s");

        StepVerifier.create(indicator.health())
                .assertNext(health -> assertThat(health.getStatus()).isEqualTo(Status.DOWN))
                .verifyComplete();
    }

    @Test
    @DisplayName("should report UNKNOWN when idle")
    void shouldReportUnknownWhenIdle() {
        given(DeliveryState.IDLE, null);
        when(deliveryManager.getTenantId()).thenReturn(null);

        StepVerifier.create(indicator.health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.UNKNOWN);
                    assertThat(health.getDetails()).containsEntry("mode", "idle").doesNotContainKey("tenantId");
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("should report DOWN when the check itself fails")
    void shouldReportDownOnFailure() {
        when(deliveryManager.getState()).thenThrow(new IllegalStateException("broken"));

        StepVerifier.create(indicator.health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.DOWN);
                    assertThat(health.getDetails()).containsEntry("message", "broken");
                })
                .verifyComplete();
    }
}
