package dev.catananti.notifier.controller;

import dev.catananti.notifier.dto.ActionRequest;
import dev.catananti.notifier.entity.DeliveryState;
import dev.catananti.notifier.entity.Notification;
import dev.catananti.notifier.entity.NotificationState;
import dev.catananti.notifier.entity.NotificationStats;
import dev.catananti.notifier.service.DeliveryManager;
import dev.catananti.notifier.service.NotificationStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("NotificationController")
class NotificationControllerTest {

    @Mock
    private NotificationStore notificationStore;

    @Mock
    private DeliveryManager deliveryManager;

    @InjectMocks
    private NotificationController controller;

    private static Notification notification(long id, String type) {
        return Notification.builder().id(id).notificationType(type).title("N" + id).build();
    }

    @Nested
    @DisplayName("GET /api/v1/notifications")
    class GetNotifications {

        @Test
        @DisplayName("should return every notification without a filter")
        void shouldReturnAll() {
            when(notificationStore.getNotifications())
                    .thenReturn(List.of(notification(1, "order"), notification(2, "low_stock")));

            StepVerifier.create(controller.getNotifications(null))
                    .assertNext(list -> assertThat(list).hasSize(2))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should filter by type")
        void shouldFilterByType() {
            when(notificationStore.getNotifications())
                    .thenReturn(List.of(notification(1, "order"), notification(2, "low_stock")));

            StepVerifier.create(controller.getNotifications("low_stock"))
                    .assertNext(list -> assertThat(list).extracting(Notification::id).containsExactly(2L))
                    .verifyComplete();
        }
    }

    @Test
    @DisplayName("GET /status should combine session and store state")
    void getStatus_shouldDescribeSession() {
        when(deliveryManager.getTenantId()).thenReturn("rest-42");
        when(deliveryManager.getState()).thenReturn(DeliveryState.POLLING);
        when(deliveryManager.isConnected()).thenReturn(false);
        when(deliveryManager.isPolling()).thenReturn(true);
        when(deliveryManager.getLastError()).thenReturn("Connection refused");
        when(notificationStore.getError()).thenReturn(null);

        StepVerifier.create(controller.getStatus())
                .assertNext(status -> {
                    assertThat(status.getTenantId()).isEqualTo("rest-42");
                    assertThat(status.getState()).isEqualTo(DeliveryState.POLLING);
                    assertThat(status.isPolling()).isTrue();
                    assertThat(status.getConnectionError()).isEqualTo("Connection refused");
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("GET /stream should emit snapshots and then heartbeats")
    void stream_shouldEmitSnapshotsAndHeartbeat() {
        NotificationState state = NotificationState.initial();
        when(notificationStore.changes()).thenReturn(Flux.just(state));

        StepVerifier.withVirtualTime(() -> controller.stream().take(2))
                .assertNext(sse -> {
                    assertThat(sse.event()).isEqualTo("snapshot");
                    assertThat(sse.data()).isSameAs(state);
                })
                .thenAwait(Duration.ofSeconds(30))
                .assertNext(sse -> assertThat(sse.comment()).isEqualTo("heartbeat"))
                .verifyComplete();
    }

    @Nested
    @DisplayName("mutations")
    class Mutations {

        @Test
        @DisplayName("POST /refresh should fetch the list then the counters")
        void refresh_shouldFetchThenStats() {
            NotificationState state = NotificationState.initial();
            when(notificationStore.fetch(48, "order")).thenReturn(Mono.just(List.of()));
            when(notificationStore.fetchStats()).thenReturn(Mono.just(NotificationStats.empty()));
            when(notificationStore.getState()).thenReturn(state);

            StepVerifier.create(controller.refresh(48, "order"))
                    .expectNext(state)
                    .verifyComplete();

            verify(notificationStore).fetch(48, "order");
            verify(notificationStore).fetchStats();
        }

        @Test
        @DisplayName("POST /{id}/acknowledge should return the new state")
        void acknowledge_shouldReturnState() {
            NotificationState state = NotificationState.initial();
            when(notificationStore.acknowledgeOne(7)).thenReturn(Mono.empty());
            when(notificationStore.getState()).thenReturn(state);

            StepVerifier.create(controller.acknowledge(7))
                    .expectNext(state)
                    .verifyComplete();
        }

        @Test
        @DisplayName("POST /acknowledge-all should treat a blank type as all types")
        void acknowledgeAll_blankType() {
            when(notificationStore.acknowledgeAllOfType(null)).thenReturn(Mono.just(4));

            StepVerifier.create(controller.acknowledgeAll(" "))
                    .assertNext(response -> assertThat(response.acknowledgedCount()).isEqualTo(4))
                    .verifyComplete();
        }

        @Test
        @DisplayName("POST /{id}/actions should forward the action")
        void takeAction_shouldForward() {
            ActionRequest request = ActionRequest.builder()
                    .actionType("restock")
                    .params(Map.of("quantity", 25))
                    .build();
            when(notificationStore.takeAction(4, "restock", Map.of("quantity", 25)))
                    .thenReturn(Mono.just(Map.of("success", true)));

            StepVerifier.create(controller.takeAction(4, request))
                    .assertNext(result -> assertThat(result).containsEntry("success", true))
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("session")
    class Session {

        @Test
        @DisplayName("PUT /session should start delivery for the tenant")
        void startSession_shouldStart() {
            when(deliveryManager.start("rest-42")).thenReturn(true);
            when(deliveryManager.getState()).thenReturn(DeliveryState.LIVE);

            StepVerifier.create(controller.startSession("rest-42"))
                    .assertNext(response -> {
                        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
                        assertThat(response.getBody().getState()).isEqualTo(DeliveryState.LIVE);
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("PUT /session should reject a tenant the manager refuses")
        void startSession_rejected() {
            when(deliveryManager.start(" ")).thenReturn(false);
            when(deliveryManager.getLastError()).thenReturn("Cannot start notification delivery without a tenant id");

            assertThatThrownBy(() -> controller.startSession(" "))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("tenant id");
        }

        @Test
        @DisplayName("DELETE /session should stop delivery")
        void stopSession_shouldStop() {
            StepVerifier.create(controller.stopSession())
                    .assertNext(response -> assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NO_CONTENT))
                    .verifyComplete();

            verify(deliveryManager).stop();
        }
    }
}
