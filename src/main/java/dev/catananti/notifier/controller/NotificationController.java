package dev.catananti.notifier.controller;

import dev.catananti.notifier.dto.AcknowledgeAllResponse;
import dev.catananti.notifier.dto.ActionRequest;
import dev.catananti.notifier.dto.SessionStatusResponse;
import dev.catananti.notifier.entity.Notification;
import dev.catananti.notifier.entity.NotificationState;
import dev.catananti.notifier.entity.NotificationStats;
import dev.catananti.notifier.service.DeliveryManager;
import dev.catananti.notifier.service.NotificationStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Local surface over the delivery session and the notification store for UI collaborators.
 */
@RestController
@RequestMapping("/api/v1/notifications")
@RequiredArgsConstructor
@Validated
@Tag(name = "Notifications", description = "Unacknowledged restaurant notifications and the delivery session")
@Slf4j
public class NotificationController {

    private static final Duration HEARTBEAT_INTERVAL = Duration.ofSeconds(30);

    private final NotificationStore notificationStore;
    private final DeliveryManager deliveryManager;

    @GetMapping
    @Operation(summary = "List unacknowledged notifications", description = "Optionally filtered by notification type")
    public Mono<List<Notification>> getNotifications(@RequestParam(required = false) String type) {
        List<Notification> notifications = notificationStore.getNotifications();
        if (type == null || type.isBlank()) {
            return Mono.just(notifications);
        }
        return Mono.just(notifications.stream().filter(n -> n.isOfType(type)).toList());
    }

    @GetMapping("/stock-alerts")
    @Operation(summary = "List stock alerts", description = "Low stock, out of stock and persistent low stock notifications")
    public Mono<List<Notification>> getStockAlerts() {
        return Mono.just(notificationStore.getStockAlerts());
    }

    @GetMapping("/stats")
    @Operation(summary = "Get notification counters")
    public Mono<NotificationStats> getStats() {
        return Mono.just(notificationStore.getStats());
    }

    @GetMapping("/status")
    @Operation(summary = "Get delivery session status")
    public Mono<SessionStatusResponse> getStatus() {
        return Mono.just(SessionStatusResponse.builder()
                .tenantId(deliveryManager.getTenantId())
                .state(deliveryManager.getState())
                .connected(deliveryManager.isConnected())
                .polling(deliveryManager.isPolling())
                .connectionError(deliveryManager.getLastError())
                .error(notificationStore.getError())
                .build());
    }

    @GetMapping("/stream")
    @Operation(summary = "Stream store snapshots", description = "Server-Sent Events carrying the full state after every change")
    public Flux<ServerSentEvent<NotificationState>> stream() {
        log.debug("Client subscribing to notification state stream");
        Flux<ServerSentEvent<NotificationState>> snapshots = notificationStore.changes()
                .map(state -> ServerSentEvent.<NotificationState>builder()
                        .event("snapshot")
                        .data(state)
                        .build());

        Flux<ServerSentEvent<NotificationState>> heartbeat = Flux.interval(HEARTBEAT_INTERVAL)
                .map(tick -> ServerSentEvent.<NotificationState>builder()
                        .comment("heartbeat")
                        .build());

        return Flux.merge(snapshots, heartbeat);
    }

    @PostMapping("/refresh")
    @Operation(summary = "Refresh notifications and counters from the restaurant API")
    public Mono<NotificationState> refresh(
            @RequestParam(defaultValue = "24") @Min(1) @Max(720) int hours,
            @RequestParam(required = false) String type) {
        log.debug("Refreshing notifications: hours={}, type={}", hours, type);
        return notificationStore.fetch(hours, type)
                .then(notificationStore.fetchStats())
                .then(Mono.fromSupplier(notificationStore::getState));
    }

    @PostMapping("/{id}/acknowledge")
    @Operation(summary = "Acknowledge one notification")
    public Mono<NotificationState> acknowledge(@PathVariable long id) {
        return notificationStore.acknowledgeOne(id)
                .then(Mono.fromSupplier(notificationStore::getState));
    }

    @PostMapping("/acknowledge-all")
    @Operation(summary = "Acknowledge all notifications", description = "Restricted to one type when given")
    public Mono<AcknowledgeAllResponse> acknowledgeAll(@RequestParam(required = false) String type) {
        String filter = type == null || type.isBlank() ? null : type;
        return notificationStore.acknowledgeAllOfType(filter)
                .map(AcknowledgeAllResponse::new);
    }

    @PostMapping("/{id}/actions")
    @Operation(summary = "Take an action on a notification", description = "A successful action also acknowledges the notification")
    public Mono<Map<String, Object>> takeAction(@PathVariable long id, @Valid @RequestBody ActionRequest request) {
        log.info("Taking action '{}' on notification {}", request.getActionType(), id);
        return notificationStore.takeAction(id, request.getActionType(), request.getParams());
    }

    @PutMapping("/session")
    @Operation(summary = "Start (or switch) the delivery session for a tenant")
    public Mono<ResponseEntity<SessionStatusResponse>> startSession(@RequestParam String tenantId) {
        if (!deliveryManager.start(tenantId)) {
            throw new IllegalArgumentException(deliveryManager.getLastError());
        }
        return getStatus().map(ResponseEntity::ok);
    }

    @DeleteMapping("/session")
    @Operation(summary = "Stop the delivery session")
    public Mono<ResponseEntity<Void>> stopSession() {
        deliveryManager.stop();
        return Mono.just(ResponseEntity.noContent().build());
    }
}
