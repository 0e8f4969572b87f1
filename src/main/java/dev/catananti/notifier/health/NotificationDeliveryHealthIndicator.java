package dev.catananti.notifier.health;

import dev.catananti.notifier.entity.DeliveryState;
import dev.catananti.notifier.service.DeliveryManager;
import dev.catananti.notifier.service.NotificationStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Health of the notification delivery session.
 * LIVE is UP; POLLING is still UP because notifications keep arriving, but is flagged as degraded.
 * A session stuck while connecting with a recorded error is DOWN.
 */
@Component("notificationDelivery")
@RequiredArgsConstructor
@Slf4j
public class NotificationDeliveryHealthIndicator implements ReactiveHealthIndicator {

    private final DeliveryManager deliveryManager;
    private final NotificationStore notificationStore;

    @Override
    public Mono<Health> health() {
        return Mono.fromSupplier(this::buildHealth)
                .onErrorResume(this::buildDownHealth);
    }

    private Health buildHealth() {
        DeliveryState state = deliveryManager.getState();
        String lastError = deliveryManager.getLastError();
        Health.Builder builder = switch (state) {
            case LIVE -> Health.up().withDetail("mode", "live");
            case POLLING -> Health.up().withDetail("mode", "polling").withDetail("degraded", true);
            case CONNECTING -> lastError != null ? Health.down() : Health.unknown();
            case IDLE -> Health.unknown().withDetail("mode", "idle");
        };
        builder.withDetail("state", state.name());
        if (deliveryManager.getTenantId() != null) {
            builder.withDetail("tenantId", deliveryManager.getTenantId());
        }
        if (lastError != null) {
            builder.withDetail("lastError", lastError);
        }
        builder.withDetail("unacknowledged", notificationStore.getStats().getTotalCount());
        return builder.build();
    }

    private Mono<Health> buildDownHealth(Throwable ex) {
        log.error("Notification delivery health check failed: {}", ex.getMessage());
        return Mono.just(Health.down()
                .withDetail("error", ex.getClass().getSimpleName())
                .withDetail("message", String.valueOf(ex.getMessage()))
                .build());
    }
}
