package dev.catananti.notifier.config;

import dev.catananti.notifier.service.DeliveryManager;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Starts the delivery session on startup when a tenant is configured, and stops it on shutdown.
 * Without {@code notifier.session.tenant-id} the session waits for {@code PUT /api/v1/notifications/session}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NotificationSessionInitializer {

    private final DeliveryManager deliveryManager;

    @Value("${notifier.session.tenant-id:}")
    private String tenantId;

    @EventListener(ApplicationReadyEvent.class)
    public void startSession() {
        if (tenantId == null || tenantId.isBlank()) {
            log.debug("Session auto-start skipped - notifier.session.tenant-id not configured");
            return;
        }
        if (deliveryManager.start(tenantId)) {
            log.info("Notification delivery session started for tenant {}", tenantId);
        }
    }

    @PreDestroy
    public void stopSession() {
        deliveryManager.stop();
    }
}
