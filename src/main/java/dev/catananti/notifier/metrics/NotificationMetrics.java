package dev.catananti.notifier.metrics;

import dev.catananti.notifier.entity.EventType;
import dev.catananti.notifier.service.NotificationStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class NotificationMetrics {

    private final MeterRegistry meterRegistry;
    private final NotificationStore notificationStore;

    private Counter duplicateCounter;
    private Counter rejectedCounter;
    private Counter pollTickCounter;
    private Counter pollFailureCounter;
    private Counter transportErrorCounter;
    private Counter reconnectCounter;

    @PostConstruct
    public void init() {
        Gauge.builder("notifier.notifications.unacknowledged", notificationStore,
                        store -> store.getNotifications().size())
                .description("Unacknowledged notifications held locally")
                .register(meterRegistry);

        Gauge.builder("notifier.notifications.total", notificationStore,
                        store -> store.getStats().getTotalCount())
                .description("Total unacknowledged notifications according to the counters")
                .register(meterRegistry);

        duplicateCounter = meterRegistry.counter("notifier.events.duplicates");
        rejectedCounter = meterRegistry.counter("notifier.events.rejected");
        pollTickCounter = meterRegistry.counter("notifier.poll.ticks");
        pollFailureCounter = meterRegistry.counter("notifier.poll.failures");
        transportErrorCounter = meterRegistry.counter("notifier.transport.errors");
        reconnectCounter = meterRegistry.counter("notifier.transport.reconnects");
        log.debug("Notification metrics registered");
    }

    public void incrementEventReceived(EventType type) {
        meterRegistry.counter("notifier.events.received", "type", type.value()).increment();
    }

    public void incrementDuplicate() {
        duplicateCounter.increment();
    }

    /**
     * Event dropped because it belonged to another tenant.
     */
    public void incrementRejected() {
        rejectedCounter.increment();
    }

    public void incrementPollTick() {
        pollTickCounter.increment();
    }

    public void incrementPollFailure() {
        pollFailureCounter.increment();
    }

    public void incrementTransportError() {
        transportErrorCounter.increment();
    }

    public void incrementReconnectAttempt() {
        reconnectCounter.increment();
    }
}
