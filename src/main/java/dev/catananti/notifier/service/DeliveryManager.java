package dev.catananti.notifier.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import dev.catananti.notifier.config.NotifierConfig;
import dev.catananti.notifier.dto.NotificationEnvelope;
import dev.catananti.notifier.dto.NotificationEvent;
import dev.catananti.notifier.entity.DeliveryState;
import dev.catananti.notifier.entity.EventType;
import dev.catananti.notifier.entity.Notification;
import dev.catananti.notifier.metrics.NotificationMetrics;
import dev.catananti.notifier.scheduler.PollingFallbackLoop;
import dev.catananti.notifier.service.transport.TransportConnection;
import dev.catananti.notifier.service.transport.TransportListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * The delivery session for one tenant.
 * <p>
 * Owns the transport, the polling fallback and the reconnect timer. Every transition and every
 * inbound event runs under {@code lock}. Each transport listener carries the session generation it
 * was created for; once {@link #stop()} or a tenant switch bumps the generation its callbacks are
 * ignored, so no handler runs for a session that has been stopped.
 * </p>
 *
 * <pre>
 * IDLE --start--> CONNECTING --connected--> LIVE
 *                      |                      |
 *                      +--error--> POLLING <--+--disconnected
 *                                    |
 *                                    +--reconnect ok--> LIVE
 * any --stop--> IDLE
 * </pre>
 */
@Service
@Slf4j
public class DeliveryManager {

    public static final String DEFAULT_OWNER = "delivery-session";

    private static final long MAX_REMEMBERED_IDS = 10_000;

    private final TransportConnection transport;
    private final HandlerRegistry registry;
    private final NotificationStore store;
    private final PollingFallbackLoop pollingLoop;
    private final NotificationMetrics metrics;
    private final NotifierConfig config;
    private final Scheduler scheduler;
    private final Clock clock;

    // ids delivered over the transport, kept so a re-sent event is not resurrected after acknowledgment
    private final Cache<Long, Boolean> recentlyDelivered;
    private final Sinks.Many<DeliveryState> states = Sinks.many().replay().latest();

    private final Object lock = new Object();
    private long generation;
    private DeliveryState state = DeliveryState.IDLE;
    private String tenantId;
    private String owner;
    private Disposable reconnectTimer;
    private int reconnectAttempts;
    private volatile String lastError;

    public DeliveryManager(TransportConnection transport,
                           HandlerRegistry registry,
                           NotificationStore store,
                           PollingFallbackLoop pollingLoop,
                           NotificationMetrics metrics,
                           NotifierConfig config,
                           @Qualifier("notifierScheduler") Scheduler scheduler,
                           Clock clock) {
        this.transport = transport;
        this.registry = registry;
        this.store = store;
        this.pollingLoop = pollingLoop;
        this.metrics = metrics;
        this.config = config;
        this.scheduler = scheduler;
        this.clock = clock;
        this.recentlyDelivered = Caffeine.newBuilder()
                .expireAfterWrite(config.getDedupRetention())
                .maximumSize(MAX_REMEMBERED_IDS)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .build();
        states.tryEmitNext(state);
    }

    // ==================== Lifecycle ====================

    public boolean start(String tenantId) {
        return start(tenantId, DEFAULT_OWNER);
    }

    /**
     * Start delivering notifications for {@code tenantId}.
     * <ul>
     *   <li>blank tenant: logged and recorded in {@link #getLastError()}, returns false</li>
     *   <li>same tenant while connecting or live: nothing happens</li>
     *   <li>same tenant while polling: reconnects right away</li>
     *   <li>another tenant: the running session is stopped and the store reset first</li>
     * </ul>
     *
     * @param owner identity whose handlers are removed when the session stops
     */
    public boolean start(String tenantId, String owner) {
        if (tenantId == null || tenantId.isBlank()) {
            lastError = "Cannot start notification delivery without a tenant id";
            log.error(lastError);
            return false;
        }
        synchronized (lock) {
            if (tenantId.equals(this.tenantId) && state != DeliveryState.IDLE) {
                if (state == DeliveryState.POLLING) {
                    log.info("Reconnect requested for tenant {} while polling", tenantId);
                    cancelReconnect();
                    attemptReconnect(generation);
                }
                return true;
            }
            generation++;
            if (state != DeliveryState.IDLE) {
                log.info("Switching delivery session from tenant {} to {}", this.tenantId, tenantId);
                shutdown("tenant changed");
            }
            this.tenantId = tenantId;
            this.owner = owner == null || owner.isBlank() ? DEFAULT_OWNER : owner;
            this.reconnectAttempts = 0;
            this.lastError = null;
            recentlyDelivered.invalidateAll();
            store.bindTenant(tenantId);
            transition(DeliveryState.CONNECTING);
            log.info("Starting notification delivery for tenant {}", tenantId);
            transport.connect(tenantId, new SessionListener(generation));
            return true;
        }
    }

    /**
     * Stop the session: transport closed, polling and reconnect timers cancelled, the owner's handlers
     * removed and in-flight store results discarded. No handler runs once this returns.
     */
    public void stop() {
        synchronized (lock) {
            if (state == DeliveryState.IDLE) {
                return;
            }
            generation++;
            log.info("Stopping notification delivery for tenant {}", tenantId);
            shutdown("stopped");
            tenantId = null;
            transition(DeliveryState.IDLE);
        }
    }

    // ==================== Handlers ====================

    public void register(EventType type, NotificationHandler handler, String owner) {
        registry.register(type, handler, owner);
    }

    public int unregister(EventType type, NotificationHandler handler, String owner) {
        return registry.unregister(type, handler, owner);
    }

    // ==================== Queries ====================

    public boolean isConnected() {
        synchronized (lock) {
            return state == DeliveryState.LIVE && transport.isConnected();
        }
    }

    public boolean isPolling() {
        synchronized (lock) {
            return state == DeliveryState.POLLING;
        }
    }

    public DeliveryState getState() {
        synchronized (lock) {
            return state;
        }
    }

    public String getTenantId() {
        synchronized (lock) {
            return tenantId;
        }
    }

    public String getLastError() {
        return lastError;
    }

    /**
     * Current state on subscription, then every transition.
     */
    public Flux<DeliveryState> states() {
        return states.asFlux();
    }

    // ==================== Internals (call with lock held) ====================

    private void shutdown(String reason) {
        cancelReconnect();
        pollingLoop.stop();
        transport.disconnect(reason);
        int removed = registry.unregisterAll(owner);
        if (removed > 0) {
            log.debug("Removed {} handler(s) of {}", removed, owner);
        }
        store.invalidatePending();
    }

    private void transition(DeliveryState next) {
        if (state == next) {
            return;
        }
        log.info("Notification delivery {} -> {} (tenant={})", state, next, tenantId);
        state = next;
        states.tryEmitNext(next);
    }

    private void enterPolling(String reason) {
        if (state != DeliveryState.POLLING) {
            log.warn("Live notifications unavailable ({}), falling back to polling", reason);
            transition(DeliveryState.POLLING);
        }
        if (!pollingLoop.isRunning()) {
            pollingLoop.start();
        }
        scheduleReconnect();
    }

    private void scheduleReconnect() {
        if (reconnectAttempts >= config.getReconnectMaxAttempts()) {
            log.warn("Giving up automatic reconnect after {} attempts, polling continues", reconnectAttempts);
            return;
        }
        Duration delay = config.reconnectDelay(reconnectAttempts);
        reconnectAttempts++;
        cancelReconnect();
        long gen = generation;
        log.info("Reconnect attempt {}/{} in {}ms", reconnectAttempts, config.getReconnectMaxAttempts(), delay.toMillis());
        reconnectTimer = scheduler.schedule(() -> {
            synchronized (lock) {
                attemptReconnect(gen);
            }
        }, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void attemptReconnect(long gen) {
        if (gen != generation || state != DeliveryState.POLLING) {
            return;
        }
        metrics.incrementReconnectAttempt();
        transport.connect(tenantId, new SessionListener(gen));
    }

    private void cancelReconnect() {
        if (reconnectTimer != null) {
            reconnectTimer.dispose();
            reconnectTimer = null;
        }
    }

    private void catchUp(long gen) {
        int hours = config.getPollingHoursWindow();
        store.fetch(hours, null)
                .filter(fetched -> isCurrent(gen))
                .flatMap(fetched -> store.fetchStats())
                .subscribe(
                        stats -> log.debug("Caught up on missed notifications ({} unacknowledged)", stats.getTotalCount()),
                        error -> log.warn("Catch-up fetch failed: {}", error.getMessage()));
    }

    private boolean isCurrent(long gen) {
        synchronized (lock) {
            return gen == generation && state != DeliveryState.IDLE;
        }
    }

    private void handleEnvelope(NotificationEnvelope envelope) {
        Optional<EventType> resolved = EventType.fromValue(envelope.type());
        if (resolved.isEmpty()) {
            log.debug("Ignoring event with unknown type '{}'", envelope.type());
            return;
        }
        EventType type = resolved.get();
        Map<String, Object> data = envelope.data();
        metrics.incrementEventReceived(type);

        String eventTenant = tenantOf(data);
        if (eventTenant != null && !eventTenant.equals(tenantId)) {
            metrics.incrementRejected();
            log.debug("Ignoring {} event for tenant {} (session tenant {})", type.value(), eventTenant, tenantId);
            return;
        }

        Notification notification = toNotification(type, data);
        if (notification != null) {
            long id = notification.id();
            if (store.contains(id) || recentlyDelivered.getIfPresent(id) != null) {
                metrics.incrementDuplicate();
                log.debug("Skipping duplicate {} notification {}", type.value(), id);
                return;
            }
            recentlyDelivered.put(id, Boolean.TRUE);
            if (!store.append(notification)) {
                metrics.incrementDuplicate();
                return;
            }
        }

        NotificationEvent event = new NotificationEvent(type, data, notification, clock.instant());
        int delivered = registry.dispatch(type, event);
        log.debug("Delivered {} event to {} handler(s)", type.value(), delivered);
    }

    // ==================== Event mapping ====================

    private static String tenantOf(Map<String, Object> data) {
        Object direct = data.get("restaurant_id");
        if (direct != null) {
            return String.valueOf(direct);
        }
        for (String nested : new String[]{"metadata", "menu_item"}) {
            Object value = nestedValue(data, nested, "restaurant_id");
            if (value != null) {
                return String.valueOf(value);
            }
        }
        return null;
    }

    private Notification toNotification(EventType type, Map<String, Object> data) {
        Long id = toId(data.get("id"));
        if (id == null) {
            id = toId(nestedValue(data, "metadata", "id"));
        }
        if (id == null) {
            return null;
        }
        String notificationType = data.get("notification_type") instanceof String named && !named.isBlank()
                ? named
                : type.defaultNotificationType().value();
        return Notification.builder()
                .id(id)
                .notificationType(notificationType)
                .title(stringOr(data.get("title"), "New " + type.value() + " notification"))
                .body(stringOr(data.get("body"), ""))
                .resourceType(stringOr(data.get("resource_type"), ""))
                .resourceId(stringOr(data.get("resource_id"), String.valueOf(id)))
                .adminPath(stringOr(data.get("admin_path"), null))
                .metadata(metadataOf(data))
                .createdAt(createdAt(data.get("created_at")))
                .build();
    }

    private static Map<String, Object> metadataOf(Map<String, Object> data) {
        if (!(data.get("metadata") instanceof Map<?, ?> metadata)) {
            return data;
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        metadata.forEach((key, value) -> copy.put(String.valueOf(key), value));
        return copy;
    }

    private OffsetDateTime createdAt(Object value) {
        if (value instanceof String text) {
            try {
                return OffsetDateTime.parse(text);
            } catch (DateTimeParseException e) {
                log.debug("Unparseable created_at '{}', using current time", text);
            }
        }
        return OffsetDateTime.now(clock);
    }

    private static Object nestedValue(Map<String, Object> data, String parent, String key) {
        return data.get(parent) instanceof Map<?, ?> nested ? nested.get(key) : null;
    }

    private static Long toId(Object value) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Long.parseLong(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static String stringOr(Object value, String fallback) {
        return value == null ? fallback : String.valueOf(value);
    }

    /**
     * Transport callbacks for one session generation.
     */
    private final class SessionListener implements TransportListener {

        private final long sessionGeneration;

        private SessionListener(long sessionGeneration) {
            this.sessionGeneration = sessionGeneration;
        }

        @Override
        public void onConnected() {
            synchronized (lock) {
                if (isStale()) {
                    return;
                }
                reconnectAttempts = 0;
                lastError = null;
                cancelReconnect();
                pollingLoop.stop();
                transition(DeliveryState.LIVE);
            }
            catchUp(sessionGeneration);
        }

        @Override
        public void onMessage(NotificationEnvelope envelope) {
            synchronized (lock) {
                if (isStale()) {
                    return;
                }
                handleEnvelope(envelope);
            }
        }

        @Override
        public void onError(Throwable error) {
            synchronized (lock) {
                if (isStale()) {
                    return;
                }
                metrics.incrementTransportError();
                lastError = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
                log.warn("Notification transport error for tenant {}: {}", tenantId, lastError);
            }
        }

        @Override
        public void onDisconnected(String reason) {
            synchronized (lock) {
                if (isStale()) {
                    return;
                }
                enterPolling(reason);
            }
        }

        private boolean isStale() {
            return !isCurrent(sessionGeneration);
        }
    }
}
