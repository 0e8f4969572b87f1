package dev.catananti.notifier.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.catananti.notifier.dto.NotificationStatsResponse;
import dev.catananti.notifier.entity.Notification;
import dev.catananti.notifier.entity.NotificationState;
import dev.catananti.notifier.entity.NotificationStats;
import dev.catananti.notifier.exception.NotificationApiException;
import dev.catananti.notifier.util.ApiErrorMessages;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Authoritative view of the tenant's unacknowledged notifications and their counters.
 * <p>
 * State is an immutable {@link NotificationState} swapped under a lock. Remote calls run first;
 * their result is then applied in one read-modify-write against the current state, so a failed
 * call never leaves a half-applied mutation behind. Remote failures end up in
 * {@link NotificationState#getError()} instead of propagating, except for
 * {@link #takeAction} whose caller needs the failure to retry.
 * </p>
 * <p>
 * {@link #invalidatePending()} bumps a generation counter; results of calls started before the
 * bump are dropped when they complete.
 * </p>
 * <p>
 * A fetched snapshot may predate live appends that arrived while the request was in flight.
 * Those entries are kept on top of the snapshot instead of being overwritten by it.
 * </p>
 */
@Service
@Slf4j
public class NotificationStore {

    public static final int DEFAULT_HOURS_WINDOW = 24;

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    private final NotificationApiClient apiClient;
    private final ObjectMapper objectMapper;

    private final Object lock = new Object();
    private final AtomicLong generation = new AtomicLong();
    private final Sinks.Many<NotificationState> sink = Sinks.many().replay().latest();

    private volatile NotificationState state = NotificationState.initial();
    private volatile String tenantId;

    // id -> append sequence of live entries still held; guarded by lock
    private final Map<Long, Long> appendedAt = new HashMap<>();
    private long appendSequence;

    public NotificationStore(NotificationApiClient apiClient, ObjectMapper objectMapper) {
        this.apiClient = apiClient;
        this.objectMapper = objectMapper;
        sink.tryEmitNext(state);
    }

    // ==================== Remote operations ====================

    /**
     * Replace the unacknowledged collection with a fresh snapshot.
     * A response that is not a JSON array is treated as empty.
     *
     * @param hoursWindow look-back window in hours
     * @param typeFilter  only fetch this notification type, or all when null
     * @return the notifications now held, or an empty list when the fetch failed
     */
    public Mono<List<Notification>> fetch(int hoursWindow, String typeFilter) {
        return Mono.defer(() -> {
            long gen = generation.get();
            long appendMark = currentAppendMark();
            log.debug("Fetching notifications: hours={}, type={}", hoursWindow, typeFilter);
            apply(gen, s -> s.toBuilder().loading(true).error(null).build());
            return apiClient.fetchUnacknowledged(tenantId, hoursWindow, typeFilter)
                    .map(this::toNotifications)
                    .defaultIfEmpty(List.of())
                    .map(fetched -> {
                        AtomicReference<List<Notification>> held = new AtomicReference<>(List.of());
                        boolean applied = apply(gen, s -> {
                            List<Notification> merged = mergeLiveAppends(s.getNotifications(), fetched, appendMark);
                            held.set(merged);
                            return s.toBuilder()
                                    .notifications(merged)
                                    .loading(false)
                                    .build();
                        });
                        if (applied) {
                            log.debug("Loaded {} unacknowledged notifications", held.get().size());
                        }
                        return held.get();
                    })
                    .onErrorResume(e -> {
                        fail(gen, e, "Failed to fetch notifications");
                        return Mono.just(List.of());
                    });
        });
    }

    public Mono<List<Notification>> fetch() {
        return fetch(DEFAULT_HOURS_WINDOW, null);
    }

    /**
     * Refresh the counters without touching the notification list.
     */
    public Mono<NotificationStats> fetchStats() {
        return Mono.defer(() -> {
            long gen = generation.get();
            apply(gen, s -> s.toBuilder().loading(true).error(null).build());
            return apiClient.fetchStats(tenantId)
                    .map(NotificationStatsResponse::toStats)
                    .flatMap(stats -> {
                        apply(gen, s -> s.toBuilder().stats(stats).loading(false).build());
                        return Mono.just(stats);
                    })
                    .switchIfEmpty(Mono.defer(() -> {
                        log.warn("Notification stats response was empty, keeping current counters");
                        apply(gen, s -> s.toBuilder().loading(false).build());
                        return Mono.just(state.getStats());
                    }))
                    .onErrorResume(e -> {
                        fail(gen, e, "Failed to fetch notification stats");
                        return Mono.just(state.getStats());
                    });
        });
    }

    /**
     * Acknowledge one notification and drop it from the collection.
     * Counters are only decremented for notifications the store knows about.
     */
    public Mono<Void> acknowledgeOne(long id) {
        return Mono.defer(() -> {
            long gen = generation.get();
            return apiClient.acknowledge(tenantId, id)
                    .then(Mono.fromRunnable(() -> apply(gen, s -> removeOne(s, id))))
                    .onErrorResume(e -> {
                        fail(gen, e, "Failed to acknowledge notification");
                        return Mono.empty();
                    })
                    .then();
        });
    }

    /**
     * Acknowledge all notifications of {@code type}, or every notification when it is null.
     *
     * @return the number of notifications the server acknowledged, 0 on failure
     */
    public Mono<Integer> acknowledgeAllOfType(String type) {
        return Mono.defer(() -> {
            long gen = generation.get();
            return apiClient.acknowledgeAll(tenantId, type)
                    .map(count -> {
                        apply(gen, s -> removeAllOfType(s, type));
                        log.info("Acknowledged {} notifications (type={})", count, type == null ? "all" : type);
                        return count;
                    })
                    .onErrorResume(e -> {
                        fail(gen, e, "Failed to acknowledge all notifications");
                        return Mono.just(0);
                    });
        });
    }

    /**
     * Run a remote action on a notification; success implies acknowledgment.
     * Unlike the other operations the returned Mono errors on failure so the caller can retry.
     */
    public Mono<Map<String, Object>> takeAction(long id, String actionType, Map<String, Object> params) {
        return Mono.defer(() -> {
            long gen = generation.get();
            apply(gen, s -> s.toBuilder().loading(true).error(null).build());
            return apiClient.takeAction(tenantId, id, actionType, params)
                    .map(this::toPayload)
                    .defaultIfEmpty(Map.of())
                    .doOnNext(result -> {
                        apply(gen, s -> removeOne(s, id).toBuilder().loading(false).build());
                        log.info("Action '{}' completed on notification {}", actionType, id);
                    })
                    .onErrorResume(e -> {
                        fail(gen, e, "Failed to take action on notification");
                        return Mono.error(e instanceof NotificationApiException
                                ? e
                                : new NotificationApiException("take action on notification", e));
                    });
        });
    }

    // ==================== Local mutations ====================

    /**
     * Add a notification delivered over the live transport.
     *
     * @return false when a notification with the same id is already held
     */
    public boolean append(Notification notification) {
        synchronized (lock) {
            NotificationState current = state;
            if (containsId(current.getNotifications(), notification.id())) {
                return false;
            }
            List<Notification> next = new ArrayList<>(current.getNotifications());
            next.add(0, notification);
            appendedAt.put(notification.id(), ++appendSequence);
            publish(current.toBuilder()
                    .notifications(List.copyOf(next))
                    .stats(current.getStats().afterAppend(notification))
                    .build());
            return true;
        }
    }

    /**
     * Scope subsequent remote calls to {@code tenantId}. Switching tenants clears the store.
     */
    public void bindTenant(String tenantId) {
        synchronized (lock) {
            if (!Objects.equals(this.tenantId, tenantId)) {
                if (this.tenantId != null) {
                    log.info("Notification store switching tenant {} -> {}", this.tenantId, tenantId);
                }
                this.tenantId = tenantId;
                generation.incrementAndGet();
                appendedAt.clear();
                publish(NotificationState.initial());
            }
        }
    }

    /**
     * Discard the results of every operation still in flight.
     */
    public void invalidatePending() {
        synchronized (lock) {
            generation.incrementAndGet();
            if (state.isLoading()) {
                publish(state.toBuilder().loading(false).build());
            }
        }
    }

    public void reset() {
        synchronized (lock) {
            generation.incrementAndGet();
            appendedAt.clear();
            publish(NotificationState.initial());
        }
    }

    public void clearError() {
        synchronized (lock) {
            if (state.getError() != null) {
                publish(state.toBuilder().error(null).build());
            }
        }
    }

    // ==================== Queries ====================

    public NotificationState getState() {
        return state;
    }

    public List<Notification> getNotifications() {
        return state.getNotifications();
    }

    public NotificationStats getStats() {
        return state.getStats();
    }

    public String getError() {
        return state.getError();
    }

    public boolean isLoading() {
        return state.isLoading();
    }

    public String getTenantId() {
        return tenantId;
    }

    public boolean contains(long id) {
        return containsId(state.getNotifications(), id);
    }

    /**
     * Stock related alerts: low stock, out of stock and persistent low stock.
     */
    public List<Notification> getStockAlerts() {
        return state.getNotifications().stream()
                .filter(Notification::isStockAlert)
                .toList();
    }

    /**
     * Whether any unacknowledged notification of {@code type} exists; any type when null.
     */
    public boolean hasUnacknowledged(String type) {
        List<Notification> notifications = state.getNotifications();
        if (type == null) {
            return !notifications.isEmpty();
        }
        return notifications.stream().anyMatch(n -> n.isOfType(type));
    }

    /**
     * Stream of snapshots: the current one on subscription, then one per change.
     */
    public Flux<NotificationState> changes() {
        return sink.asFlux();
    }

    // ==================== Internals ====================

    private boolean apply(long gen, UnaryOperator<NotificationState> mutation) {
        synchronized (lock) {
            if (gen != generation.get()) {
                log.debug("Discarding stale notification store update (generation {} != {})", gen, generation.get());
                return false;
            }
            publish(mutation.apply(state));
            return true;
        }
    }

    private long currentAppendMark() {
        synchronized (lock) {
            return appendSequence;
        }
    }

    /**
     * Snapshot plus the live entries appended after {@code appendMark} that it does not contain yet.
     * Called with {@code lock} held.
     */
    private List<Notification> mergeLiveAppends(List<Notification> current, List<Notification> fetched, long appendMark) {
        List<Notification> newer = current.stream()
                .filter(n -> appendedAt.getOrDefault(n.id(), 0L) > appendMark)
                .filter(n -> !containsId(fetched, n.id()))
                .toList();
        List<Notification> merged = fetched;
        if (!newer.isEmpty()) {
            log.debug("Keeping {} live notification(s) newer than the fetched snapshot", newer.size());
            List<Notification> combined = new ArrayList<>(newer);
            combined.addAll(fetched);
            merged = List.copyOf(combined);
        }
        Set<Long> heldIds = merged.stream().map(Notification::id).collect(Collectors.toSet());
        appendedAt.keySet().retainAll(heldIds);
        return merged;
    }

    private void fail(long gen, Throwable error, String fallback) {
        String message = ApiErrorMessages.describe(error, fallback);
        if (apply(gen, s -> s.toBuilder().loading(false).error(message).build())) {
            log.warn("{}", message);
        }
    }

    private void publish(NotificationState next) {
        state = next;
        Sinks.EmitResult result = sink.tryEmitNext(next);
        if (result.isFailure()) {
            log.warn("Failed to emit notification state: {}", result);
        }
    }

    private static NotificationState removeOne(NotificationState current, long id) {
        Notification removed = current.getNotifications().stream()
                .filter(n -> n.id() == id)
                .findFirst()
                .orElse(null);
        if (removed == null) {
            return current.toBuilder()
                    .stats(current.getStats().afterUnlistedAcknowledge())
                    .build();
        }
        List<Notification> remaining = current.getNotifications().stream()
                .filter(n -> n.id() != id)
                .toList();
        return current.toBuilder()
                .notifications(remaining)
                .stats(current.getStats().afterRemoval(removed, remaining))
                .build();
    }

    private static NotificationState removeAllOfType(NotificationState current, String type) {
        List<Notification> remaining = type == null
                ? List.of()
                : current.getNotifications().stream().filter(n -> !n.isOfType(type)).toList();
        return current.toBuilder()
                .notifications(remaining)
                .stats(current.getStats().afterBulkAcknowledge(type, remaining))
                .build();
    }

    private List<Notification> toNotifications(JsonNode body) {
        if (body == null || !body.isArray()) {
            log.warn("Notification API returned a non-array payload ({}), treating it as empty",
                    body == null ? "null" : body.getNodeType());
            return List.of();
        }
        Map<Long, Notification> byId = new LinkedHashMap<>();
        for (JsonNode node : body) {
            try {
                Notification notification = objectMapper.treeToValue(node, Notification.class);
                byId.putIfAbsent(notification.id(), notification);
            } catch (Exception e) {
                log.warn("Skipping malformed notification entry: {}", e.getMessage());
            }
        }
        return List.copyOf(byId.values());
    }

    private Map<String, Object> toPayload(JsonNode body) {
        if (body == null || !body.isObject()) {
            return Map.of();
        }
        return objectMapper.convertValue(body, PAYLOAD_TYPE);
    }

    private static boolean containsId(List<Notification> notifications, long id) {
        return notifications.stream().anyMatch(n -> n.id() == id);
    }
}
