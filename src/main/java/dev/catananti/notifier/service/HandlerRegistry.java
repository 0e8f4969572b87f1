package dev.catananti.notifier.service;

import dev.catananti.notifier.dto.NotificationEvent;
import dev.catananti.notifier.entity.EventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Event type to handler fan-out.
 * <p>
 * Registrations are keyed by owner so that one collaborator can withdraw its own handlers without
 * disturbing anyone else. Dispatch iterates a snapshot of the registrations, so changes made during
 * a dispatch only apply to the next one.
 * </p>
 */
@Component
@Slf4j
public class HandlerRegistry {

    private final Map<EventType, CopyOnWriteArrayList<Registration>> registrations = new ConcurrentHashMap<>();

    /**
     * Add {@code handler} for {@code type} on behalf of {@code owner}.
     * Registering the same handler twice for the same owner and type does nothing.
     *
     * @throws IllegalArgumentException when type, handler or owner is missing
     */
    public void register(EventType type, NotificationHandler handler, String owner) {
        if (type == null || handler == null) {
            throw new IllegalArgumentException("Event type and handler are required");
        }
        if (owner == null || owner.isBlank()) {
            throw new IllegalArgumentException("Handler owner is required");
        }
        Registration registration = new Registration(type, handler, owner);
        boolean added = registrations
                .computeIfAbsent(type, key -> new CopyOnWriteArrayList<>())
                .addIfAbsent(registration);
        if (added) {
            log.debug("Registered handler for {} (owner={})", type.value(), owner);
        }
    }

    /**
     * Remove one owner's registrations for {@code type}.
     *
     * @param handler the exact handler to remove, or null for every handler of the owner
     * @return number of registrations removed
     */
    public int unregister(EventType type, NotificationHandler handler, String owner) {
        List<Registration> handlers = registrations.get(type);
        if (handlers == null) {
            return 0;
        }
        List<Registration> matching = handlers.stream()
                .filter(r -> r.owner().equals(owner))
                .filter(r -> handler == null || r.handler() == handler)
                .toList();
        handlers.removeAll(matching);
        if (!matching.isEmpty()) {
            log.debug("Removed {} handler(s) for {} (owner={})", matching.size(), type.value(), owner);
        }
        return matching.size();
    }

    /**
     * Remove every registration of {@code owner}, across all event types.
     */
    public int unregisterAll(String owner) {
        int removed = 0;
        for (EventType type : registrations.keySet()) {
            removed += unregister(type, null, owner);
        }
        return removed;
    }

    /**
     * Invoke each handler registered for {@code type}, in registration order.
     * A handler that throws is logged and skipped; the remaining handlers still run.
     *
     * @return number of handlers that completed normally
     */
    public int dispatch(EventType type, NotificationEvent event) {
        List<Registration> handlers = registrations.get(type);
        if (handlers == null || handlers.isEmpty()) {
            log.debug("No handlers registered for {}", type.value());
            return 0;
        }
        int delivered = 0;
        for (Registration registration : handlers) {
            try {
                registration.handler().handle(event);
                delivered++;
            } catch (Exception e) {
                log.error("Handler for {} (owner={}) failed: {}",
                        type.value(), registration.owner(), e.getMessage(), e);
            }
        }
        return delivered;
    }

    public int handlerCount(EventType type) {
        List<Registration> handlers = registrations.get(type);
        return handlers == null ? 0 : handlers.size();
    }

    private record Registration(EventType type, NotificationHandler handler, String owner) {}
}
