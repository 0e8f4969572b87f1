package dev.catananti.notifier.service;

import dev.catananti.notifier.dto.NotificationEvent;

/**
 * Callback registered for one event type. Runs on the delivery thread and should return quickly.
 */
@FunctionalInterface
public interface NotificationHandler {

    void handle(NotificationEvent event);
}
