package dev.catananti.notifier.dto;

import dev.catananti.notifier.entity.EventType;
import dev.catananti.notifier.entity.Notification;

import java.time.Instant;
import java.util.Map;

/**
 * Event handed to registered handlers.
 * {@code notification} is null when the payload carried no notification id.
 */
public record NotificationEvent(
        EventType type,
        Map<String, Object> data,
        Notification notification,
        Instant receivedAt
) {}
