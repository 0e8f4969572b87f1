package dev.catananti.notifier.entity;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Immutable snapshot published by the notification store after every change.
 */
@Value
@Builder(toBuilder = true)
public class NotificationState {

    @Builder.Default
    List<Notification> notifications = List.of();

    @Builder.Default
    NotificationStats stats = NotificationStats.empty();

    boolean loading;

    String error;

    public static NotificationState initial() {
        return NotificationState.builder().build();
    }
}
