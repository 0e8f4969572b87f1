package dev.catananti.notifier.entity;

import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.Comparator;
import java.util.Objects;

/**
 * Aggregate counters over unacknowledged notifications.
 * <p>
 * {@code totalCount} equals the three bucket counters plus any notifications whose
 * type has no bucket of its own. Counters never go below zero.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class NotificationStats {

    @Builder.Default
    long orderCount = 0;

    @Builder.Default
    long lowStockCount = 0;

    @Builder.Default
    long outOfStockCount = 0;

    @Builder.Default
    long totalCount = 0;

    OffsetDateTime oldestNotificationDate;

    public static NotificationStats empty() {
        return NotificationStats.builder().build();
    }

    public long trackedCount() {
        return orderCount + lowStockCount + outOfStockCount;
    }

    /**
     * Stats after a newly delivered notification was added.
     */
    public NotificationStats afterAppend(Notification notification) {
        NotificationStatsBuilder next = adjustBucket(toBuilder(), notification.notificationType(), 1)
                .totalCount(totalCount + 1);
        OffsetDateTime created = notification.createdAt();
        if (created != null && (oldestNotificationDate == null || created.isBefore(oldestNotificationDate))) {
            next.oldestNotificationDate(created);
        }
        return next.build();
    }

    /**
     * Stats after a single known notification was acknowledged.
     */
    public NotificationStats afterRemoval(Notification removed, Collection<Notification> remaining) {
        NotificationStats next = adjustBucket(toBuilder(), removed.notificationType(), -1)
                .totalCount(Math.max(0, totalCount - 1))
                .build();
        return next.withOldestFrom(remaining);
    }

    /**
     * Stats after the server acknowledged a notification the local list does not hold.
     * Its bucket is unknown, so only the total moves.
     */
    public NotificationStats afterUnlistedAcknowledge() {
        return toBuilder().totalCount(Math.max(0, totalCount - 1)).build();
    }

    /**
     * Stats after a bulk acknowledgment. A {@code null} type resets every bucket.
     * The total is rebuilt from the remaining buckets plus remaining untracked entries.
     */
    public NotificationStats afterBulkAcknowledge(String type, Collection<Notification> remaining) {
        NotificationStatsBuilder next = toBuilder();
        if (type == null) {
            next.orderCount(0).lowStockCount(0).outOfStockCount(0);
        } else {
            NotificationType.fromValue(type).ifPresent(known -> {
                switch (known) {
                    case ORDER -> next.orderCount(0);
                    case LOW_STOCK -> next.lowStockCount(0);
                    case OUT_OF_STOCK -> next.outOfStockCount(0);
                    default -> { }
                }
            });
        }
        NotificationStats reset = next.build();
        long untracked = remaining.stream().filter(n -> !n.isTracked()).count();
        return reset.toBuilder()
                .totalCount(reset.trackedCount() + untracked)
                .build()
                .withOldestFrom(remaining);
    }

    private NotificationStats withOldestFrom(Collection<Notification> remaining) {
        OffsetDateTime oldest = remaining.stream()
                .map(Notification::createdAt)
                .filter(Objects::nonNull)
                .min(Comparator.naturalOrder())
                .orElse(null);
        if (oldest != null) {
            return toBuilder().oldestNotificationDate(oldest).build();
        }
        if (totalCount == 0) {
            return toBuilder().oldestNotificationDate(null).build();
        }
        return this;
    }

    private NotificationStatsBuilder adjustBucket(NotificationStatsBuilder builder, String type, int delta) {
        NotificationType.fromValue(type).ifPresent(known -> {
            switch (known) {
                case ORDER -> builder.orderCount(Math.max(0, orderCount + delta));
                case LOW_STOCK -> builder.lowStockCount(Math.max(0, lowStockCount + delta));
                case OUT_OF_STOCK -> builder.outOfStockCount(Math.max(0, outOfStockCount + delta));
                default -> { }
            }
        });
        return builder;
    }
}
