package dev.catananti.notifier.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.catananti.notifier.entity.NotificationStats;

import java.time.OffsetDateTime;

/**
 * Body of {@code GET /notifications/stats} on the restaurant API.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NotificationStatsResponse(
        @JsonProperty("order_count") Long orderCount,
        @JsonProperty("low_stock_count") Long lowStockCount,
        @JsonProperty("out_of_stock_count") Long outOfStockCount,
        @JsonProperty("total_count") Long totalCount,
        @JsonProperty("oldest_notification_date") OffsetDateTime oldestNotificationDate
) {

    public NotificationStats toStats() {
        return NotificationStats.builder()
                .orderCount(nonNegative(orderCount))
                .lowStockCount(nonNegative(lowStockCount))
                .outOfStockCount(nonNegative(outOfStockCount))
                .totalCount(nonNegative(totalCount))
                .oldestNotificationDate(oldestNotificationDate)
                .build();
    }

    private static long nonNegative(Long value) {
        return value == null ? 0 : Math.max(0, value);
    }
}
