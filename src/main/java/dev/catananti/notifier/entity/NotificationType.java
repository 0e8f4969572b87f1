package dev.catananti.notifier.entity;

import java.util.Arrays;
import java.util.Optional;

/**
 * Known notification types as emitted by the restaurant API.
 * The remote source may send other values; those are kept as plain strings and
 * only count towards the total.
 */
public enum NotificationType {
    ORDER("order"),
    LOW_STOCK("low_stock"),
    OUT_OF_STOCK("out_of_stock"),
    PERSISTENT_LOW_STOCK("persistent_low_stock");

    private final String value;

    NotificationType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Whether notifications of this type have their own counter in {@link NotificationStats}.
     */
    public boolean isTracked() {
        return this == ORDER || this == LOW_STOCK || this == OUT_OF_STOCK;
    }

    public boolean isStockAlert() {
        return this == LOW_STOCK || this == OUT_OF_STOCK || this == PERSISTENT_LOW_STOCK;
    }

    public static Optional<NotificationType> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(type -> type.value.equals(value))
                .findFirst();
    }
}
