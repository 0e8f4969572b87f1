package dev.catananti.notifier.entity;

import java.util.Arrays;
import java.util.Optional;

/**
 * Event types delivered over the cable transport. Anything else is dropped on arrival.
 */
public enum EventType {
    NEW_ORDER("new_order", NotificationType.ORDER),
    ORDER_UPDATED("order_updated", NotificationType.ORDER),
    LOW_STOCK("low_stock", NotificationType.LOW_STOCK),
    OUT_OF_STOCK("out_of_stock", NotificationType.OUT_OF_STOCK);

    private final String value;
    private final NotificationType defaultNotificationType;

    EventType(String value, NotificationType defaultNotificationType) {
        this.value = value;
        this.defaultNotificationType = defaultNotificationType;
    }

    public String value() {
        return value;
    }

    /**
     * Notification bucket used when the event payload does not name one.
     */
    public NotificationType defaultNotificationType() {
        return defaultNotificationType;
    }

    public static Optional<EventType> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(type -> type.value.equals(value))
                .findFirst();
    }
}
