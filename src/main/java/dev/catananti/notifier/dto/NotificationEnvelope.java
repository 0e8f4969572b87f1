package dev.catananti.notifier.dto;

import java.util.Map;

/**
 * Application-level message carried by the cable transport: {@code {type, data}}.
 */
public record NotificationEnvelope(
        String type,
        Map<String, Object> data
) {

    public NotificationEnvelope {
        data = data == null ? Map.of() : data;
    }
}
