package dev.catananti.notifier.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Optional;

/**
 * An unacknowledged notification as held by the store.
 * Acknowledgment is not modelled: a notification that left the store is acknowledged.
 */
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Notification(
        @JsonProperty("id") long id,
        @JsonProperty("notification_type") String notificationType,
        @JsonProperty("title") String title,
        @JsonProperty("body") String body,
        @JsonProperty("resource_type") String resourceType,
        @JsonProperty("resource_id") String resourceId,
        @JsonProperty("admin_path") String adminPath,
        @JsonProperty("metadata") Map<String, Object> metadata,
        @JsonProperty("created_at") OffsetDateTime createdAt
) {

    public Optional<NotificationType> knownType() {
        return NotificationType.fromValue(notificationType);
    }

    public boolean isOfType(String type) {
        return type != null && type.equals(notificationType);
    }

    /**
     * True when the type has a dedicated counter; other types only count towards the total.
     */
    @JsonIgnore
    public boolean isTracked() {
        return knownType().map(NotificationType::isTracked).orElse(false);
    }

    @JsonIgnore
    public boolean isStockAlert() {
        return knownType().map(NotificationType::isStockAlert).orElse(false);
    }
}
