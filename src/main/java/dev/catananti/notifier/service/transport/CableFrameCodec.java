package dev.catananti.notifier.service.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.catananti.notifier.dto.NotificationEnvelope;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes ActionCable frames.
 * <p>
 * Control frames carry a top-level {@code type} ({@code welcome}, {@code ping},
 * {@code confirm_subscription}, {@code reject_subscription}, {@code disconnect}). Channel broadcasts
 * arrive as {@code {"identifier": "...", "message": {"type": ..., "data": {...}}}}. Older broadcasts put
 * the payload under {@code order} or {@code item}; those are folded into {@code data}.
 * </p>
 */
@Component
@RequiredArgsConstructor
public class CableFrameCodec {

    public static final List<String> CHANNELS = List.of("OrderChannel", "InventoryChannel");

    private static final List<String> LEGACY_PAYLOAD_FIELDS = List.of("order", "item");
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public enum Kind {
        WELCOME,
        PING,
        CONFIRM_SUBSCRIPTION,
        REJECT_SUBSCRIPTION,
        DISCONNECT,
        MESSAGE,
        MALFORMED,
        UNKNOWN
    }

    /**
     * A decoded frame. {@code envelope} is set for {@link Kind#MESSAGE} only; {@code detail} holds the
     * channel identifier, disconnect reason or parse error when there is one.
     */
    public record CableFrame(Kind kind, NotificationEnvelope envelope, String detail) {

        static CableFrame of(Kind kind, String detail) {
            return new CableFrame(kind, null, detail);
        }
    }

    public CableFrame decode(String text) {
        JsonNode root;
        try {
            root = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            return CableFrame.of(Kind.MALFORMED, e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            return CableFrame.of(Kind.MALFORMED, "frame is not a JSON object");
        }

        String identifier = root.path("identifier").asText(null);
        String type = root.path("type").asText(null);
        if (type != null) {
            switch (type) {
                case "welcome":
                    return CableFrame.of(Kind.WELCOME, null);
                case "ping":
                    return CableFrame.of(Kind.PING, null);
                case "confirm_subscription":
                    return CableFrame.of(Kind.CONFIRM_SUBSCRIPTION, identifier);
                case "reject_subscription":
                    return CableFrame.of(Kind.REJECT_SUBSCRIPTION, identifier);
                case "disconnect":
                    return CableFrame.of(Kind.DISCONNECT, root.path("reason").asText("unspecified"));
                default:
                    break;
            }
        }

        JsonNode message = root.get("message");
        if (message != null && message.isObject()) {
            return toMessage(message);
        }
        if (identifier == null && type != null) {
            return toMessage(root);
        }
        return CableFrame.of(Kind.UNKNOWN, type);
    }

    public String subscribe(String channel, String tenantId) {
        Map<String, Object> identifier = new LinkedHashMap<>();
        identifier.put("channel", channel);
        identifier.put("restaurant_id", tenantId);

        Map<String, Object> command = new LinkedHashMap<>();
        command.put("command", "subscribe");
        command.put("identifier", write(identifier));
        return write(command);
    }

    public String pong() {
        return write(Map.of("type", "pong"));
    }

    private CableFrame toMessage(JsonNode message) {
        String type = message.path("type").asText(null);
        if (type == null) {
            return CableFrame.of(Kind.UNKNOWN, null);
        }
        JsonNode payload = message.get("data");
        if (payload == null || !payload.isObject()) {
            payload = LEGACY_PAYLOAD_FIELDS.stream()
                    .map(message::get)
                    .filter(node -> node != null && node.isObject())
                    .findFirst()
                    .orElse(null);
        }
        Map<String, Object> data = payload == null ? Map.of() : objectMapper.convertValue(payload, MAP_TYPE);
        return new CableFrame(Kind.MESSAGE, new NotificationEnvelope(type, data), null);
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode cable command", e);
        }
    }
}
