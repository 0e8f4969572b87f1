package dev.catananti.notifier.dto;

import dev.catananti.notifier.entity.DeliveryState;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Delivery session status exposed to UI collaborators.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Notification delivery session status")
public class SessionStatusResponse {

    @Schema(description = "Tenant (restaurant) the session is bound to", example = "rest-42")
    private String tenantId;

    @Schema(description = "Delivery state", example = "LIVE")
    private DeliveryState state;

    @Schema(description = "Whether the live transport is currently open", example = "true")
    private boolean connected;

    @Schema(description = "Whether the polling fallback is running", example = "false")
    private boolean polling;

    @Schema(description = "Last transport or wiring error, if any")
    private String connectionError;

    @Schema(description = "Last data fetch error, if any")
    private String error;
}
