package dev.catananti.notifier.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Request DTO for taking an action on a notification (e.g. restocking an item).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Action to perform on a notification")
public class ActionRequest {

    @NotBlank(message = "Action type is required")
    @Pattern(regexp = "^[a-z_]{1,50}$", message = "Action type must be lowercase snake_case")
    @Schema(description = "Action identifier understood by the restaurant API", example = "restock")
    private String actionType;

    @Schema(description = "Action-specific parameters", example = "{\"quantity\": 25}")
    @Builder.Default
    private Map<String, Object> params = new HashMap<>();
}
