package uk.gegc.readlater.features.label.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "LabelDto", description = "User-defined label attached to library items or highlights")
public record LabelDto(
        @Schema(description = "Label identifier", example = "a1b2c3d4-0000-0000-0000-000000000001")
        UUID id,

        @Schema(description = "Label name", example = "research")
        String name,

        @Schema(description = "Display color", example = "#7CFF7B")
        String color,

        @Schema(description = "Optional description")
        String description,

        @Schema(description = "Creation timestamp")
        Instant createdAt
) {
}
