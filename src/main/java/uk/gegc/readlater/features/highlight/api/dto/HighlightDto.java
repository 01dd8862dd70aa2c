package uk.gegc.readlater.features.highlight.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.readlater.features.label.api.dto.LabelDto;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Schema(name = "HighlightDto", description = "Annotation a user made on a library item")
public record HighlightDto(
        @Schema(description = "Highlight identifier")
        UUID id,

        @Schema(description = "Highlighted text")
        String quote,

        @Schema(description = "Free-form note attached to the highlight")
        String annotation,

        @Schema(description = "Identifier of the highlight author")
        UUID authorId,

        @Schema(description = "Display name of the highlight author")
        String authorName,

        @Schema(description = "Labels attached to the highlight")
        List<LabelDto> labels,

        @Schema(description = "Creation timestamp")
        Instant createdAt,

        @Schema(description = "Last update timestamp")
        Instant updatedAt
) {
}
