package uk.gegc.readlater.features.libraryitem.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import uk.gegc.readlater.features.libraryitem.domain.model.LibraryItemState;

import java.time.Instant;

/**
 * Partial update; null fields are left unchanged.
 */
@Schema(description = "Partial update of a library item; omitted fields are left unchanged")
public record LibraryItemUpdateRequest(
        String title,
        String slug,
        String description,
        String author,
        String siteName,
        String thumbnail,
        String note,
        String subscription,

        @Schema(description = "New state; archive and delete timestamps are derived from it", example = "ARCHIVED")
        LibraryItemState state,

        @DecimalMin(value = "0.0", message = "readingProgressTopPercent must be between 0 and 100")
        @DecimalMax(value = "100.0", message = "readingProgressTopPercent must be between 0 and 100")
        Double readingProgressTopPercent,

        @DecimalMin(value = "0.0", message = "readingProgressBottomPercent must be between 0 and 100")
        @DecimalMax(value = "100.0", message = "readingProgressBottomPercent must be between 0 and 100")
        Double readingProgressBottomPercent,

        @Min(value = 0, message = "readingProgressHighestReadAnchor must not be negative")
        Integer readingProgressHighestReadAnchor,

        @Min(value = 0, message = "wordCount must not be negative")
        Integer wordCount,

        Instant savedAt,
        Instant readAt,
        Instant publishedAt
) {
}
