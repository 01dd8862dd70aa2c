package uk.gegc.readlater.features.libraryitem.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import uk.gegc.readlater.features.libraryitem.domain.model.LibraryItemState;
import uk.gegc.readlater.features.libraryitem.domain.model.LibraryItemType;

import java.time.Instant;

@Schema(description = "Payload for saving a new library item")
public record LibraryItemCreateRequest(
        @Schema(description = "Title", example = "World News")
        @NotBlank(message = "title is required")
        @Size(max = 2048, message = "title must not exceed 2048 characters")
        String title,

        @Schema(description = "URL the item was saved from", example = "https://example.com/world-news")
        @NotBlank(message = "originalUrl is required")
        @Size(max = 4096, message = "originalUrl must not exceed 4096 characters")
        String originalUrl,

        @Schema(description = "URL-safe slug", example = "world-news")
        String slug,

        @Schema(description = "Short description")
        String description,

        @Schema(description = "Author byline", example = "Jane Doe")
        String author,

        @Schema(description = "Site name", example = "Wonder Times")
        String siteName,

        String siteIcon,

        String thumbnail,

        @Schema(description = "Item type", defaultValue = "UNKNOWN", example = "ARTICLE")
        LibraryItemType itemType,

        @Schema(description = "Initial state", defaultValue = "SUCCEEDED", example = "PROCESSING")
        LibraryItemState state,

        @Schema(description = "Readable HTML content; used to compute the word count when none is given")
        String readableContent,

        String note,

        @Schema(description = "Subscription (feed or newsletter) the item arrived through")
        String subscription,

        @Schema(description = "Content language", example = "en")
        String language,

        @Schema(description = "Word count; computed from readable content when omitted")
        @Min(value = 0, message = "wordCount must not be negative")
        Integer wordCount,

        @Schema(description = "Save timestamp; defaults to now")
        Instant savedAt,

        @Schema(description = "Original publication timestamp")
        Instant publishedAt
) {
}
