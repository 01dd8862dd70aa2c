package uk.gegc.readlater.features.libraryitem.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.readlater.features.highlight.api.dto.HighlightDto;
import uk.gegc.readlater.features.label.api.dto.LabelDto;
import uk.gegc.readlater.features.libraryitem.domain.model.LibraryItemState;
import uk.gegc.readlater.features.libraryitem.domain.model.LibraryItemType;
import uk.gegc.readlater.features.recommendation.api.dto.RecommendationDto;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Schema(description = "Full library item with its related labels, highlights and recommendations")
public record LibraryItemDto(
        @Schema(description = "Item identifier", example = "5b0a3c9e-6f57-4f1c-9e77-0c4f0f5a7c11")
        UUID id,
        @Schema(description = "Owning user")
        UUID userId,
        @Schema(description = "Title", example = "World News")
        String title,
        @Schema(description = "URL the item was saved from", example = "https://example.com/world-news")
        String originalUrl,
        String slug,
        String description,
        String author,
        String siteName,
        String siteIcon,
        String thumbnail,
        LibraryItemType itemType,
        LibraryItemState state,
        @Schema(description = "Readable HTML content")
        String readableContent,
        String note,
        String subscription,
        String language,
        Integer wordCount,
        Double readingProgressTopPercent,
        Double readingProgressBottomPercent,
        Integer readingProgressHighestReadAnchor,
        Instant savedAt,
        Instant archivedAt,
        Instant deletedAt,
        Instant readAt,
        Instant publishedAt,
        Instant createdAt,
        Instant updatedAt,
        List<LabelDto> labels,
        @Schema(description = "Highlights; empty for lookups that do not load them")
        List<HighlightDto> highlights,
        @Schema(description = "Recommendations; loaded by URL lookups only")
        List<RecommendationDto> recommendations
) {
}
