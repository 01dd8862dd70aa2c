package uk.gegc.readlater.features.libraryitem.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.readlater.features.label.api.dto.LabelDto;
import uk.gegc.readlater.features.libraryitem.domain.model.LibraryItemState;
import uk.gegc.readlater.features.libraryitem.domain.model.LibraryItemType;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Schema(description = "Library item as returned by search and prefix lookups")
public record LibraryItemListItemDto(
        UUID id,
        String title,
        String originalUrl,
        String slug,
        String description,
        String author,
        String siteName,
        String siteIcon,
        String thumbnail,
        LibraryItemType itemType,
        LibraryItemState state,
        String subscription,
        Integer wordCount,
        Double readingProgressTopPercent,
        Double readingProgressBottomPercent,
        Instant savedAt,
        Instant archivedAt,
        Instant deletedAt,
        Instant readAt,
        Instant publishedAt,
        Instant updatedAt,
        @Schema(description = "Labels attached to the item")
        List<LabelDto> labels,
        @Schema(description = "Names of users who recommended the item")
        List<String> recommenderNames
) {
}
