package uk.gegc.readlater.features.libraryitem.application;

import lombok.Builder;
import uk.gegc.readlater.features.libraryitem.domain.model.LibraryItemState;

import java.time.Instant;

/**
 * Fields to change on a library item. A null component means "leave as is".
 */
@Builder(toBuilder = true)
public record LibraryItemPatch(
        String title,
        String slug,
        String description,
        String author,
        String siteName,
        String thumbnail,
        String note,
        String subscription,
        LibraryItemState state,
        Double readingProgressTopPercent,
        Double readingProgressBottomPercent,
        Integer readingProgressHighestReadAnchor,
        Integer wordCount,
        Instant savedAt,
        Instant readAt,
        Instant publishedAt
) {
}
