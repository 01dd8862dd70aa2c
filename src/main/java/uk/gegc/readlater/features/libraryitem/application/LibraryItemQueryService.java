package uk.gegc.readlater.features.libraryitem.application;

import uk.gegc.readlater.features.libraryitem.api.dto.LibraryItemDto;
import uk.gegc.readlater.features.libraryitem.api.dto.LibraryItemListItemDto;
import uk.gegc.readlater.features.libraryitem.api.dto.LibraryItemSearchCriteria;
import uk.gegc.readlater.features.libraryitem.api.dto.LibraryItemSearchResult;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read side of the library: filtered search and point lookups, always scoped to one user.
 */
public interface LibraryItemQueryService {

    /**
     * Returns one page of matching items together with the total number of matches.
     * Both reads share one transaction snapshot.
     */
    LibraryItemSearchResult searchLibraryItems(LibraryItemSearchCriteria criteria, UUID userId);

    /**
     * Looks up an item with its labels, highlights and highlight authors.
     */
    Optional<LibraryItemDto> getLibraryItem(UUID id, UUID userId);

    /**
     * Looks up an item by the URL it was saved from, with labels, highlights and recommendations.
     * When the URL was saved more than once the most recently saved item wins.
     */
    Optional<LibraryItemDto> findLibraryItemByUrl(String url, UUID userId);

    /**
     * Case-insensitive prefix match on title or site name, newest saves first.
     *
     * @param limit maximum number of results, 1 to the configured maximum; null for the configured default
     */
    List<LibraryItemListItemDto> findLibraryItemsByPrefix(String prefix, UUID userId, Integer limit);

    /**
     * Counts items created in {@code [start, end]}; an open start means epoch and an open end means now.
     */
    long countByCreatedAt(UUID userId, Instant start, Instant end);
}
