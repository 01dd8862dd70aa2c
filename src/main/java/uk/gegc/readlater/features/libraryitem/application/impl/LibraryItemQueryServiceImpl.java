package uk.gegc.readlater.features.libraryitem.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import uk.gegc.readlater.features.libraryitem.api.dto.LibraryItemDto;
import uk.gegc.readlater.features.libraryitem.api.dto.LibraryItemListItemDto;
import uk.gegc.readlater.features.libraryitem.api.dto.LibraryItemSearchCriteria;
import uk.gegc.readlater.features.libraryitem.api.dto.LibraryItemSearchCriteria.SearchSort;
import uk.gegc.readlater.features.libraryitem.api.dto.LibraryItemSearchResult;
import uk.gegc.readlater.features.libraryitem.application.LibraryItemQueryService;
import uk.gegc.readlater.features.libraryitem.config.LibraryProperties;
import uk.gegc.readlater.features.libraryitem.domain.model.LibraryItem;
import uk.gegc.readlater.features.libraryitem.domain.model.search.SortBy;
import uk.gegc.readlater.features.libraryitem.domain.model.search.SortOrder;
import uk.gegc.readlater.features.libraryitem.domain.repository.LibraryItemRepository;
import uk.gegc.readlater.features.libraryitem.domain.repository.query.LibraryItemPredicates;
import uk.gegc.readlater.features.libraryitem.domain.repository.query.LibraryItemQuery;
import uk.gegc.readlater.features.libraryitem.infra.mapping.LibraryItemMapper;
import uk.gegc.readlater.shared.exception.ValidationException;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

import static uk.gegc.readlater.features.libraryitem.domain.repository.query.LibraryItemQuery.column;

@Service
@Transactional(readOnly = true)
@RequiredArgsConstructor
@Slf4j
public class LibraryItemQueryServiceImpl implements LibraryItemQueryService {

    private static final char LIKE_ESCAPE = '!';

    private final LibraryItemRepository libraryItemRepository;
    private final LibraryItemPredicates libraryItemPredicates;
    private final LibraryItemMapper libraryItemMapper;
    private final LibraryProperties libraryProperties;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public LibraryItemSearchResult searchLibraryItems(LibraryItemSearchCriteria criteria, UUID userId) {
        LibraryItemSearchCriteria effective = criteria != null ? criteria : LibraryItemSearchCriteria.empty();
        int from = resolveFrom(effective.from());
        int size = resolveSize(effective.size());

        LibraryItemQuery query = LibraryItemQuery.forUser(userId);
        libraryItemPredicates.apply(effective, query, clock.instant());
        applySort(query, effective.sort());

        List<LibraryItem> items = libraryItemRepository.findPage(query, from, size);
        long count = libraryItemRepository.countMatching(query);
        log.debug("Search for user {} returned {} of {} items (from={}, size={})", userId, items.size(), count, from, size);

        return new LibraryItemSearchResult(
                items.stream().map(libraryItemMapper::toListItem).toList(),
                count,
                from,
                size
        );
    }

    @Override
    public Optional<LibraryItemDto> getLibraryItem(UUID id, UUID userId) {
        return libraryItemRepository.findByIdAndUserId(id, userId)
                .map(libraryItemMapper::toDto);
    }

    @Override
    public Optional<LibraryItemDto> findLibraryItemByUrl(String url, UUID userId) {
        if (!StringUtils.hasText(url)) {
            throw new ValidationException("url is required");
        }
        return libraryItemRepository.findFirstByOriginalUrlAndUserIdOrderBySavedAtDesc(url.trim(), userId)
                .map(libraryItemMapper::toDtoWithRecommendations);
    }

    @Override
    public List<LibraryItemListItemDto> findLibraryItemsByPrefix(String prefix, UUID userId, Integer limit) {
        if (!StringUtils.hasText(prefix)) {
            throw new ValidationException("prefix is required");
        }
        int effectiveLimit = resolvePrefixLimit(limit);
        String pattern = escapeLike(prefix.trim().toLowerCase(Locale.ROOT)) + "%";
        return libraryItemRepository.findByTitleOrSiteNamePrefix(userId, pattern, PageRequest.of(0, effectiveLimit))
                .stream()
                .map(libraryItemMapper::toListItem)
                .toList();
    }

    @Override
    public long countByCreatedAt(UUID userId, Instant start, Instant end) {
        Instant effectiveStart = start != null ? start : Instant.EPOCH;
        Instant effectiveEnd = end != null ? end : clock.instant();
        if (effectiveStart.isAfter(effectiveEnd)) {
            throw new ValidationException("startDate must not be after endDate");
        }
        return libraryItemRepository.countByUserIdAndCreatedAtBetween(userId, effectiveStart, effectiveEnd);
    }

    private int resolveFrom(Integer from) {
        if (from == null) {
            return 0;
        }
        if (from < 0) {
            throw new ValidationException("from must not be negative");
        }
        return from;
    }

    private int resolveSize(Integer size) {
        LibraryProperties.Search search = libraryProperties.getSearch();
        if (size == null) {
            return search.getDefaultPageSize();
        }
        if (size < 1 || size > search.getMaxPageSize()) {
            throw new ValidationException("size must be between 1 and " + search.getMaxPageSize());
        }
        return size;
    }

    private int resolvePrefixLimit(Integer limit) {
        LibraryProperties.PrefixSearch prefixSearch = libraryProperties.getPrefixSearch();
        if (limit == null) {
            return prefixSearch.getDefaultLimit();
        }
        if (limit < 1 || limit > prefixSearch.getMaxLimit()) {
            throw new ValidationException("limit must be between 1 and " + prefixSearch.getMaxLimit());
        }
        return limit;
    }

    /**
     * Adds the requested ordering after any relevance ordering, then the id as a stable tie-breaker.
     */
    private void applySort(LibraryItemQuery query, SearchSort sort) {
        SortBy by = sort != null && sort.by() != null ? sort.by() : SortBy.SAVED;
        SortOrder order = sort != null && sort.order() != null ? sort.order() : SortOrder.DESC;
        query.orderBy(column(by.column()) + " " + order.name() + " NULLS LAST");
        query.orderBy(column("id") + " " + order.name());
    }

    static String escapeLike(String value) {
        StringBuilder escaped = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            if (c == LIKE_ESCAPE || c == '%' || c == '_') {
                escaped.append(LIKE_ESCAPE);
            }
            escaped.append(c);
        }
        return escaped.toString();
    }
}
