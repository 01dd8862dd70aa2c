package uk.gegc.readlater.features.libraryitem.infra.mapping;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.readlater.features.highlight.api.dto.HighlightDto;
import uk.gegc.readlater.features.highlight.infra.mapping.HighlightMapper;
import uk.gegc.readlater.features.label.api.dto.LabelDto;
import uk.gegc.readlater.features.label.infra.mapping.LabelMapper;
import uk.gegc.readlater.features.libraryitem.api.dto.LibraryItemCreateRequest;
import uk.gegc.readlater.features.libraryitem.api.dto.LibraryItemDto;
import uk.gegc.readlater.features.libraryitem.api.dto.LibraryItemListItemDto;
import uk.gegc.readlater.features.libraryitem.api.dto.LibraryItemUpdateRequest;
import uk.gegc.readlater.features.libraryitem.application.LibraryItemPatch;
import uk.gegc.readlater.features.libraryitem.domain.model.LibraryItem;
import uk.gegc.readlater.features.libraryitem.domain.model.LibraryItemState;
import uk.gegc.readlater.features.libraryitem.domain.model.LibraryItemType;
import uk.gegc.readlater.features.recommendation.infra.mapping.RecommendationMapper;
import uk.gegc.readlater.shared.exception.ValidationException;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

@Component
@RequiredArgsConstructor
public class LibraryItemMapper {

    private final LabelMapper labelMapper;
    private final HighlightMapper highlightMapper;
    private final RecommendationMapper recommendationMapper;

    public LibraryItem toEntity(LibraryItemCreateRequest request, UUID userId, Instant now) {
        if (request == null) {
            throw new ValidationException("Request body is required");
        }
        LibraryItem item = new LibraryItem();
        item.setUserId(userId);
        item.setTitle(request.title().trim());
        item.setOriginalUrl(request.originalUrl().trim());
        item.setSlug(request.slug());
        item.setDescription(request.description());
        item.setAuthor(request.author());
        item.setSiteName(request.siteName());
        item.setSiteIcon(request.siteIcon());
        item.setThumbnail(request.thumbnail());
        item.setItemType(request.itemType() != null ? request.itemType() : LibraryItemType.UNKNOWN);
        item.setState(request.state() != null ? request.state() : LibraryItemState.SUCCEEDED);
        item.setReadableContent(request.readableContent());
        item.setNote(request.note());
        item.setSubscription(request.subscription());
        item.setLanguage(request.language());
        item.setWordCount(request.wordCount());
        item.setSavedAt(request.savedAt() != null ? request.savedAt() : now);
        item.setPublishedAt(request.publishedAt());
        return item;
    }

    public LibraryItemPatch toPatch(LibraryItemUpdateRequest request) {
        if (request == null) {
            throw new ValidationException("Request body is required");
        }
        return LibraryItemPatch.builder()
                .title(request.title())
                .slug(request.slug())
                .description(request.description())
                .author(request.author())
                .siteName(request.siteName())
                .thumbnail(request.thumbnail())
                .note(request.note())
                .subscription(request.subscription())
                .state(request.state())
                .readingProgressTopPercent(request.readingProgressTopPercent())
                .readingProgressBottomPercent(request.readingProgressBottomPercent())
                .readingProgressHighestReadAnchor(request.readingProgressHighestReadAnchor())
                .wordCount(request.wordCount())
                .savedAt(request.savedAt())
                .readAt(request.readAt())
                .publishedAt(request.publishedAt())
                .build();
    }

    /**
     * Copies the non-null fields of {@code patch}. State-derived timestamps are not touched here.
     */
    public void applyPatch(LibraryItem target, LibraryItemPatch patch) {
        if (patch.title() != null) {
            target.setTitle(patch.title());
        }
        if (patch.slug() != null) {
            target.setSlug(patch.slug());
        }
        if (patch.description() != null) {
            target.setDescription(patch.description());
        }
        if (patch.author() != null) {
            target.setAuthor(patch.author());
        }
        if (patch.siteName() != null) {
            target.setSiteName(patch.siteName());
        }
        if (patch.thumbnail() != null) {
            target.setThumbnail(patch.thumbnail());
        }
        if (patch.note() != null) {
            target.setNote(patch.note());
        }
        if (patch.subscription() != null) {
            target.setSubscription(patch.subscription());
        }
        if (patch.state() != null) {
            target.setState(patch.state());
        }
        if (patch.readingProgressTopPercent() != null) {
            target.setReadingProgressTopPercent(patch.readingProgressTopPercent());
        }
        if (patch.readingProgressBottomPercent() != null) {
            target.setReadingProgressBottomPercent(patch.readingProgressBottomPercent());
        }
        if (patch.readingProgressHighestReadAnchor() != null) {
            target.setReadingProgressHighestReadAnchor(patch.readingProgressHighestReadAnchor());
        }
        if (patch.wordCount() != null) {
            target.setWordCount(patch.wordCount());
        }
        if (patch.savedAt() != null) {
            target.setSavedAt(patch.savedAt());
        }
        if (patch.readAt() != null) {
            target.setReadAt(patch.readAt());
        }
        if (patch.publishedAt() != null) {
            target.setPublishedAt(patch.publishedAt());
        }
    }

    public LibraryItemListItemDto toListItem(LibraryItem item) {
        if (item == null) {
            return null;
        }
        return new LibraryItemListItemDto(
                item.getId(),
                item.getTitle(),
                item.getOriginalUrl(),
                item.getSlug(),
                item.getDescription(),
                item.getAuthor(),
                item.getSiteName(),
                item.getSiteIcon(),
                item.getThumbnail(),
                item.getItemType(),
                item.getState(),
                item.getSubscription(),
                item.getWordCount(),
                item.getReadingProgressTopPercent(),
                item.getReadingProgressBottomPercent(),
                item.getSavedAt(),
                item.getArchivedAt(),
                item.getDeletedAt(),
                item.getReadAt(),
                item.getPublishedAt(),
                item.getUpdatedAt(),
                labels(item),
                item.getRecommenderNames() != null ? List.copyOf(item.getRecommenderNames()) : List.of()
        );
    }

    /**
     * Maps the item with labels and highlights; recommendations are left empty.
     */
    public LibraryItemDto toDto(LibraryItem item) {
        return toDto(item, false);
    }

    public LibraryItemDto toDtoWithRecommendations(LibraryItem item) {
        return toDto(item, true);
    }

    private LibraryItemDto toDto(LibraryItem item, boolean withRecommendations) {
        if (item == null) {
            return null;
        }
        return new LibraryItemDto(
                item.getId(),
                item.getUserId(),
                item.getTitle(),
                item.getOriginalUrl(),
                item.getSlug(),
                item.getDescription(),
                item.getAuthor(),
                item.getSiteName(),
                item.getSiteIcon(),
                item.getThumbnail(),
                item.getItemType(),
                item.getState(),
                item.getReadableContent(),
                item.getNote(),
                item.getSubscription(),
                item.getLanguage(),
                item.getWordCount(),
                item.getReadingProgressTopPercent(),
                item.getReadingProgressBottomPercent(),
                item.getReadingProgressHighestReadAnchor(),
                item.getSavedAt(),
                item.getArchivedAt(),
                item.getDeletedAt(),
                item.getReadAt(),
                item.getPublishedAt(),
                item.getCreatedAt(),
                item.getUpdatedAt(),
                labels(item),
                item.getHighlights() != null ? highlightMapper.toDtos(item.getHighlights()).stream()
                        .sorted(Comparator.comparing(HighlightDto::createdAt, Comparator.nullsLast(Comparator.naturalOrder())))
                        .toList() : List.of(),
                withRecommendations && item.getRecommendations() != null
                        ? recommendationMapper.toDtos(item.getRecommendations()) : List.of()
        );
    }

    private List<LabelDto> labels(LibraryItem item) {
        if (item.getLabels() == null || item.getLabels().isEmpty()) {
            return List.of();
        }
        return labelMapper.toDtos(item.getLabels()).stream()
                .sorted(Comparator.comparing(LabelDto::name, String.CASE_INSENSITIVE_ORDER))
                .toList();
    }
}
