package uk.gegc.readlater.features.libraryitem.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import uk.gegc.readlater.features.libraryitem.api.dto.LibraryItemCreateRequest;
import uk.gegc.readlater.features.libraryitem.api.dto.LibraryItemDto;
import uk.gegc.readlater.features.libraryitem.application.LibraryItemPatch;
import uk.gegc.readlater.features.libraryitem.application.LibraryItemService;
import uk.gegc.readlater.features.libraryitem.domain.event.LibraryItemChange;
import uk.gegc.readlater.features.libraryitem.domain.event.LibraryItemCreatedEvent;
import uk.gegc.readlater.features.libraryitem.domain.event.LibraryItemUpdatedEvent;
import uk.gegc.readlater.features.libraryitem.domain.model.ItemTimestamps;
import uk.gegc.readlater.features.libraryitem.domain.model.LibraryItem;
import uk.gegc.readlater.features.libraryitem.domain.model.LibraryItemState;
import uk.gegc.readlater.features.libraryitem.domain.model.LibraryItemStateTransitions;
import uk.gegc.readlater.features.libraryitem.domain.repository.LibraryItemRepository;
import uk.gegc.readlater.features.libraryitem.infra.mapping.LibraryItemMapper;
import uk.gegc.readlater.features.libraryitem.infra.text.ReadableContentWordCounter;
import uk.gegc.readlater.shared.exception.ResourceNotFoundException;
import uk.gegc.readlater.shared.exception.ValidationException;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.UUID;

@Service
@Transactional
@RequiredArgsConstructor
@Slf4j
public class LibraryItemServiceImpl implements LibraryItemService {

    private final LibraryItemRepository libraryItemRepository;
    private final LibraryItemMapper libraryItemMapper;
    private final ReadableContentWordCounter wordCounter;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Override
    public LibraryItemDto createLibraryItem(LibraryItemCreateRequest request, UUID userId) {
        LibraryItem saved = libraryItemRepository.save(toNewItem(request, userId, clock.instant()));
        LibraryItemDto dto = libraryItemMapper.toDto(saved);
        log.info("Saved library item {} for user {}", saved.getId(), userId);
        eventPublisher.publishEvent(new LibraryItemCreatedEvent(this, userId, dto));
        return dto;
    }

    @Override
    public List<LibraryItemDto> createLibraryItems(List<LibraryItemCreateRequest> requests, UUID userId) {
        if (requests == null || requests.isEmpty()) {
            return List.of();
        }
        Instant now = clock.instant();
        List<LibraryItem> items = new ArrayList<>(requests.size());
        for (LibraryItemCreateRequest request : requests) {
            items.add(toNewItem(request, userId, now));
        }
        List<LibraryItem> saved = libraryItemRepository.saveAll(items);
        log.info("Saved {} library items for user {}", saved.size(), userId);
        return saved.stream().map(libraryItemMapper::toDto).toList();
    }

    @Override
    public LibraryItemDto updateLibraryItem(UUID id, LibraryItemPatch patch, UUID userId) {
        if (patch == null) {
            throw new ValidationException("Patch is required");
        }
        LibraryItem item = libraryItemRepository.findByIdAndUserId(id, userId)
                .orElseThrow(() -> new ResourceNotFoundException("Library item " + id + " not found"));

        libraryItemMapper.applyPatch(item, patch);
        ItemTimestamps derived = null;
        if (patch.state() != null) {
            derived = LibraryItemStateTransitions.deriveTimestamps(ItemTimestamps.of(item), patch.state(), clock.instant());
            derived.applyTo(item);
        }
        libraryItemRepository.saveAndFlush(item);

        LibraryItem updated = libraryItemRepository.findByIdAndUserId(id, userId)
                .orElseThrow(() -> new ResourceNotFoundException("Library item " + id + " not found after update"));
        log.info("Updated library item {} for user {}", id, userId);
        eventPublisher.publishEvent(new LibraryItemUpdatedEvent(this, userId, new LibraryItemChange(id, patch, derived)));
        return libraryItemMapper.toDto(updated);
    }

    @Override
    public LibraryItemDto restoreLibraryItem(UUID id, UUID userId) {
        LibraryItemPatch restore = LibraryItemPatch.builder()
                .state(LibraryItemState.SUCCEEDED)
                .savedAt(clock.instant())
                .build();
        return updateLibraryItem(id, restore, userId);
    }

    @Override
    public long deleteLibraryItem(UUID id, UUID userId) {
        long deleted = libraryItemRepository.deleteByIdAndUserId(id, userId);
        log.info("Deleted {} library item(s) with id {} for user {}", deleted, id, userId);
        return deleted;
    }

    @Override
    public long deleteLibraryItems(List<UUID> ids, UUID userId) {
        if (ids == null || ids.isEmpty()) {
            throw new ValidationException("ids must not be empty");
        }
        long deleted = libraryItemRepository.deleteByIdInAndUserId(new LinkedHashSet<>(ids), userId);
        log.info("Deleted {} of {} requested library items for user {}", deleted, ids.size(), userId);
        return deleted;
    }

    @Override
    public long deleteLibraryItemByUrl(String url, UUID userId) {
        if (!StringUtils.hasText(url)) {
            throw new ValidationException("url is required");
        }
        long deleted = libraryItemRepository.deleteByOriginalUrlAndUserId(url.trim(), userId);
        log.info("Deleted {} library items with url {} for user {}", deleted, url, userId);
        return deleted;
    }

    @Override
    public long deleteLibraryItemsByUserId(UUID userId) {
        long deleted = libraryItemRepository.deleteByUserId(userId);
        log.info("Deleted all {} library items for user {}", deleted, userId);
        return deleted;
    }

    private LibraryItem toNewItem(LibraryItemCreateRequest request, UUID userId, Instant now) {
        LibraryItem item = libraryItemMapper.toEntity(request, userId, now);
        if (item.getWordCount() == null) {
            item.setWordCount(wordCounter.countWords(item.getReadableContent()));
        }
        return item;
    }
}
