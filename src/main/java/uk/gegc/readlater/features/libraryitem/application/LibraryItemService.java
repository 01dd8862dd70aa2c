package uk.gegc.readlater.features.libraryitem.application;

import uk.gegc.readlater.features.libraryitem.api.dto.LibraryItemCreateRequest;
import uk.gegc.readlater.features.libraryitem.api.dto.LibraryItemDto;

import java.util.List;
import java.util.UUID;

public interface LibraryItemService {

    LibraryItemDto createLibraryItem(LibraryItemCreateRequest request, UUID userId);

    List<LibraryItemDto> createLibraryItems(List<LibraryItemCreateRequest> requests, UUID userId);

    /**
     * Applies the non-null fields of {@code patch}. A state change also derives the archive and delete timestamps.
     *
     * @throws uk.gegc.readlater.shared.exception.ResourceNotFoundException if the item does not exist before or after the write
     */
    LibraryItemDto updateLibraryItem(UUID id, LibraryItemPatch patch, UUID userId);

    /**
     * Moves an archived or deleted item back to the library and marks it as saved now.
     */
    LibraryItemDto restoreLibraryItem(UUID id, UUID userId);

    long deleteLibraryItem(UUID id, UUID userId);

    long deleteLibraryItems(List<UUID> ids, UUID userId);

    long deleteLibraryItemByUrl(String url, UUID userId);

    long deleteLibraryItemsByUserId(UUID userId);
}
