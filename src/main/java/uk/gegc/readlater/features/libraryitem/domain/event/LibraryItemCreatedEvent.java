package uk.gegc.readlater.features.libraryitem.domain.event;

import org.springframework.context.ApplicationEvent;
import uk.gegc.readlater.features.libraryitem.api.dto.LibraryItemDto;

import java.util.UUID;

/**
 * Published when a library item has been saved.
 * <p>
 * The item is carried as a detached DTO so listeners running after commit never touch lazy state.
 * </p>
 */
public class LibraryItemCreatedEvent extends ApplicationEvent {

    private final UUID userId;
    private final LibraryItemDto item;

    public LibraryItemCreatedEvent(Object source, UUID userId, LibraryItemDto item) {
        super(source);
        this.userId = userId;
        this.item = item;
    }

    public UUID getUserId() {
        return userId;
    }

    public LibraryItemDto getItem() {
        return item;
    }
}
