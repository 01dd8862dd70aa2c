package uk.gegc.readlater.features.libraryitem.domain.event;

import org.springframework.context.ApplicationEvent;

import java.util.UUID;

/**
 * Published when a library item has been patched or restored.
 */
public class LibraryItemUpdatedEvent extends ApplicationEvent {

    private final UUID userId;
    private final LibraryItemChange change;

    public LibraryItemUpdatedEvent(Object source, UUID userId, LibraryItemChange change) {
        super(source);
        this.userId = userId;
        this.change = change;
    }

    public UUID getUserId() {
        return userId;
    }

    public LibraryItemChange getChange() {
        return change;
    }
}
