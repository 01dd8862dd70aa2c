package uk.gegc.readlater.features.libraryitem.domain.model;

import java.time.Instant;

/**
 * The pair of lifecycle timestamps that depend on an item's state.
 */
public record ItemTimestamps(Instant archivedAt, Instant deletedAt) {

    public static ItemTimestamps of(LibraryItem item) {
        return new ItemTimestamps(item.getArchivedAt(), item.getDeletedAt());
    }

    public void applyTo(LibraryItem item) {
        item.setArchivedAt(archivedAt);
        item.setDeletedAt(deletedAt);
    }
}
