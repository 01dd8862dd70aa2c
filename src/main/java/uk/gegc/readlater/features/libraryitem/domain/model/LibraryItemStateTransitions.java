package uk.gegc.readlater.features.libraryitem.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Derives the archive/delete timestamps implied by moving an item into a state.
 * <ul>
 *     <li>{@link LibraryItemState#ARCHIVED} stamps {@code archivedAt}; {@code deletedAt} is kept.</li>
 *     <li>{@link LibraryItemState#DELETED} stamps {@code deletedAt}; {@code archivedAt} is kept.</li>
 *     <li>{@link LibraryItemState#PROCESSING} and {@link LibraryItemState#SUCCEEDED} clear both.</li>
 * </ul>
 */
public final class LibraryItemStateTransitions {

    private LibraryItemStateTransitions() {
    }

    public static ItemTimestamps deriveTimestamps(ItemTimestamps current, LibraryItemState newState, Instant now) {
        Objects.requireNonNull(current, "current timestamps");
        Objects.requireNonNull(newState, "newState");
        return switch (newState) {
            case ARCHIVED -> new ItemTimestamps(now, current.deletedAt());
            case DELETED -> new ItemTimestamps(current.archivedAt(), now);
            case PROCESSING, SUCCEEDED -> new ItemTimestamps(null, null);
        };
    }
}
