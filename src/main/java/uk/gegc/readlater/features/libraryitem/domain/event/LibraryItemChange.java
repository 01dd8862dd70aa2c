package uk.gegc.readlater.features.libraryitem.domain.event;

import uk.gegc.readlater.features.libraryitem.application.LibraryItemPatch;
import uk.gegc.readlater.features.libraryitem.domain.model.ItemTimestamps;

import java.util.UUID;

/**
 * Effective change applied to one item.
 *
 * @param timestamps archive/delete timestamps derived from a state change, or null when the state was not patched
 */
public record LibraryItemChange(UUID id, LibraryItemPatch patch, ItemTimestamps timestamps) {
}
