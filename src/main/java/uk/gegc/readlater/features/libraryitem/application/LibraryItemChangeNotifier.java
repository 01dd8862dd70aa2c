package uk.gegc.readlater.features.libraryitem.application;

import uk.gegc.readlater.features.libraryitem.domain.event.EntityType;

import java.util.UUID;

/**
 * Outbound channel for committed changes. Delivery is best-effort.
 */
public interface LibraryItemChangeNotifier {

    void notifyCreated(EntityType type, Object entity, UUID userId);

    void notifyUpdated(EntityType type, Object patch, UUID userId);
}
