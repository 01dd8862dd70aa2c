package uk.gegc.readlater.features.libraryitem.infra.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.readlater.features.libraryitem.application.LibraryItemChangeNotifier;
import uk.gegc.readlater.features.libraryitem.domain.event.EntityType;

import java.util.UUID;

/**
 * Default notifier: records changes in the application log.
 */
@Component
@Slf4j
public class LoggingLibraryItemChangeNotifier implements LibraryItemChangeNotifier {

    @Override
    public void notifyCreated(EntityType type, Object entity, UUID userId) {
        log.info("{} created for user {}", type, userId);
        log.debug("Created {} payload: {}", type, entity);
    }

    @Override
    public void notifyUpdated(EntityType type, Object patch, UUID userId) {
        log.info("{} updated for user {}", type, userId);
        log.debug("Updated {} payload: {}", type, patch);
    }
}
