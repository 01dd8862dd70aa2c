package uk.gegc.readlater.features.libraryitem.domain.event;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import uk.gegc.readlater.features.libraryitem.application.LibraryItemChangeNotifier;

/**
 * Forwards library item events to the {@link LibraryItemChangeNotifier} once the
 * publishing transaction has committed. A rolled-back mutation is never announced.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LibraryItemChangeEventListener {

    private final LibraryItemChangeNotifier notifier;

    @Async("generalTaskExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleCreated(LibraryItemCreatedEvent event) {
        try {
            notifier.notifyCreated(EntityType.LIBRARY_ITEM, event.getItem(), event.getUserId());
        } catch (Exception e) {
            // The item is already committed
            log.warn("Failed to notify creation of library item {} for user {}: {}",
                    event.getItem().id(), event.getUserId(), e.getMessage());
        }
    }

    @Async("generalTaskExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleUpdated(LibraryItemUpdatedEvent event) {
        try {
            notifier.notifyUpdated(EntityType.LIBRARY_ITEM, event.getChange(), event.getUserId());
        } catch (Exception e) {
            log.warn("Failed to notify update of library item {} for user {}: {}",
                    event.getChange().id(), event.getUserId(), e.getMessage());
        }
    }
}
