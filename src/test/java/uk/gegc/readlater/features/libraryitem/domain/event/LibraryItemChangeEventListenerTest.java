package uk.gegc.readlater.features.libraryitem.domain.event;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import uk.gegc.readlater.BaseUnitTest;
import uk.gegc.readlater.features.libraryitem.api.dto.LibraryItemDto;
import uk.gegc.readlater.features.libraryitem.application.LibraryItemChangeNotifier;
import uk.gegc.readlater.features.libraryitem.application.LibraryItemPatch;
import uk.gegc.readlater.features.libraryitem.domain.model.ItemTimestamps;
import uk.gegc.readlater.features.libraryitem.domain.model.LibraryItemState;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class LibraryItemChangeEventListenerTest extends BaseUnitTest {

    @Mock
    private LibraryItemChangeNotifier notifier;

    @InjectMocks
    private LibraryItemChangeEventListener listener;

    @Test
    @DisplayName("created events are forwarded as library item notifications")
    void handleCreated_forwards() {
        UUID userId = UUID.randomUUID();
        LibraryItemDto item = mock(LibraryItemDto.class);

        listener.handleCreated(new LibraryItemCreatedEvent(this, userId, item));

        verify(notifier).notifyCreated(EntityType.LIBRARY_ITEM, item, userId);
    }

    @Test
    @DisplayName("updated events carry the effective change")
    void handleUpdated_forwardsChange() {
        UUID userId = UUID.randomUUID();
        LibraryItemChange change = new LibraryItemChange(UUID.randomUUID(),
                LibraryItemPatch.builder().state(LibraryItemState.ARCHIVED).build(),
                new ItemTimestamps(Instant.parse("2024-06-01T12:00:00Z"), null));

        listener.handleUpdated(new LibraryItemUpdatedEvent(this, userId, change));

        verify(notifier).notifyUpdated(EntityType.LIBRARY_ITEM, change, userId);
    }

    @Test
    @DisplayName("notifier failures do not escape the listener")
    void notifierFailure_isContained() {
        UUID userId = UUID.randomUUID();
        LibraryItemChange change = new LibraryItemChange(UUID.randomUUID(), LibraryItemPatch.builder().build(), null);
        doThrow(new IllegalStateException("downstream unavailable"))
                .when(notifier).notifyUpdated(any(), any(), eq(userId));

        assertThatCode(() -> listener.handleUpdated(new LibraryItemUpdatedEvent(this, userId, change)))
                .doesNotThrowAnyException();
    }
}
