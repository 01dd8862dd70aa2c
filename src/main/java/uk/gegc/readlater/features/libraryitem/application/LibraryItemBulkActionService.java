package uk.gegc.readlater.features.libraryitem.application;

import uk.gegc.readlater.features.libraryitem.api.dto.BulkActionResult;
import uk.gegc.readlater.features.libraryitem.api.dto.LibraryItemSearchCriteria;
import uk.gegc.readlater.features.libraryitem.domain.model.BulkActionType;

import java.util.List;
import java.util.UUID;

public interface LibraryItemBulkActionService {

    /**
     * Applies {@code action} to every item of {@code userId} matching {@code criteria}.
     * Pagination and sort in the criteria are ignored.
     *
     * @param labelIds labels to attach; required for {@link BulkActionType#ADD_LABELS}, ignored otherwise
     * @throws uk.gegc.readlater.shared.exception.InvalidBulkActionException if the action is missing or lacks its labels
     */
    BulkActionResult performBulkAction(BulkActionType action,
                                       LibraryItemSearchCriteria criteria,
                                       List<UUID> labelIds,
                                       UUID userId);
}
