package uk.gegc.readlater.features.libraryitem.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import uk.gegc.readlater.features.libraryitem.domain.model.BulkActionType;

import java.util.List;
import java.util.UUID;

@Schema(description = "Bulk action applied to every item matching the criteria")
public record BulkActionRequest(
        @Schema(description = "Action to apply", example = "ARCHIVE")
        BulkActionType action,

        @Schema(description = "Selects the target items; pagination and sort are ignored")
        @Valid
        LibraryItemSearchCriteria criteria,

        @Schema(description = "Labels to attach; required for ADD_LABELS")
        List<UUID> labelIds
) {
}
