package uk.gegc.readlater.features.libraryitem.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.readlater.features.libraryitem.domain.model.BulkActionType;

@Schema(description = "Outcome of a bulk action")
public record BulkActionResult(
        @Schema(description = "Action applied", example = "MARK_AS_READ")
        BulkActionType action,

        @Schema(description = "Rows updated, or label attachments inserted for ADD_LABELS", example = "2")
        long affectedCount
) {
}
