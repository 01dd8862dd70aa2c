package uk.gegc.readlater.features.libraryitem.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Number of physically removed items")
public record LibraryItemDeleteResponse(
        @Schema(example = "1")
        long deleted
) {
}
