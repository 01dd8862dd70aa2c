package uk.gegc.readlater.features.libraryitem.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Number of items matching a lookup")
public record LibraryItemCountResponse(
        @Schema(example = "42")
        long count
) {
}
