package uk.gegc.readlater.features.libraryitem.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "One page of search results and the total number of matches")
public record LibraryItemSearchResult(
        @Schema(description = "Items on this page")
        List<LibraryItemListItemDto> items,
        @Schema(description = "Total number of matching items", example = "12")
        long count,
        @Schema(description = "Offset used", example = "10")
        int from,
        @Schema(description = "Page size used", example = "5")
        int size
) {
}
