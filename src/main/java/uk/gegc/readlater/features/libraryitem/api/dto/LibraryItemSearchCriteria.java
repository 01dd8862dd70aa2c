package uk.gegc.readlater.features.libraryitem.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import uk.gegc.readlater.features.libraryitem.domain.model.search.*;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Schema(description = "Filter criteria for searching and bulk-updating library items")
@Builder(toBuilder = true)
public record LibraryItemSearchCriteria(
        @Schema(description = "Zero-based offset of the first result", defaultValue = "0", example = "0")
        @Min(value = 0, message = "from must not be negative")
        Integer from,

        @Schema(description = "Maximum number of results", defaultValue = "10", example = "10")
        @Min(value = 1, message = "size must be at least 1")
        Integer size,

        @Schema(description = "Sort field and direction; defaults to saved time descending")
        @Valid
        SearchSort sort,

        @Schema(description = "Free-text query in web search syntax", example = "\"climate change\" -opinion")
        String query,

        @Schema(description = "Folder to search in", defaultValue = "ALL", example = "INBOX")
        ScopeFilter scope,

        @Schema(description = "Read status filter", defaultValue = "ALL", example = "UNREAD")
        ReadFilter readFilter,

        @Schema(description = "Item type, case-insensitive", example = "article")
        String typeFilter,

        @Schema(description = "Label filters; include entries are ANDed, exclude entries are unioned")
        List<@Valid LabelFilter> labelFilters,

        @Schema(description = "Require highlights and/or labels to be present")
        List<HasFilter> hasFilters,

        @Schema(description = "Inclusive date ranges; an open start means epoch and an open end means now")
        List<@Valid DateFilter> dateFilters,

        @Schema(description = "Case-insensitive exact matches on a field")
        List<@Valid TermFilter> termFilters,

        @Schema(description = "Full-text matches on a single field")
        List<@Valid MatchFilter> matchFilters,

        @Schema(description = "Restrict to these item ids")
        List<UUID> ids,

        @Schema(description = "Include items still being processed", defaultValue = "false")
        Boolean includePending,

        @Schema(description = "Include soft-deleted items", defaultValue = "false")
        Boolean includeDeleted,

        @Schema(description = "Recommender name, or * for any recommended item", example = "*")
        String recommendedBy,

        @Schema(description = "Array fields that must be empty")
        List<@Valid NoFilter> noFilters
) {

    public static LibraryItemSearchCriteria empty() {
        return builder().build();
    }

    public boolean pendingIncluded() {
        return Boolean.TRUE.equals(includePending);
    }

    public boolean deletedIncluded() {
        return Boolean.TRUE.equals(includeDeleted);
    }

    @Schema(description = "Sort field and direction")
    public record SearchSort(
            @Schema(description = "Field to sort by", defaultValue = "SAVED") SortBy by,
            @Schema(description = "Direction", defaultValue = "DESC") SortOrder order
    ) {
    }

    @Schema(description = "A set of labels matched by overlap")
    public record LabelFilter(
            @NotEmpty(message = "labels must not be empty") List<@NotBlank String> labels,
            @NotNull(message = "mode is required") LabelFilterMode mode
    ) {
    }

    @Schema(description = "Inclusive date range on a timestamp field")
    public record DateFilter(
            @NotNull(message = "field is required") DateField field,
            Instant startDate,
            Instant endDate
    ) {
    }

    @Schema(description = "Case-insensitive exact match")
    public record TermFilter(
            @NotNull(message = "field is required") TermField field,
            @NotNull(message = "value is required") String value
    ) {
    }

    @Schema(description = "Full-text match on one field")
    public record MatchFilter(
            @NotNull(message = "field is required") MatchField field,
            @NotBlank(message = "value is required") String value
    ) {
    }

    @Schema(description = "Array field that must be empty")
    public record NoFilter(
            @NotNull(message = "field is required") NoFilterField field
    ) {
    }
}
