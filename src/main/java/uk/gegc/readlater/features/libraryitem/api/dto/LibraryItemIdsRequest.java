package uk.gegc.readlater.features.libraryitem.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.UUID;

@Schema(description = "A set of library item identifiers")
public record LibraryItemIdsRequest(
        @NotEmpty(message = "ids must not be empty")
        List<@NotNull UUID> ids
) {
}
