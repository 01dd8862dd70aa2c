package uk.gegc.readlater.features.libraryitem.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.security.core.Authentication;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import uk.gegc.readlater.features.libraryitem.api.dto.*;
import uk.gegc.readlater.features.libraryitem.application.LibraryItemBulkActionService;
import uk.gegc.readlater.features.libraryitem.application.LibraryItemQueryService;
import uk.gegc.readlater.features.libraryitem.application.LibraryItemService;
import uk.gegc.readlater.features.libraryitem.infra.mapping.LibraryItemMapper;
import uk.gegc.readlater.shared.exception.ResourceNotFoundException;
import uk.gegc.readlater.shared.security.AuthenticatedUserResolver;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/library-items")
@Validated
@SecurityRequirement(name = "Bearer Authentication")
@Tag(name = "Library Items", description = "Search, save, update and bulk-manage saved items")
public class LibraryItemController {

    private final LibraryItemQueryService queryService;
    private final LibraryItemService libraryItemService;
    private final LibraryItemBulkActionService bulkActionService;
    private final LibraryItemMapper libraryItemMapper;
    private final AuthenticatedUserResolver userResolver;

    public LibraryItemController(LibraryItemQueryService queryService,
                                 LibraryItemService libraryItemService,
                                 LibraryItemBulkActionService bulkActionService,
                                 LibraryItemMapper libraryItemMapper,
                                 AuthenticatedUserResolver userResolver) {
        this.queryService = queryService;
        this.libraryItemService = libraryItemService;
        this.bulkActionService = bulkActionService;
        this.libraryItemMapper = libraryItemMapper;
        this.userResolver = userResolver;
    }

    @Operation(summary = "Search library items", description = "Filtered, paginated search over the caller's items")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Page of matching items",
                    content = @Content(schema = @Schema(implementation = LibraryItemSearchResult.class))),
            @ApiResponse(responseCode = "400", description = "Invalid criteria",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/search")
    public LibraryItemSearchResult search(@Valid @RequestBody(required = false) LibraryItemSearchCriteria criteria,
                                          Authentication authentication) {
        return queryService.searchLibraryItems(criteria, userResolver.resolveUserId(authentication));
    }

    @Operation(summary = "Get library item by ID")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Item found",
                    content = @Content(schema = @Schema(implementation = LibraryItemDto.class))),
            @ApiResponse(responseCode = "404", description = "Item not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/{id}")
    public LibraryItemDto getById(@Parameter(description = "Item ID") @PathVariable UUID id,
                                  Authentication authentication) {
        return queryService.getLibraryItem(id, userResolver.resolveUserId(authentication))
                .orElseThrow(() -> new ResourceNotFoundException("Library item " + id + " not found"));
    }

    @Operation(summary = "Get library item by original URL")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Item found",
                    content = @Content(schema = @Schema(implementation = LibraryItemDto.class))),
            @ApiResponse(responseCode = "404", description = "No item saved from this URL",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/by-url")
    public LibraryItemDto getByUrl(@Parameter(description = "Original URL") @RequestParam String url,
                                   Authentication authentication) {
        return queryService.findLibraryItemByUrl(url, userResolver.resolveUserId(authentication))
                .orElseThrow(() -> new ResourceNotFoundException("Library item with url " + url + " not found"));
    }

    @Operation(summary = "Prefix search", description = "Case-insensitive prefix match on title or site name")
    @GetMapping("/prefix")
    public List<LibraryItemListItemDto> findByPrefix(
            @Parameter(description = "Prefix to match", example = "Wo") @RequestParam String prefix,
            @Parameter(description = "Maximum results") @RequestParam(required = false) Integer limit,
            Authentication authentication) {
        return queryService.findLibraryItemsByPrefix(prefix, userResolver.resolveUserId(authentication), limit);
    }

    @Operation(summary = "Count items created in a date range")
    @GetMapping("/count")
    public LibraryItemCountResponse countByCreatedAt(
            @Parameter(description = "Inclusive start; defaults to epoch")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant startDate,
            @Parameter(description = "Inclusive end; defaults to now")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant endDate,
            Authentication authentication) {
        long count = queryService.countByCreatedAt(userResolver.resolveUserId(authentication), startDate, endDate);
        return new LibraryItemCountResponse(count);
    }

    @Operation(summary = "Save a library item")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Item saved",
                    content = @Content(schema = @Schema(implementation = LibraryItemDto.class))),
            @ApiResponse(responseCode = "400", description = "Invalid payload",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public LibraryItemDto create(@Valid @RequestBody LibraryItemCreateRequest request,
                                 Authentication authentication) {
        return libraryItemService.createLibraryItem(request, userResolver.resolveUserId(authentication));
    }

    @Operation(summary = "Save several library items")
    @PostMapping("/batch")
    @ResponseStatus(HttpStatus.CREATED)
    public List<LibraryItemDto> createBatch(@RequestBody @NotEmpty List<@Valid LibraryItemCreateRequest> requests,
                                            Authentication authentication) {
        return libraryItemService.createLibraryItems(requests, userResolver.resolveUserId(authentication));
    }

    @Operation(summary = "Update a library item", description = "Partial update; a state change derives archive and delete timestamps")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Item updated",
                    content = @Content(schema = @Schema(implementation = LibraryItemDto.class))),
            @ApiResponse(responseCode = "404", description = "Item not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PatchMapping("/{id}")
    public LibraryItemDto update(@PathVariable UUID id,
                                 @Valid @RequestBody LibraryItemUpdateRequest request,
                                 Authentication authentication) {
        return libraryItemService.updateLibraryItem(id, libraryItemMapper.toPatch(request),
                userResolver.resolveUserId(authentication));
    }

    @Operation(summary = "Restore an archived or deleted item")
    @PostMapping("/{id}/restore")
    public LibraryItemDto restore(@PathVariable UUID id, Authentication authentication) {
        return libraryItemService.restoreLibraryItem(id, userResolver.resolveUserId(authentication));
    }

    @Operation(summary = "Apply a bulk action", description = "Archive, delete, mark as read or label every item matching the criteria")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Action applied",
                    content = @Content(schema = @Schema(implementation = BulkActionResult.class))),
            @ApiResponse(responseCode = "400", description = "Missing action or labels",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Unknown label",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/bulk-actions")
    public BulkActionResult bulkAction(@Valid @RequestBody BulkActionRequest request,
                                       Authentication authentication) {
        return bulkActionService.performBulkAction(request.action(), request.criteria(), request.labelIds(),
                userResolver.resolveUserId(authentication));
    }

    @Operation(summary = "Delete a library item permanently")
    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable UUID id, Authentication authentication) {
        long deleted = libraryItemService.deleteLibraryItem(id, userResolver.resolveUserId(authentication));
        if (deleted == 0) {
            throw new ResourceNotFoundException("Library item " + id + " not found");
        }
    }

    @Operation(summary = "Delete the items saved from a URL")
    @DeleteMapping(params = "url")
    public LibraryItemDeleteResponse deleteByUrl(@RequestParam String url, Authentication authentication) {
        return new LibraryItemDeleteResponse(
                libraryItemService.deleteLibraryItemByUrl(url, userResolver.resolveUserId(authentication)));
    }

    @Operation(summary = "Delete several items permanently")
    @DeleteMapping("/bulk")
    public LibraryItemDeleteResponse deleteMany(@Valid @RequestBody LibraryItemIdsRequest request,
                                                Authentication authentication) {
        return new LibraryItemDeleteResponse(
                libraryItemService.deleteLibraryItems(request.ids(), userResolver.resolveUserId(authentication)));
    }

    @Operation(summary = "Delete every item of the caller")
    @DeleteMapping("/all")
    public LibraryItemDeleteResponse deleteAll(Authentication authentication) {
        return new LibraryItemDeleteResponse(
                libraryItemService.deleteLibraryItemsByUserId(userResolver.resolveUserId(authentication)));
    }
}
