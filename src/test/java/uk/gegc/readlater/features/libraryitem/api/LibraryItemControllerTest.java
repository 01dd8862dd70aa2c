package uk.gegc.readlater.features.libraryitem.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.readlater.features.libraryitem.api.dto.BulkActionRequest;
import uk.gegc.readlater.features.libraryitem.api.dto.BulkActionResult;
import uk.gegc.readlater.features.libraryitem.api.dto.LibraryItemCreateRequest;
import uk.gegc.readlater.features.libraryitem.api.dto.LibraryItemDto;
import uk.gegc.readlater.features.libraryitem.api.dto.LibraryItemListItemDto;
import uk.gegc.readlater.features.libraryitem.api.dto.LibraryItemSearchCriteria;
import uk.gegc.readlater.features.libraryitem.api.dto.LibraryItemSearchResult;
import uk.gegc.readlater.features.libraryitem.api.dto.LibraryItemUpdateRequest;
import uk.gegc.readlater.features.libraryitem.application.LibraryItemBulkActionService;
import uk.gegc.readlater.features.libraryitem.application.LibraryItemPatch;
import uk.gegc.readlater.features.libraryitem.application.LibraryItemQueryService;
import uk.gegc.readlater.features.libraryitem.application.LibraryItemService;
import uk.gegc.readlater.features.libraryitem.domain.model.BulkActionType;
import uk.gegc.readlater.features.libraryitem.domain.model.LibraryItemState;
import uk.gegc.readlater.features.libraryitem.domain.model.LibraryItemType;
import uk.gegc.readlater.features.libraryitem.domain.model.search.ScopeFilter;
import uk.gegc.readlater.features.libraryitem.infra.mapping.LibraryItemMapper;
import uk.gegc.readlater.shared.exception.InvalidBulkActionException;
import uk.gegc.readlater.shared.exception.ValidationException;
import uk.gegc.readlater.shared.security.AuthenticatedUserResolver;
import uk.gegc.readlater.testsupport.WebMvcSecurityTestConfig;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.csrf;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(LibraryItemController.class)
@Import({AuthenticatedUserResolver.class, WebMvcSecurityTestConfig.class})
class LibraryItemControllerTest {

    private static final String USER_ID = "8f2c6b1e-4d3a-4c5b-9e7f-0a1b2c3d4e5f";
    private static final UUID USER = UUID.fromString(USER_ID);
    private static final Instant SAVED_AT = Instant.parse("2024-06-01T12:00:00Z");

    @Autowired
    MockMvc mockMvc;

    @Autowired
    ObjectMapper objectMapper;

    @MockitoBean
    LibraryItemQueryService queryService;

    @MockitoBean
    LibraryItemService libraryItemService;

    @MockitoBean
    LibraryItemBulkActionService bulkActionService;

    @MockitoBean
    LibraryItemMapper libraryItemMapper;

    private static LibraryItemListItemDto listItem(UUID id, String title) {
        return new LibraryItemListItemDto(id, title, "https://example.com/" + id, null, null, null, "Example",
                null, null, LibraryItemType.ARTICLE, LibraryItemState.SUCCEEDED, null, 120, 0.0, 0.0,
                SAVED_AT, null, null, null, null, null, List.of(), List.of());
    }

    private static LibraryItemDto item(UUID id, String title, LibraryItemState state) {
        return new LibraryItemDto(id, USER, title, "https://example.com/" + id, null, null, null, "Example",
                null, null, LibraryItemType.ARTICLE, state, null, null, null, null, 120, 0.0, 0.0, 0,
                SAVED_AT, state == LibraryItemState.ARCHIVED ? SAVED_AT : null, null, null, null, SAVED_AT, SAVED_AT,
                List.of(), List.of(), List.of());
    }

    @Test
    @DisplayName("POST /search: returns the page with the total count")
    @WithMockUser(username = USER_ID)
    void search_returnsPage() throws Exception {
        LibraryItemSearchCriteria criteria = LibraryItemSearchCriteria.builder()
                .scope(ScopeFilter.INBOX)
                .size(5)
                .build();
        when(queryService.searchLibraryItems(eq(criteria), eq(USER)))
                .thenReturn(new LibraryItemSearchResult(List.of(listItem(UUID.randomUUID(), "World News")), 12, 0, 5));

        mockMvc.perform(post("/api/v1/library-items/search")
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(criteria)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(12))
                .andExpect(jsonPath("$.size").value(5))
                .andExpect(jsonPath("$.items[0].title").value("World News"));
    }

    @Test
    @DisplayName("POST /search: an empty body searches with defaults")
    @WithMockUser(username = USER_ID)
    void search_withoutBody() throws Exception {
        when(queryService.searchLibraryItems(isNull(), eq(USER)))
                .thenReturn(new LibraryItemSearchResult(List.of(), 0, 0, 10));

        mockMvc.perform(post("/api/v1/library-items/search").with(csrf()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(0));
    }

    @Test
    @DisplayName("POST /search: a negative offset is a 400")
    @WithMockUser(username = USER_ID)
    void search_negativeFrom_isBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/library-items/search")
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"from\":-1}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(queryService);
    }

    @Test
    @DisplayName("POST /search: an oversized page reported by the service is a 400")
    @WithMockUser(username = USER_ID)
    void search_serviceValidation_isBadRequest() throws Exception {
        when(queryService.searchLibraryItems(any(), eq(USER)))
                .thenThrow(new ValidationException("size must be between 1 and 100"));

        mockMvc.perform(post("/api/v1/library-items/search")
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"size\":500}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("requests without a user are rejected")
    void search_unauthenticated() throws Exception {
        mockMvc.perform(post("/api/v1/library-items/search").with(csrf()))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("GET /{id}: unknown items are a 404")
    @WithMockUser(username = USER_ID)
    void getById_missing() throws Exception {
        UUID id = UUID.randomUUID();
        when(queryService.getLibraryItem(id, USER)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/library-items/{id}", id))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("GET /by-url: returns the saved item")
    @WithMockUser(username = USER_ID)
    void getByUrl_found() throws Exception {
        UUID id = UUID.randomUUID();
        when(queryService.findLibraryItemByUrl("https://example.com/a", USER))
                .thenReturn(Optional.of(item(id, "A", LibraryItemState.SUCCEEDED)));

        mockMvc.perform(get("/api/v1/library-items/by-url").param("url", "https://example.com/a"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(id.toString()));
    }

    @Test
    @DisplayName("GET /prefix: passes the prefix and limit through")
    @WithMockUser(username = USER_ID)
    void prefix() throws Exception {
        when(queryService.findLibraryItemsByPrefix("Wo", USER, 3))
                .thenReturn(List.of(listItem(UUID.randomUUID(), "World News")));

        mockMvc.perform(get("/api/v1/library-items/prefix").param("prefix", "Wo").param("limit", "3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].title").value("World News"));
    }

    @Test
    @DisplayName("GET /count: parses ISO date-times")
    @WithMockUser(username = USER_ID)
    void count() throws Exception {
        Instant start = Instant.parse("2024-01-01T00:00:00Z");
        when(queryService.countByCreatedAt(USER, start, null)).thenReturn(4L);

        mockMvc.perform(get("/api/v1/library-items/count").param("startDate", "2024-01-01T00:00:00Z"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(4));
    }

    @Test
    @DisplayName("POST: creates an item with 201")
    @WithMockUser(username = USER_ID)
    void create() throws Exception {
        UUID id = UUID.randomUUID();
        LibraryItemCreateRequest request = new LibraryItemCreateRequest("World News", "https://example.com/news",
                null, null, null, null, null, null, LibraryItemType.ARTICLE, null, "<p>hi</p>", null, null, "en",
                null, null, null);
        when(libraryItemService.createLibraryItem(any(LibraryItemCreateRequest.class), eq(USER)))
                .thenReturn(item(id, "World News", LibraryItemState.SUCCEEDED));

        mockMvc.perform(post("/api/v1/library-items")
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.title").value("World News"));
    }

    @Test
    @DisplayName("POST: a missing title is a 400")
    @WithMockUser(username = USER_ID)
    void create_missingTitle() throws Exception {
        mockMvc.perform(post("/api/v1/library-items")
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"originalUrl\":\"https://example.com\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(libraryItemService);
    }

    @Test
    @DisplayName("PATCH /{id}: converts the request into a patch")
    @WithMockUser(username = USER_ID)
    void update() throws Exception {
        UUID id = UUID.randomUUID();
        LibraryItemPatch patch = LibraryItemPatch.builder().state(LibraryItemState.ARCHIVED).build();
        when(libraryItemMapper.toPatch(any(LibraryItemUpdateRequest.class))).thenReturn(patch);
        when(libraryItemService.updateLibraryItem(id, patch, USER))
                .thenReturn(item(id, "World News", LibraryItemState.ARCHIVED));

        mockMvc.perform(patch("/api/v1/library-items/{id}", id)
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"state\":\"ARCHIVED\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("ARCHIVED"))
                .andExpect(jsonPath("$.archivedAt").exists());
    }

    @Test
    @DisplayName("PATCH /{id}: progress above 100 is a 400")
    @WithMockUser(username = USER_ID)
    void update_invalidProgress() throws Exception {
        mockMvc.perform(patch("/api/v1/library-items/{id}", UUID.randomUUID())
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"readingProgressTopPercent\":150}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("POST /bulk-actions: returns the affected count")
    @WithMockUser(username = USER_ID)
    void bulkAction() throws Exception {
        BulkActionRequest request = new BulkActionRequest(BulkActionType.MARK_AS_READ,
                LibraryItemSearchCriteria.builder().scope(ScopeFilter.INBOX).build(), null);
        when(bulkActionService.performBulkAction(eq(BulkActionType.MARK_AS_READ),
                argThat(c -> c != null && c.scope() == ScopeFilter.INBOX), isNull(), eq(USER)))
                .thenReturn(new BulkActionResult(BulkActionType.MARK_AS_READ, 2));

        mockMvc.perform(post("/api/v1/library-items/bulk-actions")
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.action").value("MARK_AS_READ"))
                .andExpect(jsonPath("$.affectedCount").value(2));
    }

    @Test
    @DisplayName("POST /bulk-actions: an invalid action is a 400")
    @WithMockUser(username = USER_ID)
    void bulkAction_invalid() throws Exception {
        when(bulkActionService.performBulkAction(any(), any(), any(), eq(USER)))
                .thenThrow(new InvalidBulkActionException("ADD_LABELS requires at least one label id"));

        mockMvc.perform(post("/api/v1/library-items/bulk-actions")
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"ADD_LABELS\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("DELETE /{id}: 204 when removed, 404 when nothing matched")
    @WithMockUser(username = USER_ID)
    void deleteById() throws Exception {
        UUID present = UUID.randomUUID();
        UUID absent = UUID.randomUUID();
        when(libraryItemService.deleteLibraryItem(present, USER)).thenReturn(1L);
        when(libraryItemService.deleteLibraryItem(absent, USER)).thenReturn(0L);

        mockMvc.perform(delete("/api/v1/library-items/{id}", present).with(csrf()))
                .andExpect(status().isNoContent());
        mockMvc.perform(delete("/api/v1/library-items/{id}", absent).with(csrf()))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("DELETE ?url: returns the number of removed items")
    @WithMockUser(username = USER_ID)
    void deleteByUrl() throws Exception {
        when(libraryItemService.deleteLibraryItemByUrl("https://example.com/a", USER)).thenReturn(2L);

        mockMvc.perform(delete("/api/v1/library-items").param("url", "https://example.com/a").with(csrf()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deleted").value(2));
    }

    @Test
    @DisplayName("DELETE /bulk: deletes the listed ids")
    @WithMockUser(username = USER_ID)
    void deleteMany() throws Exception {
        UUID a = UUID.randomUUID();
        UUID b = UUID.randomUUID();
        when(libraryItemService.deleteLibraryItems(List.of(a, b), USER)).thenReturn(2L);

        mockMvc.perform(delete("/api/v1/library-items/bulk")
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ids\":[\"" + a + "\",\"" + b + "\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deleted").value(2));
    }

    @Test
    @DisplayName("DELETE /all: removes every item of the caller")
    @WithMockUser(username = USER_ID)
    void deleteAll() throws Exception {
        when(libraryItemService.deleteLibraryItemsByUserId(USER)).thenReturn(5L);

        mockMvc.perform(delete("/api/v1/library-items/all").with(csrf()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deleted").value(5));

        verify(libraryItemService).deleteLibraryItemsByUserId(USER);
    }
}
