package uk.gegc.readlater.features.libraryitem.domain.repository.query;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import uk.gegc.readlater.features.libraryitem.api.dto.LibraryItemSearchCriteria;
import uk.gegc.readlater.features.libraryitem.api.dto.LibraryItemSearchCriteria.DateFilter;
import uk.gegc.readlater.features.libraryitem.api.dto.LibraryItemSearchCriteria.LabelFilter;
import uk.gegc.readlater.features.libraryitem.api.dto.LibraryItemSearchCriteria.MatchFilter;
import uk.gegc.readlater.features.libraryitem.api.dto.LibraryItemSearchCriteria.NoFilter;
import uk.gegc.readlater.features.libraryitem.api.dto.LibraryItemSearchCriteria.TermFilter;
import uk.gegc.readlater.features.libraryitem.config.LibraryProperties;
import uk.gegc.readlater.features.libraryitem.domain.model.search.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LibraryItemPredicates")
class LibraryItemPredicatesTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private LibraryItemPredicates predicates;
    private UUID userId;

    @BeforeEach
    void setUp() {
        predicates = new LibraryItemPredicates(new LibraryProperties());
        userId = UUID.randomUUID();
    }

    private LibraryItemQuery apply(LibraryItemSearchCriteria criteria) {
        LibraryItemQuery query = LibraryItemQuery.forUser(userId);
        predicates.apply(criteria, query, NOW);
        return query;
    }

    @Test
    @DisplayName("empty criteria add only the default visibility exclusions")
    void emptyCriteria_addsOnlyVisibilityExclusions() {
        LibraryItemQuery query = apply(LibraryItemSearchCriteria.empty());

        assertThat(query.getConditions()).containsExactly(
                "library_item.user_id = :userId",
                "library_item.state <> :pendingState",
                "library_item.state <> :deletedState");
        assertThat(query.getParameters())
                .containsOnlyKeys("userId", "pendingState", "deletedState")
                .containsEntry("pendingState", "PROCESSING")
                .containsEntry("deletedState", "DELETED");
        assertThat(query.getSelections()).isEmpty();
        assertThat(query.getOrderings()).isEmpty();
    }

    @Test
    @DisplayName("includePending and includeDeleted drop the matching exclusions")
    void includeFlags_dropExclusions() {
        LibraryItemQuery query = apply(LibraryItemSearchCriteria.builder()
                .includePending(true)
                .includeDeleted(true)
                .build());

        assertThat(query.getConditions()).containsExactly("library_item.user_id = :userId");
    }

    @Test
    @DisplayName("blank and empty inputs are no-ops")
    void blankInputs_areNoOps() {
        LibraryItemQuery query = apply(LibraryItemSearchCriteria.builder()
                .query("   ")
                .typeFilter("")
                .scope(ScopeFilter.ALL)
                .readFilter(ReadFilter.ALL)
                .labelFilters(List.of())
                .hasFilters(List.of())
                .dateFilters(List.of())
                .termFilters(List.of())
                .matchFilters(List.of())
                .ids(List.of())
                .noFilters(List.of())
                .recommendedBy(" ")
                .build());

        assertThat(query.getConditions()).hasSize(3);
    }

    @Nested
    @DisplayName("free-text query")
    class FreeText {

        @Test
        @DisplayName("adds rank projection, match predicate and a leading rank ordering")
        void query_addsRankAndMatch() {
            LibraryItemQuery query = LibraryItemQuery.forUser(userId)
                    .orderBy("library_item.saved_at DESC NULLS LAST");
            predicates.apply(LibraryItemSearchCriteria.builder().query(" climate ").build(), query, NOW);

            assertThat(query.getSelections()).containsExactly(
                    "ts_rank_cd(library_item.search_tsv, websearch_to_tsquery('english', :query)) AS rank");
            assertThat(query.getConditions())
                    .contains("websearch_to_tsquery('english', :query) @@ library_item.search_tsv");
            assertThat(query.getOrderings())
                    .containsExactly("rank DESC", "library_item.saved_at DESC NULLS LAST");
            assertThat(query.getParameters()).containsEntry("query", "climate");
        }

        @Test
        @DisplayName("caller text never reaches the SQL")
        void query_isBoundNotInlined() {
            String hostile = "x'); DROP TABLE library_item; --";
            LibraryItemQuery query = apply(LibraryItemSearchCriteria.builder()
                    .query(hostile)
                    .typeFilter(hostile)
                    .recommendedBy(hostile)
                    .termFilters(List.of(new TermFilter(TermField.AUTHOR, hostile)))
                    .matchFilters(List.of(new MatchFilter(MatchField.NOTE, hostile)))
                    .labelFilters(List.of(new LabelFilter(List.of(hostile), LabelFilterMode.INCLUDE)))
                    .build());

            assertThat(query.toSelectSql()).doesNotContain("DROP TABLE");
            assertThat(query.toCountSql()).doesNotContain("DROP TABLE");
        }
    }

    @Test
    @DisplayName("type filter compares lower-cased values")
    void typeFilter_isCaseInsensitive() {
        LibraryItemQuery query = apply(LibraryItemSearchCriteria.builder().typeFilter("Article").build());

        assertThat(query.getConditions()).contains("lower(library_item.item_type) = :typeFilter");
        assertThat(query.getParameters()).containsEntry("typeFilter", "article");
    }

    @Nested
    @DisplayName("scope filter")
    class Scope {

        @Test
        @DisplayName("INBOX and ARCHIVE test the archive timestamp")
        void inboxAndArchive() {
            assertThat(apply(LibraryItemSearchCriteria.builder().scope(ScopeFilter.INBOX).build()).getConditions())
                    .contains("library_item.archived_at IS NULL");
            assertThat(apply(LibraryItemSearchCriteria.builder().scope(ScopeFilter.ARCHIVE).build()).getConditions())
                    .contains("library_item.archived_at IS NOT NULL");
        }

        @Test
        @DisplayName("TRASH keeps deleted items of the last 14 days")
        void trash_usesRetentionWindowAndKeepsDeleted() {
            LibraryItemQuery query = apply(LibraryItemSearchCriteria.builder().scope(ScopeFilter.TRASH).build());

            assertThat(query.getConditions())
                    .contains("library_item.deleted_at >= :trashCutoff")
                    .doesNotContain("library_item.state <> :deletedState");
            assertThat(query.getParameters()).containsEntry("trashCutoff", NOW.minus(Duration.ofDays(14)));
        }

        @Test
        @DisplayName("SUBSCRIPTION excludes items carrying the library label")
        void subscription() {
            LibraryItemQuery query = apply(LibraryItemSearchCriteria.builder().scope(ScopeFilter.SUBSCRIPTION).build());

            assertThat(query.getConditions()).contains(
                    "(library_item.subscription IS NOT NULL AND NOT ('library' ILIKE ANY(library_item.label_names))"
                            + " AND library_item.archived_at IS NULL)");
        }

        @Test
        @DisplayName("LIBRARY accepts non-subscription items or ones carrying the library label")
        void library() {
            LibraryItemQuery query = apply(LibraryItemSearchCriteria.builder().scope(ScopeFilter.LIBRARY).build());

            assertThat(query.getConditions()).contains(
                    "((library_item.subscription IS NULL OR 'library' ILIKE ANY(library_item.label_names))"
                            + " AND library_item.archived_at IS NULL)");
        }
    }

    @Test
    @DisplayName("read filter compares the top reading progress with the threshold")
    void readFilter() {
        LibraryItemQuery read = apply(LibraryItemSearchCriteria.builder().readFilter(ReadFilter.READ).build());
        LibraryItemQuery unread = apply(LibraryItemSearchCriteria.builder().readFilter(ReadFilter.UNREAD).build());

        assertThat(read.getConditions()).contains("library_item.reading_progress_top_percent >= :readThreshold");
        assertThat(unread.getConditions()).contains("library_item.reading_progress_top_percent < :readThreshold");
        assertThat(read.getParameters()).containsEntry("readThreshold", 98.0);
    }

    @Test
    @DisplayName("has filters check array length on the derived columns")
    void hasFilters() {
        LibraryItemQuery query = apply(LibraryItemSearchCriteria.builder()
                .hasFilters(List.of(HasFilter.HIGHLIGHTS, HasFilter.LABELS))
                .build());

        assertThat(query.getConditions()).contains(
                "array_length(library_item.highlight_annotations, 1) > 0",
                "array_length(library_item.label_names, 1) > 0");
    }

    @Nested
    @DisplayName("label filters")
    class Labels {

        @Test
        @DisplayName("each include entry becomes its own overlap clause")
        void includeEntries_areAnded() {
            LibraryItemQuery query = apply(LibraryItemSearchCriteria.builder()
                    .labelFilters(List.of(
                            new LabelFilter(List.of("News", "Tech"), LabelFilterMode.INCLUDE),
                            new LabelFilter(List.of("Later"), LabelFilterMode.INCLUDE)))
                    .build());

            assertThat(query.getConditions())
                    .filteredOn(c -> c.contains(":includeLabels_"))
                    .hasSize(2);
            assertThat(query.getConditions())
                    .contains("CAST(lower(CAST(array_cat(library_item.label_names, library_item.highlight_labels)"
                            + " AS text)) AS text[]) && CAST(:includeLabels_0 AS text[])");
            assertThat((String[]) query.getParameters().get("includeLabels_0")).containsExactly("news", "tech");
            assertThat((String[]) query.getParameters().get("includeLabels_1")).containsExactly("later");
        }

        @Test
        @DisplayName("exclude entries are unioned into a single NOT clause")
        void excludeEntries_areUnioned() {
            LibraryItemQuery query = apply(LibraryItemSearchCriteria.builder()
                    .labelFilters(List.of(
                            new LabelFilter(List.of("Spam"), LabelFilterMode.EXCLUDE),
                            new LabelFilter(List.of("Ads", "spam"), LabelFilterMode.EXCLUDE)))
                    .build());

            assertThat(query.getConditions())
                    .filteredOn(c -> c.startsWith("NOT ("))
                    .containsExactly("NOT (CAST(lower(CAST(array_cat(library_item.label_names, library_item.highlight_labels)"
                            + " AS text)) AS text[]) && CAST(:excludeLabels AS text[]))");
            assertThat((String[]) query.getParameters().get("excludeLabels")).containsExactly("spam", "ads");
        }
    }

    @Nested
    @DisplayName("date filters")
    class Dates {

        @Test
        @DisplayName("open bounds default to epoch and now")
        void openBounds_defaultToEpochAndNow() {
            LibraryItemQuery query = apply(LibraryItemSearchCriteria.builder()
                    .dateFilters(List.of(new DateFilter(DateField.SAVED_AT, null, null)))
                    .build());

            assertThat(query.getConditions())
                    .contains("library_item.saved_at BETWEEN :date_saved_at_0_start AND :date_saved_at_0_end");
            assertThat(query.getParameters())
                    .containsEntry("date_saved_at_0_start", Instant.EPOCH)
                    .containsEntry("date_saved_at_0_end", NOW);
        }

        @Test
        @DisplayName("two ranges on the same field get distinct parameters")
        void repeatedField_getsDistinctNames() {
            Instant start = Instant.parse("2024-01-01T00:00:00Z");
            Instant end = Instant.parse("2024-02-01T00:00:00Z");
            LibraryItemQuery query = apply(LibraryItemSearchCriteria.builder()
                    .dateFilters(List.of(
                            new DateFilter(DateField.PUBLISHED_AT, start, null),
                            new DateFilter(DateField.PUBLISHED_AT, null, end)))
                    .build());

            assertThat(query.getParameters())
                    .containsEntry("date_published_at_0_start", start)
                    .containsEntry("date_published_at_0_end", NOW)
                    .containsEntry("date_published_at_1_start", Instant.EPOCH)
                    .containsEntry("date_published_at_1_end", end);
        }
    }

    @Test
    @DisplayName("term and match filters use whitelisted columns and indexed parameter names")
    void termAndMatchFilters() {
        LibraryItemQuery query = apply(LibraryItemSearchCriteria.builder()
                .termFilters(List.of(new TermFilter(TermField.SITE_NAME, "Wonder Times")))
                .matchFilters(List.of(new MatchFilter(MatchField.TITLE, "world news")))
                .build());

        assertThat(query.getConditions()).contains(
                "lower(library_item.site_name) = :term_site_name_0",
                "websearch_to_tsquery('english', :match_title_0) @@ library_item.title_tsv");
        assertThat(query.getParameters())
                .containsEntry("term_site_name_0", "wonder times")
                .containsEntry("match_title_0", "world news");
    }

    @Test
    @DisplayName("id filter binds the distinct ids")
    void idFilter() {
        UUID id = UUID.randomUUID();
        LibraryItemQuery query = apply(LibraryItemSearchCriteria.builder().ids(List.of(id, id)).build());

        assertThat(query.getConditions()).contains("library_item.id IN (:ids)");
        assertThat(query.getParameters()).containsEntry("ids", List.of(id));
    }

    @Test
    @DisplayName("no filters require empty arrays")
    void noFilters() {
        LibraryItemQuery query = apply(LibraryItemSearchCriteria.builder()
                .noFilters(List.of(new NoFilter(NoFilterField.LABELS), new NoFilter(NoFilterField.HIGHLIGHTS)))
                .build());

        assertThat(query.getConditions()).contains(
                "cardinality(library_item.label_names) = 0",
                "cardinality(library_item.highlight_annotations) = 0");
    }

    @Nested
    @DisplayName("recommended by")
    class RecommendedBy {

        @Test
        @DisplayName("* matches any recommended item")
        void wildcard() {
            LibraryItemQuery query = apply(LibraryItemSearchCriteria.builder().recommendedBy("*").build());

            assertThat(query.getConditions()).contains("cardinality(library_item.recommender_names) > 0");
            assertThat(query.getParameters()).doesNotContainKey("recommendedBy");
        }

        @Test
        @DisplayName("a name matches case-insensitively")
        void name() {
            LibraryItemQuery query = apply(LibraryItemSearchCriteria.builder().recommendedBy("Alice").build());

            assertThat(query.getParameters()).containsEntry("recommendedBy", "alice");
            assertThat(query.getConditions()).anyMatch(c -> c.contains("CAST(:recommendedBy AS text)"));
        }
    }

    @Test
    @DisplayName("rules are independent of each other and of criteria order")
    void combinedRules_doNotCollide() {
        LibraryItemQuery query = apply(LibraryItemSearchCriteria.builder()
                .scope(ScopeFilter.INBOX)
                .readFilter(ReadFilter.UNREAD)
                .typeFilter("ARTICLE")
                .dateFilters(List.of(new DateFilter(DateField.SAVED_AT, null, null)))
                .termFilters(List.of(new TermFilter(TermField.LANGUAGE, "en")))
                .build());

        assertThat(query.getConditions()).hasSize(8);
        assertThat(query.getParameters()).containsKeys(
                "userId", "typeFilter", "readThreshold", "date_saved_at_0_start", "date_saved_at_0_end",
                "term_language_0", "pendingState", "deletedState");
    }
}
