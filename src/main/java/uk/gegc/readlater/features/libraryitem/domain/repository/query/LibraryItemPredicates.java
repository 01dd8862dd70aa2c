package uk.gegc.readlater.features.libraryitem.domain.repository.query;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.readlater.features.label.domain.model.Label;
import uk.gegc.readlater.features.libraryitem.api.dto.LibraryItemSearchCriteria;
import uk.gegc.readlater.features.libraryitem.api.dto.LibraryItemSearchCriteria.DateFilter;
import uk.gegc.readlater.features.libraryitem.api.dto.LibraryItemSearchCriteria.LabelFilter;
import uk.gegc.readlater.features.libraryitem.api.dto.LibraryItemSearchCriteria.MatchFilter;
import uk.gegc.readlater.features.libraryitem.api.dto.LibraryItemSearchCriteria.NoFilter;
import uk.gegc.readlater.features.libraryitem.api.dto.LibraryItemSearchCriteria.TermFilter;
import uk.gegc.readlater.features.libraryitem.config.LibraryProperties;
import uk.gegc.readlater.features.libraryitem.domain.model.LibraryItemState;
import uk.gegc.readlater.features.libraryitem.domain.model.search.HasFilter;
import uk.gegc.readlater.features.libraryitem.domain.model.search.LabelFilterMode;
import uk.gegc.readlater.features.libraryitem.domain.model.search.ReadFilter;
import uk.gegc.readlater.features.libraryitem.domain.model.search.ScopeFilter;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

import static uk.gegc.readlater.features.libraryitem.domain.repository.query.LibraryItemQuery.column;

/**
 * Translates a {@link LibraryItemSearchCriteria} into conditions on a {@link LibraryItemQuery}.
 * <p>
 * Each rule is guarded by the presence of its input; an absent or empty filter adds nothing.
 * Rules are independent of each other and may run in any order. The free-text rule is the
 * only one that touches ordering and always puts relevance first.
 */
@Component
@Slf4j
public class LibraryItemPredicates {

    static final String TEXT_SEARCH_CONFIG = "'english'";

    private static final String LABEL_UNION = "CAST(lower(CAST(array_cat(" + column("label_names") + ", "
            + column("highlight_labels") + ") AS text)) AS text[])";

    private static final String RECOMMENDERS_LOWER = "CAST(lower(CAST(" + column("recommender_names")
            + " AS text)) AS text[])";

    private static final String LIBRARY_LABEL_PRESENT = "'" + Label.LIBRARY_LABEL + "' ILIKE ANY("
            + column("label_names") + ")";

    private final Duration trashRetention;
    private final double readThresholdPercent;
    private final List<PredicateRule> rules;

    public LibraryItemPredicates(LibraryProperties properties) {
        this.trashRetention = Duration.ofDays(properties.getTrashRetentionDays());
        this.readThresholdPercent = properties.getReadThresholdPercent();
        this.rules = List.of(
                new PredicateRule("query", c -> hasText(c.query()), this::addQuery),
                new PredicateRule("type", c -> hasText(c.typeFilter()), this::addTypeFilter),
                new PredicateRule("scope", c -> c.scope() != null && c.scope() != ScopeFilter.ALL, this::addScopeFilter),
                new PredicateRule("read", c -> c.readFilter() != null && c.readFilter() != ReadFilter.ALL, this::addReadFilter),
                new PredicateRule("has", c -> notEmpty(c.hasFilters()), this::addHasFilters),
                new PredicateRule("labels", c -> notEmpty(c.labelFilters()), this::addLabelFilters),
                new PredicateRule("dates", c -> notEmpty(c.dateFilters()), this::addDateFilters),
                new PredicateRule("terms", c -> notEmpty(c.termFilters()), this::addTermFilters),
                new PredicateRule("matches", c -> notEmpty(c.matchFilters()), this::addMatchFilters),
                new PredicateRule("ids", c -> notEmpty(c.ids()), this::addIdFilter),
                new PredicateRule("pending", c -> !c.pendingIncluded(), this::excludePending),
                new PredicateRule("deleted", c -> !c.deletedIncluded() && c.scope() != ScopeFilter.TRASH, this::excludeDeleted),
                new PredicateRule("no", c -> notEmpty(c.noFilters()), this::addNoFilters),
                new PredicateRule("recommendedBy", c -> hasText(c.recommendedBy()), this::addRecommendedBy)
        );
    }

    /**
     * Applies every rule whose input is present.
     *
     * @param now reference time for open date ranges and the trash window
     */
    public void apply(LibraryItemSearchCriteria criteria, LibraryItemQuery query, Instant now) {
        Objects.requireNonNull(criteria, "criteria");
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(now, "now");
        List<String> applied = new ArrayList<>();
        for (PredicateRule rule : rules) {
            if (rule.condition().test(criteria)) {
                rule.clause().addTo(criteria, query, now);
                applied.add(rule.name());
            }
        }
        log.debug("Applied library item predicate rules {}", applied);
    }

    private void addQuery(LibraryItemSearchCriteria criteria, LibraryItemQuery query, Instant now) {
        String tsQuery = "websearch_to_tsquery(" + TEXT_SEARCH_CONFIG + ", :query)";
        query.bind("query", criteria.query().trim());
        query.select("ts_rank_cd(" + column("search_tsv") + ", " + tsQuery + ") AS rank");
        query.where(tsQuery + " @@ " + column("search_tsv"));
        query.orderByFirst("rank DESC");
    }

    private void addTypeFilter(LibraryItemSearchCriteria criteria, LibraryItemQuery query, Instant now) {
        query.where("lower(" + column("item_type") + ") = :typeFilter",
                "typeFilter", criteria.typeFilter().trim().toLowerCase(Locale.ROOT));
    }

    private void addScopeFilter(LibraryItemSearchCriteria criteria, LibraryItemQuery query, Instant now) {
        switch (criteria.scope()) {
            case INBOX -> query.where(column("archived_at") + " IS NULL");
            case ARCHIVE -> query.where(column("archived_at") + " IS NOT NULL");
            case TRASH -> query.where(column("deleted_at") + " >= :trashCutoff", "trashCutoff", now.minus(trashRetention));
            case SUBSCRIPTION -> query.where("(" + column("subscription") + " IS NOT NULL AND NOT ("
                    + LIBRARY_LABEL_PRESENT + ") AND " + column("archived_at") + " IS NULL)");
            case LIBRARY -> query.where("((" + column("subscription") + " IS NULL OR "
                    + LIBRARY_LABEL_PRESENT + ") AND " + column("archived_at") + " IS NULL)");
            case ALL -> {
            }
        }
    }

    private void addReadFilter(LibraryItemSearchCriteria criteria, LibraryItemQuery query, Instant now) {
        String operator = criteria.readFilter() == ReadFilter.READ ? ">=" : "<";
        query.where(column("reading_progress_top_percent") + " " + operator + " :readThreshold",
                "readThreshold", readThresholdPercent);
    }

    private void addHasFilters(LibraryItemSearchCriteria criteria, LibraryItemQuery query, Instant now) {
        for (HasFilter filter : new LinkedHashSet<>(criteria.hasFilters())) {
            if (filter != null) {
                query.where("array_length(" + column(filter.column()) + ", 1) > 0");
            }
        }
    }

    private void addLabelFilters(LibraryItemSearchCriteria criteria, LibraryItemQuery query, Instant now) {
        int includeIndex = 0;
        Set<String> excluded = new LinkedHashSet<>();
        for (LabelFilter filter : criteria.labelFilters()) {
            if (filter == null || filter.mode() == null) {
                continue;
            }
            List<String> labels = normalizeLabels(filter.labels());
            if (labels.isEmpty()) {
                continue;
            }
            if (filter.mode() == LabelFilterMode.INCLUDE) {
                String name = "includeLabels_" + includeIndex++;
                query.where(LABEL_UNION + " && CAST(:" + name + " AS text[])", name, labels.toArray(String[]::new));
            } else {
                excluded.addAll(labels);
            }
        }
        if (!excluded.isEmpty()) {
            query.where("NOT (" + LABEL_UNION + " && CAST(:excludeLabels AS text[]))",
                    "excludeLabels", excluded.toArray(String[]::new));
        }
    }

    private void addDateFilters(LibraryItemSearchCriteria criteria, LibraryItemQuery query, Instant now) {
        List<DateFilter> filters = criteria.dateFilters();
        for (int i = 0; i < filters.size(); i++) {
            DateFilter filter = filters.get(i);
            if (filter == null || filter.field() == null) {
                continue;
            }
            String columnName = filter.field().column();
            String start = "date_" + columnName + "_" + i + "_start";
            String end = "date_" + columnName + "_" + i + "_end";
            query.bind(start, filter.startDate() != null ? filter.startDate() : Instant.EPOCH);
            query.bind(end, filter.endDate() != null ? filter.endDate() : now);
            query.where(column(columnName) + " BETWEEN :" + start + " AND :" + end);
        }
    }

    private void addTermFilters(LibraryItemSearchCriteria criteria, LibraryItemQuery query, Instant now) {
        List<TermFilter> filters = criteria.termFilters();
        for (int i = 0; i < filters.size(); i++) {
            TermFilter filter = filters.get(i);
            if (filter == null || filter.field() == null || filter.value() == null) {
                continue;
            }
            String columnName = filter.field().column();
            String name = "term_" + columnName + "_" + i;
            query.where("lower(" + column(columnName) + ") = :" + name, name,
                    filter.value().toLowerCase(Locale.ROOT));
        }
    }

    private void addMatchFilters(LibraryItemSearchCriteria criteria, LibraryItemQuery query, Instant now) {
        List<MatchFilter> filters = criteria.matchFilters();
        for (int i = 0; i < filters.size(); i++) {
            MatchFilter filter = filters.get(i);
            if (filter == null || filter.field() == null || !hasText(filter.value())) {
                continue;
            }
            String name = "match_" + filter.field().field() + "_" + i;
            query.where("websearch_to_tsquery(" + TEXT_SEARCH_CONFIG + ", :" + name + ") @@ "
                    + column(filter.field().vectorColumn()), name, filter.value());
        }
    }

    private void addIdFilter(LibraryItemSearchCriteria criteria, LibraryItemQuery query, Instant now) {
        query.where(column("id") + " IN (:ids)", "ids", List.copyOf(new LinkedHashSet<>(criteria.ids())));
    }

    private void excludePending(LibraryItemSearchCriteria criteria, LibraryItemQuery query, Instant now) {
        query.where(column("state") + " <> :pendingState", "pendingState", LibraryItemState.PROCESSING.name());
    }

    private void excludeDeleted(LibraryItemSearchCriteria criteria, LibraryItemQuery query, Instant now) {
        query.where(column("state") + " <> :deletedState", "deletedState", LibraryItemState.DELETED.name());
    }

    private void addNoFilters(LibraryItemSearchCriteria criteria, LibraryItemQuery query, Instant now) {
        Set<String> columns = new LinkedHashSet<>();
        for (NoFilter filter : criteria.noFilters()) {
            if (filter != null && filter.field() != null) {
                columns.add(filter.field().column());
            }
        }
        for (String columnName : columns) {
            query.where("cardinality(" + column(columnName) + ") = 0");
        }
    }

    private void addRecommendedBy(LibraryItemSearchCriteria criteria, LibraryItemQuery query, Instant now) {
        String recommender = criteria.recommendedBy().trim();
        if ("*".equals(recommender)) {
            query.where("cardinality(" + column("recommender_names") + ") > 0");
            return;
        }
        query.where(RECOMMENDERS_LOWER + " && CAST(ARRAY[CAST(:recommendedBy AS text)] AS text[])",
                "recommendedBy", recommender.toLowerCase(Locale.ROOT));
    }

    private static List<String> normalizeLabels(Collection<String> labels) {
        if (labels == null) {
            return List.of();
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String label : labels) {
            if (hasText(label)) {
                normalized.add(label.trim().toLowerCase(Locale.ROOT));
            }
        }
        return new ArrayList<>(normalized);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static boolean notEmpty(Collection<?> values) {
        return values != null && !values.isEmpty();
    }

    @FunctionalInterface
    private interface ClauseBuilder {
        void addTo(LibraryItemSearchCriteria criteria, LibraryItemQuery query, Instant now);
    }

    private record PredicateRule(String name, Predicate<LibraryItemSearchCriteria> condition, ClauseBuilder clause) {
    }
}
