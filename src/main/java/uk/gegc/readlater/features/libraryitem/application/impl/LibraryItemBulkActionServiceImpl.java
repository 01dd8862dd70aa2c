package uk.gegc.readlater.features.libraryitem.application.impl;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.readlater.features.label.domain.model.EntityLabel;
import uk.gegc.readlater.features.label.domain.model.EntityLabelId;
import uk.gegc.readlater.features.label.domain.model.Label;
import uk.gegc.readlater.features.label.domain.repository.EntityLabelRepository;
import uk.gegc.readlater.features.label.domain.repository.LabelRepository;
import uk.gegc.readlater.features.libraryitem.api.dto.BulkActionResult;
import uk.gegc.readlater.features.libraryitem.api.dto.LibraryItemSearchCriteria;
import uk.gegc.readlater.features.libraryitem.application.LibraryItemBulkActionService;
import uk.gegc.readlater.features.libraryitem.domain.model.BulkActionType;
import uk.gegc.readlater.features.libraryitem.domain.model.LibraryItemState;
import uk.gegc.readlater.features.libraryitem.domain.repository.LibraryItemRepository;
import uk.gegc.readlater.features.libraryitem.domain.repository.query.LibraryItemPredicates;
import uk.gegc.readlater.features.libraryitem.domain.repository.query.LibraryItemQuery;
import uk.gegc.readlater.shared.exception.InvalidBulkActionException;
import uk.gegc.readlater.shared.exception.ResourceNotFoundException;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@Transactional
@Slf4j
public class LibraryItemBulkActionServiceImpl implements LibraryItemBulkActionService {

    private static final double FULLY_READ_PERCENT = 100.0;

    private final LibraryItemRepository libraryItemRepository;
    private final LabelRepository labelRepository;
    private final EntityLabelRepository entityLabelRepository;
    private final LibraryItemPredicates libraryItemPredicates;
    private final Clock clock;
    private final Map<BulkActionType, Counter> affectedRowCounters = new EnumMap<>(BulkActionType.class);

    public LibraryItemBulkActionServiceImpl(LibraryItemRepository libraryItemRepository,
                                            LabelRepository labelRepository,
                                            EntityLabelRepository entityLabelRepository,
                                            LibraryItemPredicates libraryItemPredicates,
                                            Clock clock,
                                            MeterRegistry meterRegistry) {
        this.libraryItemRepository = libraryItemRepository;
        this.labelRepository = labelRepository;
        this.entityLabelRepository = entityLabelRepository;
        this.libraryItemPredicates = libraryItemPredicates;
        this.clock = clock;
        for (BulkActionType action : BulkActionType.values()) {
            affectedRowCounters.put(action, Counter.builder("library.bulk_actions.rows")
                    .description("Rows changed by library bulk actions")
                    .tag("action", action.name())
                    .register(meterRegistry));
        }
    }

    @Override
    public BulkActionResult performBulkAction(BulkActionType action,
                                              LibraryItemSearchCriteria criteria,
                                              List<UUID> labelIds,
                                              UUID userId) {
        if (action == null) {
            throw new InvalidBulkActionException("Bulk action is required");
        }
        if (action == BulkActionType.ADD_LABELS && (labelIds == null || labelIds.isEmpty())) {
            throw new InvalidBulkActionException("ADD_LABELS requires at least one label id");
        }
        LibraryItemSearchCriteria effective = criteria != null ? criteria : LibraryItemSearchCriteria.empty();
        Instant now = clock.instant();
        LibraryItemQuery query = LibraryItemQuery.forUser(userId);
        libraryItemPredicates.apply(effective, query, now);

        long affected = switch (action) {
            case ARCHIVE -> {
                query.bind("bulkNow", now).bind("bulkState", LibraryItemState.ARCHIVED.name());
                yield libraryItemRepository.updateMatching(query,
                        List.of("archived_at = :bulkNow", "state = :bulkState", "updated_at = :bulkNow"));
            }
            case DELETE -> {
                query.bind("bulkNow", now).bind("bulkState", LibraryItemState.DELETED.name());
                yield libraryItemRepository.updateMatching(query,
                        List.of("deleted_at = :bulkNow", "state = :bulkState", "updated_at = :bulkNow"));
            }
            case MARK_AS_READ -> {
                query.bind("bulkNow", now).bind("fullyRead", FULLY_READ_PERCENT);
                yield libraryItemRepository.updateMatching(query, List.of(
                        "read_at = :bulkNow",
                        "reading_progress_top_percent = :fullyRead",
                        "reading_progress_bottom_percent = :fullyRead",
                        "updated_at = :bulkNow"));
            }
            case ADD_LABELS -> addLabels(query, labelIds, userId);
        };

        affectedRowCounters.get(action).increment(affected);
        log.info("Bulk action {} for user {} affected {} rows", action, userId, affected);
        return new BulkActionResult(action, affected);
    }

    private long addLabels(LibraryItemQuery query, List<UUID> labelIds, UUID userId) {
        Set<UUID> requested = new LinkedHashSet<>(labelIds);
        List<Label> labels = labelRepository.findAllByIdInAndUserId(requested, userId);
        if (labels.size() != requested.size()) {
            Set<UUID> found = labels.stream().map(Label::getId).collect(Collectors.toSet());
            List<UUID> missing = requested.stream().filter(id -> !found.contains(id)).toList();
            throw new ResourceNotFoundException("Labels not found: " + missing);
        }

        List<UUID> itemIds = libraryItemRepository.findIdsMatching(query);
        if (itemIds.isEmpty()) {
            return 0;
        }

        Set<EntityLabelId> existing = entityLabelRepository.findAllByLibraryItemIdInAndLabelIdIn(itemIds, requested)
                .stream()
                .map(link -> new EntityLabelId(link.getLabelId(), link.getLibraryItemId()))
                .collect(Collectors.toSet());

        List<EntityLabel> toInsert = new ArrayList<>();
        for (UUID itemId : itemIds) {
            for (UUID labelId : requested) {
                if (!existing.contains(new EntityLabelId(labelId, itemId))) {
                    toInsert.add(new EntityLabel(labelId, itemId));
                }
            }
        }
        entityLabelRepository.saveAll(toInsert);
        log.debug("Attached {} labels to {} items ({} links already present)",
                requested.size(), itemIds.size(), existing.size());
        return toInsert.size();
    }
}
