package uk.gegc.readlater.features.libraryitem.domain.repository;

import uk.gegc.readlater.features.libraryitem.domain.model.LibraryItem;
import uk.gegc.readlater.features.libraryitem.domain.repository.query.LibraryItemQuery;

import java.util.List;
import java.util.UUID;

/**
 * Native statements built from a {@link LibraryItemQuery}.
 */
public interface LibraryItemRepositoryCustom {

    List<LibraryItem> findPage(LibraryItemQuery query, int offset, int limit);

    long countMatching(LibraryItemQuery query);

    List<UUID> findIdsMatching(LibraryItemQuery query);

    /**
     * Runs one UPDATE over every matching row.
     *
     * @param assignments {@code column = expression} fragments; their parameters must already be bound on the query
     * @return number of updated rows
     */
    int updateMatching(LibraryItemQuery query, List<String> assignments);
}
