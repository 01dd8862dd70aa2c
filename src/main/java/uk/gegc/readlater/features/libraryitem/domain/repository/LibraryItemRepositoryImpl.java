package uk.gegc.readlater.features.libraryitem.domain.repository;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.Query;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import uk.gegc.readlater.features.libraryitem.domain.model.LibraryItem;
import uk.gegc.readlater.features.libraryitem.domain.repository.query.LibraryItemQuery;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Repository
@Slf4j
public class LibraryItemRepositoryImpl implements LibraryItemRepositoryCustom {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    @SuppressWarnings("unchecked")
    public List<LibraryItem> findPage(LibraryItemQuery query, int offset, int limit) {
        String sql = query.toSelectSql();
        log.debug("Library item page query: {} [offset={}, limit={}]", sql, offset, limit);
        Query nativeQuery = entityManager.createNativeQuery(sql, LibraryItem.class);
        bindParameters(nativeQuery, query.parametersFor(sql));
        nativeQuery.setFirstResult(offset);
        nativeQuery.setMaxResults(limit);
        return nativeQuery.getResultList();
    }

    @Override
    public long countMatching(LibraryItemQuery query) {
        String sql = query.toCountSql();
        log.debug("Library item count query: {}", sql);
        Query nativeQuery = entityManager.createNativeQuery(sql);
        bindParameters(nativeQuery, query.parametersFor(sql));
        return ((Number) nativeQuery.getSingleResult()).longValue();
    }

    @Override
    public List<UUID> findIdsMatching(LibraryItemQuery query) {
        String sql = query.toIdSql();
        log.debug("Library item id query: {}", sql);
        Query nativeQuery = entityManager.createNativeQuery(sql);
        bindParameters(nativeQuery, query.parametersFor(sql));
        List<?> rows = nativeQuery.getResultList();
        return rows.stream()
                .map(row -> row instanceof UUID uuid ? uuid : UUID.fromString(row.toString()))
                .toList();
    }

    @Override
    public int updateMatching(LibraryItemQuery query, List<String> assignments) {
        String sql = query.toUpdateSql(assignments);
        log.debug("Library item bulk update: {}", sql);
        // pending entity changes must reach the table before the statement, and cached state is stale after it
        entityManager.flush();
        Query nativeQuery = entityManager.createNativeQuery(sql);
        bindParameters(nativeQuery, query.parametersFor(sql));
        int updated = nativeQuery.executeUpdate();
        entityManager.clear();
        return updated;
    }

    private void bindParameters(Query nativeQuery, Map<String, Object> parameters) {
        parameters.forEach((name, value) -> {
            if (value instanceof Collection<?> values) {
                nativeQuery.unwrap(org.hibernate.query.Query.class).setParameterList(name, values);
            } else {
                nativeQuery.setParameter(name, value);
            }
        });
    }
}
