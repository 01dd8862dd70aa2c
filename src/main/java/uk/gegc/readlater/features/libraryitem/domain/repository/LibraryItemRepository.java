package uk.gegc.readlater.features.libraryitem.domain.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.readlater.features.libraryitem.domain.model.LibraryItem;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface LibraryItemRepository extends JpaRepository<LibraryItem, UUID>, LibraryItemRepositoryCustom {

    @EntityGraph(attributePaths = {"labels", "highlights", "highlights.user"})
    Optional<LibraryItem> findByIdAndUserId(UUID id, UUID userId);

    /**
     * Most recently saved item with this URL; the same URL may be saved more than once.
     */
    @EntityGraph(attributePaths = {
            "labels",
            "highlights",
            "highlights.user",
            "recommendations",
            "recommendations.recommender",
            "recommendations.recommender.profile",
            "recommendations.group"
    })
    Optional<LibraryItem> findFirstByOriginalUrlAndUserIdOrderBySavedAtDesc(String originalUrl, UUID userId);

    /**
     * Items whose title or site name starts with the given pattern.
     *
     * @param pattern lower-cased LIKE pattern using {@code !} as the escape character
     */
    @Query("""
            SELECT li FROM LibraryItem li
            WHERE li.userId = :userId
              AND (lower(li.title) LIKE :pattern ESCAPE '!'
                   OR lower(li.siteName) LIKE :pattern ESCAPE '!')
            ORDER BY li.savedAt DESC
            """)
    List<LibraryItem> findByTitleOrSiteNamePrefix(@Param("userId") UUID userId,
                                                  @Param("pattern") String pattern,
                                                  Pageable pageable);

    long countByUserIdAndCreatedAtBetween(UUID userId, Instant start, Instant end);

    long deleteByIdAndUserId(UUID id, UUID userId);

    long deleteByIdInAndUserId(Collection<UUID> ids, UUID userId);

    long deleteByOriginalUrlAndUserId(String originalUrl, UUID userId);

    long deleteByUserId(UUID userId);
}
