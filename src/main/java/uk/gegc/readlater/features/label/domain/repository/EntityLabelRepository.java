package uk.gegc.readlater.features.label.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.readlater.features.label.domain.model.EntityLabel;
import uk.gegc.readlater.features.label.domain.model.EntityLabelId;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface EntityLabelRepository extends JpaRepository<EntityLabel, EntityLabelId> {

    List<EntityLabel> findAllByLibraryItemIdInAndLabelIdIn(Collection<UUID> libraryItemIds, Collection<UUID> labelIds);

    List<EntityLabel> findAllByLibraryItemId(UUID libraryItemId);
}
