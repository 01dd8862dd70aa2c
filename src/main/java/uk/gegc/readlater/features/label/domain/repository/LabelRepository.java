package uk.gegc.readlater.features.label.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.readlater.features.label.domain.model.Label;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface LabelRepository extends JpaRepository<Label, UUID> {

    List<Label> findAllByIdInAndUserId(Collection<UUID> ids, UUID userId);
}
