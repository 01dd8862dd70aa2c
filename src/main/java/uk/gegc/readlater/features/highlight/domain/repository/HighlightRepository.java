package uk.gegc.readlater.features.highlight.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.readlater.features.highlight.domain.model.Highlight;

import java.util.UUID;

@Repository
public interface HighlightRepository extends JpaRepository<Highlight, UUID> {
}
