package uk.gegc.readlater.features.label.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * Join row attaching a label to a library item. The (label, item) pair is the key,
 * so a label is attached to an item at most once. Rows are never updated and are
 * removed only by cascade when either side is deleted.
 */
@Entity
@Table(name = "entity_labels")
@IdClass(EntityLabelId.class)
@Getter
@Setter
@NoArgsConstructor
public class EntityLabel {

    @Id
    @Column(name = "label_id", nullable = false, updatable = false)
    private UUID labelId;

    @Id
    @Column(name = "library_item_id", nullable = false, updatable = false)
    private UUID libraryItemId;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    public EntityLabel(UUID labelId, UUID libraryItemId) {
        this.labelId = labelId;
        this.libraryItemId = libraryItemId;
    }
}
