package uk.gegc.readlater.features.label.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
        name = "labels",
        uniqueConstraints = @UniqueConstraint(name = "uk_labels_user_name", columnNames = {"user_id", "name"})
)
@Getter
@Setter
@NoArgsConstructor
public class Label {

    /**
     * Reserved label that moves a subscription item into the library folder.
     */
    public static final String LIBRARY_LABEL = "library";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "label_id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "color", length = 20)
    private String color;

    @Column(name = "description", length = 500)
    private String description;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;
}
