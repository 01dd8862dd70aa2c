package uk.gegc.readlater.features.highlight.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.BatchSize;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import uk.gegc.readlater.features.label.domain.model.Label;
import uk.gegc.readlater.features.libraryitem.domain.model.LibraryItem;
import uk.gegc.readlater.features.user.domain.model.User;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

@Entity
@Table(name = "highlights")
@Getter
@Setter
@NoArgsConstructor
public class Highlight {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "highlight_id", updatable = false, nullable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "library_item_id", nullable = false)
    private LibraryItem libraryItem;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    private User user;

    @Column(name = "quote", length = 10000)
    private String quote;

    @Column(name = "annotation", length = 10000)
    private String annotation;

    @ManyToMany(fetch = FetchType.LAZY)
    @JoinTable(
            name = "highlight_labels",
            joinColumns = @JoinColumn(name = "highlight_id", nullable = false),
            inverseJoinColumns = @JoinColumn(name = "label_id", nullable = false)
    )
    @BatchSize(size = 50)
    private Set<Label> labels = new HashSet<>();

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;
}
