package uk.gegc.readlater.features.libraryitem.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.BatchSize;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.DynamicUpdate;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;
import uk.gegc.readlater.features.highlight.domain.model.Highlight;
import uk.gegc.readlater.features.label.domain.model.Label;
import uk.gegc.readlater.features.recommendation.domain.model.Recommendation;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * A saved page, article or file owned by a single user.
 * <p>
 * The array columns ({@code label_names}, {@code highlight_labels},
 * {@code highlight_annotations}, {@code recommender_names}) are denormalised copies of
 * the join tables kept in sync by the database; the text-search vectors are generated
 * columns and are not mapped here.
 */
@Entity
@Table(name = "library_item")
@DynamicUpdate
@Getter
@Setter
@NoArgsConstructor
public class LibraryItem {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "title", nullable = false, length = 2048)
    private String title;

    @Column(name = "original_url", nullable = false, length = 4096)
    private String originalUrl;

    @Column(name = "slug", length = 2048)
    private String slug;

    @Column(name = "description", length = 4096)
    private String description;

    @Column(name = "author", length = 1024)
    private String author;

    @Column(name = "site_name", length = 1024)
    private String siteName;

    @Column(name = "site_icon", length = 4096)
    private String siteIcon;

    @Column(name = "thumbnail", length = 4096)
    private String thumbnail;

    @Enumerated(EnumType.STRING)
    @Column(name = "item_type", nullable = false, length = 20)
    private LibraryItemType itemType = LibraryItemType.UNKNOWN;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 20)
    private LibraryItemState state = LibraryItemState.SUCCEEDED;

    @Column(name = "readable_content", columnDefinition = "text")
    private String readableContent;

    @Column(name = "note", length = 4096)
    private String note;

    @Column(name = "subscription", length = 1024)
    private String subscription;

    @Column(name = "language", length = 50)
    private String language;

    @Column(name = "word_count")
    private Integer wordCount;

    @Column(name = "reading_progress_top_percent", nullable = false)
    private Double readingProgressTopPercent = 0.0;

    @Column(name = "reading_progress_bottom_percent", nullable = false)
    private Double readingProgressBottomPercent = 0.0;

    @Column(name = "reading_progress_highest_read_anchor", nullable = false)
    private Integer readingProgressHighestReadAnchor = 0;

    @Column(name = "saved_at", nullable = false)
    private Instant savedAt;

    @Column(name = "archived_at")
    private Instant archivedAt;

    @Column(name = "deleted_at")
    private Instant deletedAt;

    @Column(name = "read_at")
    private Instant readAt;

    @Column(name = "published_at")
    private Instant publishedAt;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    @JdbcTypeCode(SqlTypes.ARRAY)
    @Column(name = "label_names", nullable = false)
    private List<String> labelNames = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.ARRAY)
    @Column(name = "highlight_labels", nullable = false)
    private List<String> highlightLabels = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.ARRAY)
    @Column(name = "highlight_annotations", nullable = false)
    private List<String> highlightAnnotations = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.ARRAY)
    @Column(name = "recommender_names", nullable = false)
    private List<String> recommenderNames = new ArrayList<>();

    @ManyToMany(fetch = FetchType.LAZY)
    @JoinTable(
            name = "entity_labels",
            joinColumns = @JoinColumn(name = "library_item_id", nullable = false),
            inverseJoinColumns = @JoinColumn(name = "label_id", nullable = false)
    )
    @BatchSize(size = 50)
    private Set<Label> labels = new HashSet<>();

    @OneToMany(mappedBy = "libraryItem", cascade = CascadeType.REMOVE)
    @BatchSize(size = 50)
    private Set<Highlight> highlights = new HashSet<>();

    @OneToMany(mappedBy = "libraryItem", cascade = CascadeType.REMOVE)
    @BatchSize(size = 50)
    private Set<Recommendation> recommendations = new HashSet<>();
}
