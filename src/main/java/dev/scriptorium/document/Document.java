package dev.scriptorium.document;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * An ingested document: its title, source identifier, full extracted text and JSONB metadata.
 *
 * <p>A document owns zero or more {@link Chunk}s. The {@code chunks.document_id} foreign key is
 * declared {@code ON DELETE CASCADE}, so deleting a document removes its chunks in the same
 * statement.
 *
 * <p>Maps to the {@code documents} table managed by Flyway migrations.
 *
 * @see DocumentRepository
 */
@Entity
@Table(name = "documents")
public class Document {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String title;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String source;

    @Column(name = "content", nullable = false, columnDefinition = "TEXT")
    private String fullText;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(nullable = false, columnDefinition = "JSONB")
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected Document() {
        // JPA requires no-arg constructor
    }

    /**
     * Creates a new document. Metadata is validated against {@link MetadataKeys}.
     *
     * @param title    display title used in context citations
     * @param source   path or identifier the document was read from
     * @param fullText the complete extracted text
     * @param metadata document-level metadata
     */
    public Document(String title, String source, String fullText, Map<String, ?> metadata) {
        this.title = title;
        this.source = source;
        this.fullText = fullText;
        this.metadata = new LinkedHashMap<>(MetadataKeys.validate(metadata));
    }

    @PrePersist
    protected void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }

    /**
     * Merges additional entries into the document metadata. This is the only mutation permitted
     * after creation.
     */
    public void enrichMetadata(Map<String, ?> entries) {
        Map<String, Object> merged = new LinkedHashMap<>(metadata);
        merged.putAll(MetadataKeys.validate(entries));
        this.metadata = merged;
    }

    public UUID getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public String getSource() {
        return source;
    }

    public String getFullText() {
        return fullText;
    }

    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
