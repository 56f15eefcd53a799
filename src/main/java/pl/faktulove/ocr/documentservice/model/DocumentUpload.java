package pl.faktulove.ocr.documentservice.model;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * An admitted upload. Immutable after creation except for the storage reference, which
 * is cleared once the blob has been purged.
 */
@Data
@NoArgsConstructor
@EqualsAndHashCode(onlyExplicitlyIncluded = true, callSuper = false)
@Entity
@Table(name = "ocr_document_upload")
public class DocumentUpload extends PanacheEntityBase {

    @Id
    @EqualsAndHashCode.Include
    @Column(length = 36)
    private String id;

    @Column(name = "owner_id", nullable = false)
    private String ownerId;

    @Column(name = "original_filename")
    private String originalFilename;

    @Column(name = "declared_mime_type", length = 100, nullable = false)
    private String declaredMimeType;

    @Column(name = "sniffed_mime_type", length = 100, nullable = false)
    private String sniffedMimeType;

    @Column(name = "size_bytes", nullable = false)
    private long sizeBytes;

    @Column(name = "storage_ref")
    private String storageRef;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public DocumentUpload(String ownerId, String originalFilename, String declaredMimeType,
                          String sniffedMimeType, long sizeBytes, String storageRef, LocalDateTime now) {
        this.id = UUID.randomUUID().toString();
        this.ownerId = ownerId;
        this.originalFilename = originalFilename;
        this.declaredMimeType = declaredMimeType;
        this.sniffedMimeType = sniffedMimeType;
        this.sizeBytes = sizeBytes;
        this.storageRef = storageRef;
        this.createdAt = now;
    }

    public DocumentUpload copy() {
        DocumentUpload copy = new DocumentUpload();
        copy.id = id;
        copy.ownerId = ownerId;
        copy.originalFilename = originalFilename;
        copy.declaredMimeType = declaredMimeType;
        copy.sniffedMimeType = sniffedMimeType;
        copy.sizeBytes = sizeBytes;
        copy.storageRef = storageRef;
        copy.createdAt = createdAt;
        return copy;
    }
}
