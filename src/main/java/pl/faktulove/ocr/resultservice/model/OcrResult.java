package pl.faktulove.ocr.resultservice.model;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Structured fields extracted from one completed task. Written once by the worker;
 * afterwards only manual validation changes field values and confidences.
 */
@Data
@NoArgsConstructor
@EqualsAndHashCode(onlyExplicitlyIncluded = true, callSuper = false)
@Entity
@Table(name = "ocr_result", indexes = {
        @Index(name = "idx_ocr_result_owner", columnList = "owner_id, created_at")
})
public class OcrResult extends PanacheEntityBase {

    @Id
    @EqualsAndHashCode.Include
    @Column(length = 36)
    private String id;

    @Column(name = "task_id", length = 36, nullable = false, unique = true)
    private String taskId;

    @Column(name = "document_id", length = 36, nullable = false)
    private String documentId;

    @Column(name = "owner_id", nullable = false)
    private String ownerId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "ocr_result_field", joinColumns = @JoinColumn(name = "result_id"))
    @MapKeyColumn(name = "field_name", length = 40)
    private Map<String, ExtractedField> fields = new LinkedHashMap<>();

    @Column(name = "aggregate_confidence", nullable = false)
    private double aggregateConfidence;

    @Column(name = "needs_review", nullable = false)
    private boolean needsReview;

    @Column(name = "raw_text", columnDefinition = "LONGTEXT")
    private String rawText;

    @Column(name = "engine_id", length = 100)
    private String engineId;

    @Column(name = "processing_duration_ms", nullable = false)
    private long processingDurationMillis;

    @Column(name = "invoice_ref")
    private String invoiceRef;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Column(nullable = false)
    private long version;

    public OcrResult(String taskId, String documentId, String ownerId, LocalDateTime now) {
        this.id = UUID.randomUUID().toString();
        this.taskId = taskId;
        this.documentId = documentId;
        this.ownerId = ownerId;
        this.createdAt = now;
        this.updatedAt = now;
    }

    public OcrResult copy() {
        OcrResult copy = new OcrResult();
        copy.id = id;
        copy.taskId = taskId;
        copy.documentId = documentId;
        copy.ownerId = ownerId;
        Map<String, ExtractedField> fieldCopies = new LinkedHashMap<>();
        fields.forEach((name, field) -> fieldCopies.put(name, field.copy()));
        copy.fields = fieldCopies;
        copy.aggregateConfidence = aggregateConfidence;
        copy.needsReview = needsReview;
        copy.rawText = rawText;
        copy.engineId = engineId;
        copy.processingDurationMillis = processingDurationMillis;
        copy.invoiceRef = invoiceRef;
        copy.createdAt = createdAt;
        copy.updatedAt = updatedAt;
        copy.version = version;
        return copy;
    }
}
