package pl.faktulove.ocr.validationservice.model;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Audit entry for one accepted correction request. Append-only.
 */
@Data
@NoArgsConstructor
@EqualsAndHashCode(onlyExplicitlyIncluded = true, callSuper = false)
@Entity
@Table(name = "ocr_validation_record", indexes = {
        @Index(name = "idx_ocr_validation_result", columnList = "result_id, created_at")
})
public class ValidationRecord extends PanacheEntityBase {

    @Id
    @EqualsAndHashCode.Include
    @Column(length = 36)
    private String id;

    @Column(name = "result_id", length = 36, nullable = false, updatable = false)
    private String resultId;

    @Column(name = "corrector_id", nullable = false, updatable = false)
    private String correctorId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "ocr_validation_change", joinColumns = @JoinColumn(name = "record_id"))
    @OrderColumn(name = "position")
    private List<FieldChange> changes = new ArrayList<>();

    @Column(name = "aggregate_before", nullable = false, updatable = false)
    private double aggregateBefore;

    @Column(name = "aggregate_after", nullable = false, updatable = false)
    private double aggregateAfter;

    @Column(name = "invoice_ref", updatable = false)
    private String invoiceRef;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public ValidationRecord(String resultId, String correctorId, List<FieldChange> changes, LocalDateTime now) {
        this.id = UUID.randomUUID().toString();
        this.resultId = resultId;
        this.correctorId = correctorId;
        this.changes = new ArrayList<>(changes);
        this.createdAt = now;
    }

    public List<String> correctedFieldNames() {
        return changes.stream().map(FieldChange::getFieldName).toList();
    }
}
