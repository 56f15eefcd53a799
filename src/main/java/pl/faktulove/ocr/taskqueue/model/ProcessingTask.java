package pl.faktulove.ocr.taskqueue.model;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.Setter;
import pl.faktulove.ocr.taskqueue.model.enums.ErrorKind;
import pl.faktulove.ocr.taskqueue.model.enums.TaskState;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * One unit of asynchronous OCR processing for a single uploaded document.
 *
 * <p>The row doubles as the lease record: while {@code PROCESSING} it carries the
 * worker holding it, a per-lease token and the lease expiry. Every write goes through
 * a compare-and-swap on {@link #version}.
 *
 * <p>{@link #activeDocumentId} mirrors {@link #documentId} until the task reaches a
 * terminal state and is null afterwards. Its unique index lets the database refuse a
 * second active task for the same document.
 *
 * @see pl.faktulove.ocr.taskqueue.services.LeaseTableTaskQueue
 */
@Data
@NoArgsConstructor
@EqualsAndHashCode(onlyExplicitlyIncluded = true, callSuper = false)
@Entity
@Table(name = "ocr_processing_task", indexes = {
        @Index(name = "idx_ocr_task_state", columnList = "state, not_before"),
        @Index(name = "idx_ocr_task_document", columnList = "document_id")
})
public class ProcessingTask extends PanacheEntityBase {

    public static final int MAX_ERROR_LENGTH = 5000;

    @Id
    @EqualsAndHashCode.Include
    @Column(length = 36)
    private String id;

    @Column(name = "document_id", length = 36, nullable = false)
    private String documentId;

    @Column(name = "owner_id", nullable = false)
    private String ownerId;

    @Setter(AccessLevel.NONE)
    @Column(name = "active_document_id", length = 36, unique = true)
    private String activeDocumentId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TaskState state = TaskState.PENDING;

    @Column(name = "progress_percent", nullable = false)
    private int progressPercent;

    @Column(name = "attempt_count", nullable = false)
    private int attemptCount;

    @Enumerated(EnumType.STRING)
    @Column(name = "last_error_kind", length = 30)
    private ErrorKind lastErrorKind;

    @Column(name = "last_error_message", columnDefinition = "TEXT")
    private String lastErrorMessage;

    @Column(name = "lease_owner")
    private String leaseOwner;

    @Column(name = "lease_token", length = 36)
    private String leaseToken;

    @Column(name = "lease_expiry")
    private LocalDateTime leaseExpiry;

    /**
     * A requeued task is not claimable before this instant.
     */
    @Column(name = "not_before")
    private LocalDateTime notBefore;

    @Column(name = "result_id", length = 36)
    private String resultId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Column(nullable = false)
    private long version;

    public ProcessingTask(String documentId, String ownerId, LocalDateTime now) {
        this.id = UUID.randomUUID().toString();
        this.documentId = documentId;
        this.ownerId = ownerId;
        this.activeDocumentId = documentId;
        this.state = TaskState.PENDING;
        this.createdAt = now;
        this.updatedAt = now;
        this.notBefore = now;
    }

    public ProcessingTask copy() {
        ProcessingTask copy = new ProcessingTask();
        copy.id = id;
        copy.documentId = documentId;
        copy.ownerId = ownerId;
        copy.activeDocumentId = activeDocumentId;
        copy.state = state;
        copy.progressPercent = progressPercent;
        copy.attemptCount = attemptCount;
        copy.lastErrorKind = lastErrorKind;
        copy.lastErrorMessage = lastErrorMessage;
        copy.leaseOwner = leaseOwner;
        copy.leaseToken = leaseToken;
        copy.leaseExpiry = leaseExpiry;
        copy.notBefore = notBefore;
        copy.resultId = resultId;
        copy.createdAt = createdAt;
        copy.updatedAt = updatedAt;
        copy.version = version;
        return copy;
    }

    public void setState(TaskState state) {
        this.state = state;
        this.activeDocumentId = state.isTerminal() ? null : documentId;
    }

    public void recordError(ErrorKind kind, String message) {
        this.lastErrorKind = kind;
        this.lastErrorMessage = message != null && message.length() > MAX_ERROR_LENGTH
                ? message.substring(0, MAX_ERROR_LENGTH) + "... (truncated)"
                : message;
    }

    public void clearLease() {
        this.leaseOwner = null;
        this.leaseToken = null;
        this.leaseExpiry = null;
    }

    public boolean isLeaseExpired(LocalDateTime now) {
        return leaseExpiry != null && !leaseExpiry.isAfter(now);
    }

    /**
     * True when the given token names the current, unexpired lease.
     */
    public boolean isLeasedBy(String token, LocalDateTime now) {
        return state == TaskState.PROCESSING
                && token != null
                && token.equals(leaseToken)
                && !isLeaseExpired(now);
    }
}
