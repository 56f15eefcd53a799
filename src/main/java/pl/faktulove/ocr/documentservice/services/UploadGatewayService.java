package pl.faktulove.ocr.documentservice.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;
import pl.faktulove.ocr.config.OcrPipelineConfig;
import pl.faktulove.ocr.documentservice.dto.UploadReceipt;
import pl.faktulove.ocr.documentservice.model.DocumentUpload;
import pl.faktulove.ocr.documentservice.repositories.DocumentUploadStore;
import pl.faktulove.ocr.exceptions.*;
import pl.faktulove.ocr.statusservice.services.EtaEstimator;
import pl.faktulove.ocr.storage.DocumentStorage;
import pl.faktulove.ocr.taskqueue.model.ProcessingTask;
import pl.faktulove.ocr.taskqueue.model.enums.TaskState;
import pl.faktulove.ocr.taskqueue.repositories.TaskStore;
import pl.faktulove.ocr.taskqueue.services.TaskQueue;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Admits uploaded documents into the pipeline.
 *
 * <p>All checks run before anything is written. Once the blob is stored, a failure of any
 * later step removes what was written so far and gives the quota unit back.
 */
@JBossLog
@ApplicationScoped
public class UploadGatewayService {

    @Inject
    OcrPipelineConfig config;

    @Inject
    MimeTypeSniffer sniffer;

    @Inject
    UploadThrottle throttle;

    @Inject
    DocumentStorage storage;

    @Inject
    DocumentUploadStore documentStore;

    @Inject
    TaskStore taskStore;

    @Inject
    TaskQueue taskQueue;

    @Inject
    EtaEstimator etaEstimator;

    @Inject
    Clock clock;

    /**
     * @param content          file bytes
     * @param filename         original file name, may be null
     * @param declaredMimeType MIME type claimed by the client, may be null
     * @param ownerId          uploading user
     * @throws PayloadTooLargeException   if the file exceeds the configured size
     * @throws UnsupportedFormatException if the type is not allowed or the content does not match it
     * @throws QuotaExceededException     if the owner is over the per-minute quota
     */
    public UploadReceipt upload(byte[] content, String filename, String declaredMimeType, String ownerId) {
        long maxSize = config.upload().maxSizeBytes();
        if (content.length > maxSize) {
            throw new PayloadTooLargeException(content.length, maxSize);
        }
        if (content.length == 0) {
            throw new UnsupportedFormatException("Uploaded file is empty");
        }

        String declared = declaredMimeType == null || declaredMimeType.isBlank()
                ? sniffer.detectFromName(filename)
                : MimeTypeSniffer.normalize(declaredMimeType);
        List<String> allowed = config.upload().allowedMimeTypes();
        if (!allowed.contains(declared)) {
            throw new UnsupportedFormatException("File type " + declared + " is not accepted, allowed: " + allowed);
        }
        String sniffed = sniffer.detect(content);
        if (!declared.equals(sniffed)) {
            log.warnf("Rejected upload %s of user %s: declared %s but content is %s", filename, ownerId, declared, sniffed);
            throw new UnsupportedFormatException("File content (" + sniffed + ") does not match declared type " + declared);
        }

        ThrottleDecision decision = throttle.tryAcquire(ownerId);
        if (!decision.allowed()) {
            throw new QuotaExceededException(ownerId, config.upload().quotaPerMinute(), decision.retryAfterSeconds());
        }

        String storageRef = null;
        DocumentUpload document = null;
        try {
            storageRef = storage.save(content, sniffed);
            document = new DocumentUpload(ownerId, filename, declared, sniffed, content.length, storageRef,
                    LocalDateTime.now(clock));
            documentStore.insert(document);
            ProcessingTask task = taskQueue.enqueue(document.getId(), ownerId);
            long eta = etaEstimator.forQueuedTask(taskQueue.queueDepth());
            log.infof("Accepted %s (%d bytes, %s) from user %s as document %s, task %s",
                    filename, content.length, sniffed, ownerId, document.getId(), task.getId());
            return new UploadReceipt(task.getId(), document.getId(), eta);
        } catch (RuntimeException e) {
            log.errorf(e, "Upload of %s by user %s failed, rolling back", filename, ownerId);
            rollback(storageRef, document, ownerId);
            throw e;
        }
    }

    /**
     * Queues a new attempt for a document whose latest task failed or was cancelled.
     */
    public UploadReceipt reprocess(String documentId, String callerId) {
        DocumentUpload document = documentStore.get(documentId)
                .orElseThrow(() -> new ResourceNotFoundException("Document", documentId));
        if (!document.getOwnerId().equals(callerId)) {
            throw new OwnershipException("Document", documentId);
        }
        if (document.getStorageRef() == null) {
            throw new InvalidTaskStateException("Document " + documentId + " has been purged, upload it again");
        }
        List<ProcessingTask> tasks = taskStore.findByDocument(documentId);
        if (!tasks.isEmpty()) {
            TaskState latest = tasks.get(0).getState();
            if (latest != TaskState.FAILED && latest != TaskState.CANCELLED) {
                throw new InvalidTaskStateException(
                        "Document " + documentId + " can only be reprocessed after a failed or cancelled task, latest is " + latest);
            }
        }
        ProcessingTask task = taskQueue.enqueue(documentId, callerId);
        log.infof("User %s requested reprocessing of document %s, task %s", callerId, documentId, task.getId());
        return new UploadReceipt(task.getId(), documentId, etaEstimator.forQueuedTask(taskQueue.queueDepth()));
    }

    private void rollback(String storageRef, DocumentUpload document, String ownerId) {
        try {
            if (document != null) {
                documentStore.remove(document.getId());
            }
            if (storageRef != null) {
                storage.delete(storageRef);
            }
        } catch (RuntimeException cleanup) {
            log.errorf(cleanup, "Cleanup after failed upload left blob %s behind", storageRef);
        } finally {
            throttle.release(ownerId);
        }
    }
}
