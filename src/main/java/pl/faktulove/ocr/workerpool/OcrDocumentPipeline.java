package pl.faktulove.ocr.workerpool;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;
import pl.faktulove.ocr.confidence.ConfidenceScorer;
import pl.faktulove.ocr.documentservice.model.DocumentUpload;
import pl.faktulove.ocr.documentservice.repositories.DocumentUploadStore;
import pl.faktulove.ocr.documentservice.services.MimeTypeSniffer;
import pl.faktulove.ocr.engine.EngineFailureException;
import pl.faktulove.ocr.engine.OcrEngine;
import pl.faktulove.ocr.engine.RecognitionOutput;
import pl.faktulove.ocr.extraction.ExtractedValue;
import pl.faktulove.ocr.extraction.InvoiceField;
import pl.faktulove.ocr.extraction.InvoiceFieldExtractionService;
import pl.faktulove.ocr.resultservice.model.ExtractedField;
import pl.faktulove.ocr.resultservice.model.OcrResult;
import pl.faktulove.ocr.resultservice.repositories.OcrResultStore;
import pl.faktulove.ocr.statusservice.services.ProcessingStatistics;
import pl.faktulove.ocr.storage.DocumentStorage;
import pl.faktulove.ocr.storage.StorageException;
import pl.faktulove.ocr.taskqueue.model.enums.ErrorKind;
import pl.faktulove.ocr.taskqueue.model.enums.ProcessingStage;
import pl.faktulove.ocr.taskqueue.services.Lease;
import pl.faktulove.ocr.taskqueue.services.LeaseStatus;
import pl.faktulove.ocr.taskqueue.services.TaskQueue;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * One processing attempt of a leased task, from stored blob to persisted result.
 *
 * <p>Every stage boundary reports progress through the lease; a cancelled task or a lost
 * lease stops the attempt there. The whole run is a pure function of the stored blob, so
 * a requeued task simply starts over.
 */
@JBossLog
@ApplicationScoped
public class OcrDocumentPipeline {

    @Inject
    TaskQueue taskQueue;

    @Inject
    DocumentUploadStore documentStore;

    @Inject
    DocumentStorage storage;

    @Inject
    MimeTypeSniffer sniffer;

    @Inject
    OcrEngine engine;

    @Inject
    InvoiceFieldExtractionService extractionService;

    @Inject
    ConfidenceScorer confidenceScorer;

    @Inject
    OcrResultStore resultStore;

    @Inject
    ProcessingStatistics statistics;

    @Inject
    Clock clock;

    /**
     * @return id of the persisted result
     * @throws ProcessingFailure       when the attempt failed and the failure must be recorded
     * @throws AttemptAbortedException when the task was cancelled or the lease lost
     */
    public String run(Lease lease) throws ProcessingFailure, AttemptAbortedException {
        long attemptStart = System.nanoTime();
        long stageStart = attemptStart;

        DocumentUpload document = documentStore.get(lease.documentId())
                .orElseThrow(() -> new ProcessingFailure(ErrorKind.CORRUPT_DOCUMENT,
                        "Document " + lease.documentId() + " no longer exists"));
        byte[] content = loadContent(document);
        String sniffed = sniffer.detect(content);
        if (!sniffed.equals(document.getSniffedMimeType())) {
            throw new ProcessingFailure(ErrorKind.CORRUPT_DOCUMENT,
                    "Stored content is " + sniffed + ", expected " + document.getSniffedMimeType());
        }
        stageStart = checkpoint(lease, ProcessingStage.UPLOAD_VERIFIED, stageStart);

        // deskew and binarize run on the OCR server, configured through the request
        stageStart = checkpoint(lease, ProcessingStage.PREPROCESSED, stageStart);

        RecognitionOutput output;
        try {
            output = engine.recognize(content, sniffed);
        } catch (EngineFailureException e) {
            ErrorKind kind = e.isTransient() ? ErrorKind.ENGINE_TRANSIENT : ErrorKind.ENGINE_PERMANENT;
            throw new ProcessingFailure(kind, e.getMessage(), e);
        }
        stageStart = checkpoint(lease, ProcessingStage.RECOGNIZED, stageStart);

        Map<InvoiceField, ExtractedValue> extracted = extractionService.extract(output);
        Map<String, ExtractedField> fields = confidenceScorer.score(extracted);
        double aggregate = confidenceScorer.aggregate(fields);
        stageStart = checkpoint(lease, ProcessingStage.FIELDS_MAPPED, stageStart);

        OcrResult result = new OcrResult(lease.taskId(), lease.documentId(), lease.ownerId(), LocalDateTime.now(clock));
        result.setFields(fields);
        result.setAggregateConfidence(aggregate);
        result.setNeedsReview(confidenceScorer.needsReview(aggregate));
        result.setRawText(output.getRawText());
        result.setEngineId(output.getEngineId() != null ? output.getEngineId() : engine.engineId());
        result.setProcessingDurationMillis(Duration.ofNanos(System.nanoTime() - attemptStart).toMillis());

        // a crashed earlier attempt may have left its result behind
        resultStore.findByTask(lease.taskId()).ifPresent(stale -> resultStore.remove(stale.getId()));
        resultStore.insert(result);

        LeaseStatus status = taskQueue.complete(lease, result.getId());
        if (!status.isHeld()) {
            resultStore.remove(result.getId());
            throw new AttemptAbortedException(lease.taskId(), status);
        }
        statistics.recordStage(ProcessingStage.PERSISTED, Duration.ofNanos(System.nanoTime() - stageStart));
        statistics.recordTask(Duration.ofNanos(System.nanoTime() - attemptStart));

        log.infof("Task %s: result %s with aggregate confidence %.1f%s", lease.taskId(), result.getId(),
                aggregate, result.isNeedsReview() ? " (needs review)" : "");
        return result.getId();
    }

    private byte[] loadContent(DocumentUpload document) throws ProcessingFailure {
        if (document.getStorageRef() == null) {
            throw new ProcessingFailure(ErrorKind.CORRUPT_DOCUMENT, "Document " + document.getId() + " has been purged");
        }
        try {
            return storage.load(document.getStorageRef());
        } catch (StorageException e) {
            if (e.isMissing()) {
                throw new ProcessingFailure(ErrorKind.CORRUPT_DOCUMENT, "Stored document is missing", e);
            }
            throw new ProcessingFailure(ErrorKind.STORAGE, "Could not read stored document: " + e.getMessage(), e);
        }
    }

    private long checkpoint(Lease lease, ProcessingStage stage, long stageStart) throws AttemptAbortedException {
        if (Thread.currentThread().isInterrupted()) {
            throw new AttemptAbortedException(lease.taskId(), LeaseStatus.LOST);
        }
        LeaseStatus status = taskQueue.reportProgress(lease, stage);
        if (!status.isHeld()) {
            throw new AttemptAbortedException(lease.taskId(), status);
        }
        long now = System.nanoTime();
        statistics.recordStage(stage, Duration.ofNanos(now - stageStart));
        log.debugf("Task %s reached %s (%d%%)", lease.taskId(), stage, stage.getPercent());
        return now;
    }
}
