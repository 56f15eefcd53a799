package pl.faktulove.ocr.jobs;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;
import pl.faktulove.ocr.config.OcrPipelineConfig;
import pl.faktulove.ocr.documentservice.model.DocumentUpload;
import pl.faktulove.ocr.documentservice.repositories.DocumentUploadStore;
import pl.faktulove.ocr.storage.DocumentStorage;
import pl.faktulove.ocr.taskqueue.model.ProcessingTask;
import pl.faktulove.ocr.taskqueue.model.enums.TaskState;
import pl.faktulove.ocr.taskqueue.repositories.TaskStore;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Purges stored blobs of documents whose processing ended unsuccessfully a while ago.
 * The document record stays; only its storage reference is cleared.
 */
@JBossLog
@ApplicationScoped
public class StaleDocumentCleanupJob {

    @Inject
    TaskStore taskStore;

    @Inject
    DocumentUploadStore documentStore;

    @Inject
    DocumentStorage storage;

    @Inject
    OcrPipelineConfig config;

    @Inject
    Clock clock;

    @Scheduled(cron = "0 15 3 * * ?")
    public int purgeStaleDocuments() {
        LocalDateTime cutoff = LocalDateTime.now(clock).minusDays(config.retention().failedDocumentDays());
        Set<String> documentIds = new LinkedHashSet<>();
        for (ProcessingTask task : taskStore.findEndedBefore(EnumSet.of(TaskState.FAILED, TaskState.CANCELLED), cutoff)) {
            documentIds.add(task.getDocumentId());
        }
        log.infof("Starting stale document cleanup, %d candidate(s) ended before %s", documentIds.size(), cutoff);

        int purged = 0;
        for (String documentId : documentIds) {
            if (!latestTaskEndedBefore(documentId, cutoff)) {
                continue;
            }
            Optional<DocumentUpload> document = documentStore.get(documentId);
            if (document.isEmpty() || document.get().getStorageRef() == null) {
                continue;
            }
            try {
                storage.delete(document.get().getStorageRef());
                documentStore.clearStorageRef(documentId);
                purged++;
            } catch (RuntimeException e) {
                log.errorf(e, "Failed to purge document %s", documentId);
            }
        }
        log.infof("Stale document cleanup purged %d document(s)", purged);
        return purged;
    }

    /**
     * A document reprocessed since, or ever completed, keeps its blob.
     */
    private boolean latestTaskEndedBefore(String documentId, LocalDateTime cutoff) {
        List<ProcessingTask> tasks = taskStore.findByDocument(documentId);
        if (tasks.isEmpty() || tasks.stream().anyMatch(task -> task.getState() == TaskState.COMPLETED)) {
            return false;
        }
        ProcessingTask latest = tasks.get(0);
        return (latest.getState() == TaskState.FAILED || latest.getState() == TaskState.CANCELLED)
                && latest.getUpdatedAt().isBefore(cutoff);
    }
}
