package pl.faktulove.ocr.statusservice.services;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import pl.faktulove.ocr.documentservice.model.DocumentUpload;
import pl.faktulove.ocr.exceptions.FieldValidationException;
import pl.faktulove.ocr.exceptions.OwnershipException;
import pl.faktulove.ocr.exceptions.ResourceNotFoundException;
import pl.faktulove.ocr.statusservice.dto.LastError;
import pl.faktulove.ocr.statusservice.dto.QueueStatisticsResponse;
import pl.faktulove.ocr.statusservice.dto.TaskStatusResponse;
import pl.faktulove.ocr.support.DocumentOwnerUserContext;
import pl.faktulove.ocr.support.InMemoryDocumentUploadStore;
import pl.faktulove.ocr.support.InMemoryTaskStore;
import pl.faktulove.ocr.support.TestPipelineConfig;
import pl.faktulove.ocr.taskqueue.model.ProcessingTask;
import pl.faktulove.ocr.taskqueue.model.enums.ErrorKind;
import pl.faktulove.ocr.taskqueue.model.enums.ProcessingStage;
import pl.faktulove.ocr.taskqueue.model.enums.TaskState;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("StatusService")
class StatusServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 3, 15, 9, 0);
    private static final String OWNER = "user-1";
    private static final String STRANGER = "user-2";

    private TestPipelineConfig config;
    private InMemoryTaskStore taskStore;
    private InMemoryDocumentUploadStore documentStore;
    private ProcessingStatistics statistics;
    private StatusService service;

    @BeforeEach
    void setUp() {
        config = new TestPipelineConfig();
        taskStore = new InMemoryTaskStore();
        documentStore = new InMemoryDocumentUploadStore();
        statistics = StatusFixtures.statistics(config);
        service = StatusFixtures.statusService(taskStore, new DocumentOwnerUserContext(documentStore, OWNER),
                statistics, config);
    }

    @Nested
    @DisplayName("single task")
    class SingleTask {

        @Test
        @DisplayName("pending task reports queue-based ETA and a 3 second poll hint")
        void pendingTask() {
            // Given
            ProcessingTask task = aTask(OWNER, TaskState.PENDING);
            aTask("user-9", TaskState.PENDING);
            aTask("user-9", TaskState.PENDING);

            // When
            TaskStatusResponse status = service.getStatus(task.getId(), OWNER);

            // Then
            assertEquals(TaskState.PENDING, status.state());
            assertEquals(0, status.progressPercent());
            // 3 pending tasks x 25s default mean / 4 workers
            assertEquals(19, status.etaSeconds());
            assertEquals(3000, status.pollIntervalMillis());
            assertNull(status.resultRef());
            assertNull(status.lastError());
        }

        @Test
        @DisplayName("processing task ETA sums the stages not yet reached")
        void processingTask() {
            ProcessingTask task = aTask(OWNER, TaskState.PROCESSING);
            task.setProgressPercent(ProcessingStage.PREPROCESSED.getPercent());
            task.setAttemptCount(1);
            taskStore.put(task);

            TaskStatusResponse status = service.getStatus(task.getId(), OWNER);

            assertEquals(30, status.progressPercent());
            assertEquals(15, status.etaSeconds());
            assertEquals(1000, status.pollIntervalMillis());
            assertEquals(1, status.attemptCount());
        }

        @Test
        @DisplayName("recorded stage durations replace the default")
        void usesHistoricalStageDurations() {
            statistics.recordStage(ProcessingStage.RECOGNIZED, Duration.ofSeconds(8));
            statistics.recordStage(ProcessingStage.RECOGNIZED, Duration.ofSeconds(12));
            ProcessingTask task = aTask(OWNER, TaskState.PROCESSING);
            task.setProgressPercent(ProcessingStage.PREPROCESSED.getPercent());
            taskStore.put(task);

            TaskStatusResponse status = service.getStatus(task.getId(), OWNER);

            assertEquals(10 + 5 + 5, status.etaSeconds());
        }

        @Test
        @DisplayName("completed task carries its result reference and no ETA")
        void completedTask() {
            ProcessingTask task = aTask(OWNER, TaskState.COMPLETED);
            task.setProgressPercent(100);
            task.setResultId("result-1");
            taskStore.put(task);

            TaskStatusResponse status = service.getStatus(task.getId(), OWNER);

            assertEquals("result-1", status.resultRef());
            assertEquals(0, status.etaSeconds());
            assertEquals(0, status.pollIntervalMillis());
        }

        @Test
        @DisplayName("failed task advises a re-upload")
        void failedTask() {
            ProcessingTask task = aTask(OWNER, TaskState.FAILED);
            task.setAttemptCount(3);
            task.recordError(ErrorKind.ENGINE_TRANSIENT, "OCR server returned 503");
            taskStore.put(task);

            TaskStatusResponse status = service.getStatus(task.getId(), OWNER);

            LastError lastError = status.lastError();
            assertNotNull(lastError);
            assertEquals(ErrorKind.ENGINE_TRANSIENT, lastError.kind());
            assertEquals("OCR server returned 503", lastError.message());
            assertEquals(LastError.Advice.REUPLOAD, lastError.advice());
            assertEquals(3, status.attemptCount());
        }

        @Test
        @DisplayName("task waiting for a retry advises to wait")
        void retryingTask() {
            ProcessingTask task = aTask(OWNER, TaskState.PENDING);
            task.setAttemptCount(1);
            task.recordError(ErrorKind.TIMEOUT, "Processing exceeded the time limit of 300s");
            taskStore.put(task);

            LastError lastError = service.getStatus(task.getId(), OWNER).lastError();

            assertEquals(LastError.Advice.WAIT, lastError.advice());
        }

        @Test
        @DisplayName("unknown task is not found")
        void unknownTask() {
            assertThrows(ResourceNotFoundException.class, () -> service.getStatus("missing", OWNER));
        }

        @Test
        @DisplayName("task of another owner is forbidden")
        void foreignTask() {
            ProcessingTask task = aTask(OWNER, TaskState.PENDING);

            assertThrows(OwnershipException.class, () -> service.getStatus(task.getId(), STRANGER));
        }

        @Test
        @DisplayName("ownership falls back to the task once the document is gone")
        void purgedDocument() {
            ProcessingTask task = aTask(OWNER, TaskState.FAILED);
            documentStore.remove(task.getDocumentId());

            assertEquals(TaskState.FAILED, service.getStatus(task.getId(), OWNER).state());
            assertThrows(OwnershipException.class, () -> service.getStatus(task.getId(), STRANGER));
        }

        @Test
        @DisplayName("reading a status does not modify the task")
        void readOnly() {
            ProcessingTask task = aTask(OWNER, TaskState.PENDING);
            long version = taskStore.get(task.getId()).orElseThrow().getVersion();

            service.getStatus(task.getId(), OWNER);
            service.getStatus(task.getId(), OWNER);

            assertEquals(version, taskStore.get(task.getId()).orElseThrow().getVersion());
        }
    }

    @Nested
    @DisplayName("bulk")
    class Bulk {

        @Test
        @DisplayName("returns own tasks and skips unknown and foreign ids")
        void filtersIds() {
            ProcessingTask mine = aTask(OWNER, TaskState.PENDING);
            ProcessingTask alsoMine = aTask(OWNER, TaskState.COMPLETED);
            ProcessingTask foreign = aTask(STRANGER, TaskState.PENDING);

            List<TaskStatusResponse> statuses = service.getStatuses(
                    List.of(mine.getId(), foreign.getId(), "missing", alsoMine.getId(), mine.getId()), OWNER);

            assertEquals(2, statuses.size());
            assertTrue(statuses.stream().anyMatch(s -> s.taskId().equals(mine.getId())));
            assertTrue(statuses.stream().anyMatch(s -> s.taskId().equals(alsoMine.getId())));
        }

        @Test
        @DisplayName("more than 50 ids are rejected")
        void tooManyIds() {
            List<String> ids = new ArrayList<>();
            IntStream.range(0, StatusService.MAX_BULK_IDS + 1).forEach(i -> ids.add("task-" + i));

            FieldValidationException e = assertThrows(FieldValidationException.class,
                    () -> service.getStatuses(ids, OWNER));
            assertTrue(e.getFieldErrors().containsKey("ids"));
        }
    }

    @Test
    @DisplayName("statistics count tasks per state")
    void statistics() {
        aTask(OWNER, TaskState.PENDING);
        aTask(OWNER, TaskState.PENDING);
        aTask(OWNER, TaskState.PROCESSING);
        aTask(OWNER, TaskState.FAILED);
        statistics.recordTask(Duration.ofSeconds(12));

        QueueStatisticsResponse response = service.getStatistics();

        assertEquals(2, response.pending());
        assertEquals(1, response.processing());
        assertEquals(0, response.completed());
        assertEquals(1, response.failed());
        assertEquals(0, response.cancelled());
        assertEquals(4, response.workerSlots());
        assertEquals(12.0, response.meanProcessingSeconds(), 0.001);
    }

    // ==================== Test Data Builders ====================

    private ProcessingTask aTask(String ownerId, TaskState state) {
        DocumentUpload document = new DocumentUpload(ownerId, "faktura.pdf", "application/pdf", "application/pdf",
                2048, "ref-" + ownerId, NOW);
        documentStore.insert(document);
        ProcessingTask task = new ProcessingTask(document.getId(), ownerId, NOW);
        task.setState(state);
        taskStore.put(task);
        return task;
    }
}
