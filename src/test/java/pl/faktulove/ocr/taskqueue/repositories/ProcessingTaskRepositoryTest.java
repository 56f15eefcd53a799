package pl.faktulove.ocr.taskqueue.repositories;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import pl.faktulove.ocr.exceptions.InvalidTaskStateException;
import pl.faktulove.ocr.taskqueue.model.ProcessingTask;
import pl.faktulove.ocr.taskqueue.model.enums.TaskState;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the lease table queries against a real database.
 */
@QuarkusTest
public class ProcessingTaskRepositoryTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 3, 15, 9, 0);

    @Inject
    ProcessingTaskRepository repository;

    private final List<String> documentIds = new ArrayList<>();

    @AfterEach
    @Transactional
    public void tearDown() {
        if (!documentIds.isEmpty()) {
            repository.delete("documentId in ?1", documentIds);
        }
        documentIds.clear();
    }

    @Test
    @DisplayName("two writers holding the same version: only the first compare-and-set wins")
    public void compareAndSetOnSameVersion() {
        // Given
        ProcessingTask task = aTask(newOwner(), NOW);
        ProcessingTask first = repository.get(task.getId()).orElseThrow();
        ProcessingTask second = repository.get(task.getId()).orElseThrow();

        first.setState(TaskState.PROCESSING);
        first.setLeaseOwner("worker-a");
        second.setState(TaskState.PROCESSING);
        second.setLeaseOwner("worker-b");

        // When
        boolean firstWon = repository.compareAndSet(first);
        boolean secondWon = repository.compareAndSet(second);

        // Then
        assertTrue(firstWon);
        assertFalse(secondWon);
        ProcessingTask stored = repository.get(task.getId()).orElseThrow();
        assertEquals("worker-a", stored.getLeaseOwner());
        assertEquals(task.getVersion() + 1, stored.getVersion());
        assertEquals(first.getVersion(), stored.getVersion());
    }

    @Test
    @DisplayName("a second active task for the same document is refused by the database")
    public void uniqueActiveTaskPerDocument() {
        String owner = newOwner();
        ProcessingTask active = aTask(owner, NOW);

        ProcessingTask duplicate = new ProcessingTask(active.getDocumentId(), owner, NOW);

        assertThrows(InvalidTaskStateException.class, () -> repository.insert(duplicate));
        assertEquals(1, repository.findByDocument(active.getDocumentId()).size());
    }

    @Test
    @DisplayName("once the active task ends, the document can get a new one")
    public void newTaskAfterTerminal() {
        String owner = newOwner();
        ProcessingTask first = repository.get(aTask(owner, NOW).getId()).orElseThrow();
        first.setState(TaskState.CANCELLED);
        assertTrue(repository.compareAndSet(first));

        repository.insert(new ProcessingTask(first.getDocumentId(), owner, NOW.plusMinutes(1)));

        assertEquals(2, repository.findByDocument(first.getDocumentId()).size());
        assertTrue(repository.findActiveForDocument(first.getDocumentId()).isPresent());
    }

    @Test
    @DisplayName("claimable owners and each owner's oldest tasks")
    public void claimableByOwner() {
        // Given
        String busy = newOwner();
        String quiet = newOwner();
        String waiting = newOwner();
        ProcessingTask oldest = aTask(busy, NOW.minusMinutes(3));
        ProcessingTask middle = aTask(busy, NOW.minusMinutes(2));
        aTask(busy, NOW.minusMinutes(1));
        aTask(quiet, NOW.minusMinutes(1));
        ProcessingTask backedOff = repository.get(aTask(waiting, NOW.minusMinutes(5)).getId()).orElseThrow();
        backedOff.setNotBefore(NOW.plusMinutes(10));
        assertTrue(repository.compareAndSet(backedOff));

        // When
        List<String> owners = repository.findClaimableOwners(NOW);
        List<ProcessingTask> busyTasks = repository.findClaimableForOwner(busy, NOW, 2);

        // Then
        assertTrue(owners.contains(busy));
        assertTrue(owners.contains(quiet));
        assertFalse(owners.contains(waiting));
        assertEquals(1, owners.stream().filter(busy::equals).count());
        assertEquals(List.of(oldest.getId(), middle.getId()), busyTasks.stream().map(ProcessingTask::getId).toList());
    }

    // ==================== Test Data Builders ====================

    private ProcessingTask aTask(String ownerId, LocalDateTime createdAt) {
        ProcessingTask task = new ProcessingTask(UUID.randomUUID().toString(), ownerId, createdAt);
        documentIds.add(task.getDocumentId());
        repository.insert(task);
        return task;
    }

    private static String newOwner() {
        return "owner-" + UUID.randomUUID();
    }
}
