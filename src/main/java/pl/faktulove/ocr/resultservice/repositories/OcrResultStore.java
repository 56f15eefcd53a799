package pl.faktulove.ocr.resultservice.repositories;

import pl.faktulove.ocr.resultservice.model.OcrResult;

import java.util.List;
import java.util.Optional;

/**
 * Persistence of {@link OcrResult}. Reads return detached copies.
 */
public interface OcrResultStore {

    void insert(OcrResult result);

    Optional<OcrResult> get(String resultId);

    /**
     * Like {@link #get(String)}, but the row stays locked against other writers until the
     * caller's transaction ends.
     */
    Optional<OcrResult> getForUpdate(String resultId);

    Optional<OcrResult> findByTask(String taskId);

    /**
     * Results of an owner, newest first.
     */
    List<OcrResult> findByOwner(String ownerId);

    /**
     * Replaces fields, confidences and invoice reference if the stored version still
     * equals {@code result.getVersion()}; increments the version on success.
     */
    boolean compareAndSet(OcrResult result);

    void remove(String resultId);
}
