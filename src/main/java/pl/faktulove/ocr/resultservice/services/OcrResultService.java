package pl.faktulove.ocr.resultservice.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import pl.faktulove.ocr.confidence.ConfidenceScorer;
import pl.faktulove.ocr.exceptions.OwnershipException;
import pl.faktulove.ocr.exceptions.ResourceNotFoundException;
import pl.faktulove.ocr.resultservice.dto.OcrResultResponse;
import pl.faktulove.ocr.resultservice.dto.OcrResultSummary;
import pl.faktulove.ocr.resultservice.model.OcrResult;
import pl.faktulove.ocr.resultservice.repositories.OcrResultStore;
import pl.faktulove.ocr.security.UserContext;

import java.util.List;
import java.util.Optional;

/**
 * Read access to OCR results, restricted to the owner of the uploaded document.
 */
@ApplicationScoped
public class OcrResultService {

    @Inject
    OcrResultStore resultStore;

    @Inject
    UserContext userContext;

    @Inject
    ConfidenceScorer confidenceScorer;

    public OcrResultResponse getResult(String resultId, String callerId) {
        return toResponse(loadOwned(resultId, callerId));
    }

    /**
     * Loads a result and checks that the caller owns its document.
     *
     * @throws ResourceNotFoundException if the result does not exist
     * @throws OwnershipException        if it belongs to someone else
     */
    public OcrResult loadOwned(String resultId, String callerId) {
        return checkOwner(resultStore.get(resultId), resultId, callerId);
    }

    /**
     * {@link #loadOwned(String, String)} holding the row lock for the rest of the caller's
     * transaction.
     */
    public OcrResult loadOwnedForUpdate(String resultId, String callerId) {
        return checkOwner(resultStore.getForUpdate(resultId), resultId, callerId);
    }

    private OcrResult checkOwner(Optional<OcrResult> found, String resultId, String callerId) {
        OcrResult result = found.orElseThrow(() -> new ResourceNotFoundException("OcrResult", resultId));
        String owner = userContext.ownerOf(result.getDocumentId()).orElse(result.getOwnerId());
        if (!owner.equals(callerId)) {
            throw new OwnershipException("OcrResult", resultId);
        }
        return result;
    }

    public List<OcrResultSummary> listResults(String callerId) {
        return resultStore.findByOwner(callerId).stream()
                .map(r -> new OcrResultSummary(r.getId(), r.getDocumentId(), r.getAggregateConfidence(),
                        r.isNeedsReview(), confidenceScorer.level(r.getAggregateConfidence()),
                        r.getInvoiceRef(), r.getCreatedAt()))
                .toList();
    }

    public OcrResultResponse toResponse(OcrResult result) {
        return new OcrResultResponse(result.getId(), result.getTaskId(), result.getDocumentId(),
                result.getFields(), result.getAggregateConfidence(), result.isNeedsReview(),
                confidenceScorer.level(result.getAggregateConfidence()), result.getInvoiceRef(),
                result.getEngineId(), result.getProcessingDurationMillis(),
                result.getCreatedAt(), result.getUpdatedAt());
    }
}
