package pl.faktulove.ocr.resultservice.services;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import pl.faktulove.ocr.confidence.ConfidenceFixtures;
import pl.faktulove.ocr.confidence.ConfidenceLevel;
import pl.faktulove.ocr.documentservice.model.DocumentUpload;
import pl.faktulove.ocr.exceptions.OwnershipException;
import pl.faktulove.ocr.exceptions.ResourceNotFoundException;
import pl.faktulove.ocr.resultservice.dto.OcrResultResponse;
import pl.faktulove.ocr.resultservice.dto.OcrResultSummary;
import pl.faktulove.ocr.resultservice.model.ExtractedField;
import pl.faktulove.ocr.resultservice.model.OcrResult;
import pl.faktulove.ocr.support.DocumentOwnerUserContext;
import pl.faktulove.ocr.support.InMemoryDocumentUploadStore;
import pl.faktulove.ocr.support.InMemoryOcrResultStore;
import pl.faktulove.ocr.support.MutableClock;
import pl.faktulove.ocr.support.TestPipelineConfig;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("OcrResultService")
class OcrResultServiceTest {

    private static final String OWNER = "user-1";
    private static final LocalDateTime CREATED = LocalDateTime.of(2024, 3, 15, 9, 0);

    private InMemoryOcrResultStore resultStore;
    private InMemoryDocumentUploadStore documentStore;
    private OcrResultService service;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.startingAt("2024-03-15T09:00:00Z");
        resultStore = new InMemoryOcrResultStore();
        documentStore = new InMemoryDocumentUploadStore();
        service = ResultFixtures.resultService(resultStore, new DocumentOwnerUserContext(documentStore, OWNER),
                ConfidenceFixtures.scorer(new TestPipelineConfig(), clock));
    }

    @Test
    @DisplayName("returns the fields with confidence level")
    void getResult() {
        OcrResult result = aResult(OWNER, 96, CREATED);

        OcrResultResponse response = service.getResult(result.getId(), OWNER);

        assertEquals(result.getId(), response.resultId());
        assertEquals(ConfidenceLevel.HIGH, response.confidenceLevel());
        assertFalse(response.needsReview());
        assertEquals("FV/2024/03/001", response.fields().get("invoice_number").getValue());
        assertEquals("fake-engine", response.engineId());
    }

    @Test
    @DisplayName("levels follow the review and auto-approve thresholds")
    void levels() {
        assertEquals(ConfidenceLevel.MEDIUM, service.getResult(aResult(OWNER, 80, CREATED).getId(), OWNER).confidenceLevel());
        assertEquals(ConfidenceLevel.LOW, service.getResult(aResult(OWNER, 69.9, CREATED).getId(), OWNER).confidenceLevel());
        assertEquals(ConfidenceLevel.HIGH, service.getResult(aResult(OWNER, 95, CREATED).getId(), OWNER).confidenceLevel());
    }

    @Test
    @DisplayName("unknown results are not found")
    void unknownResult() {
        ResourceNotFoundException e = assertThrows(ResourceNotFoundException.class,
                () -> service.getResult("missing", OWNER));
        assertEquals("OcrResult missing not found", e.getMessage());
    }

    @Test
    @DisplayName("results of another owner are forbidden")
    void foreignResult() {
        OcrResult result = aResult(OWNER, 96, CREATED);

        assertThrows(OwnershipException.class, () -> service.getResult(result.getId(), "user-2"));
    }

    @Test
    @DisplayName("ownership follows the uploaded document")
    void ownershipFromDocument() {
        DocumentUpload document = new DocumentUpload("user-3", "faktura.pdf", "application/pdf", "application/pdf",
                100, "ref", CREATED);
        documentStore.insert(document);
        OcrResult result = new OcrResult("task-9", document.getId(), "user-3", CREATED);
        resultStore.insert(result);

        assertNotNull(service.loadOwned(result.getId(), "user-3"));
        assertThrows(OwnershipException.class, () -> service.loadOwned(result.getId(), OWNER));
    }

    @Test
    @DisplayName("lists only the caller's results, newest first")
    void listResults() {
        OcrResult older = aResult(OWNER, 96, CREATED);
        aResult("user-2", 96, CREATED.plusMinutes(1));
        OcrResult newer = aResult(OWNER, 50, CREATED.plusMinutes(2));

        List<OcrResultSummary> summaries = service.listResults(OWNER);

        assertEquals(List.of(newer.getId(), older.getId()), summaries.stream().map(OcrResultSummary::resultId).toList());
        assertTrue(summaries.get(0).needsReview());
        assertEquals(ConfidenceLevel.LOW, summaries.get(0).confidenceLevel());
    }

    // ==================== Test Data Builders ====================

    private OcrResult aResult(String ownerId, double aggregate, LocalDateTime createdAt) {
        OcrResult result = new OcrResult("task-" + createdAt, "document-" + createdAt, ownerId, createdAt);
        result.getFields().put("invoice_number", ExtractedField.engine("FV/2024/03/001", aggregate));
        result.setAggregateConfidence(aggregate);
        result.setNeedsReview(aggregate < 70);
        result.setEngineId("fake-engine");
        resultStore.insert(result);
        return result;
    }
}
