package pl.faktulove.ocr.resultservice.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import pl.faktulove.ocr.confidence.ConfidenceLevel;
import pl.faktulove.ocr.resultservice.model.ExtractedField;

import java.time.LocalDateTime;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record OcrResultResponse(
        String resultId,
        String taskId,
        String documentId,
        Map<String, ExtractedField> fields,
        double aggregateConfidence,
        boolean needsReview,
        ConfidenceLevel confidenceLevel,
        String invoiceRef,
        String engineId,
        long processingDurationMillis,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
}
