package pl.faktulove.ocr.resultservice.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import pl.faktulove.ocr.confidence.ConfidenceLevel;

import java.time.LocalDateTime;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record OcrResultSummary(
        String resultId,
        String documentId,
        double aggregateConfidence,
        boolean needsReview,
        ConfidenceLevel confidenceLevel,
        String invoiceRef,
        LocalDateTime createdAt
) {
}
