package pl.faktulove.ocr.validationservice.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationResponse(
        String resultId,
        List<String> updatedFields,
        Map<String, Double> newConfidences,
        double aggregateConfidence,
        boolean needsReview,
        boolean invoiceCreated,
        String invoiceRef,
        String validationRecordId
) {
}
