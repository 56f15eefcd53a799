package pl.faktulove.ocr.validationservice.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import pl.faktulove.ocr.validationservice.model.FieldChange;

import java.time.LocalDateTime;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationRecordResponse(
        String id,
        String correctorId,
        List<FieldChange> changes,
        double aggregateBefore,
        double aggregateAfter,
        String invoiceRef,
        LocalDateTime createdAt
) {
}
