package pl.faktulove.ocr.validationservice.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import lombok.extern.jbosslog.JBossLog;
import pl.faktulove.ocr.confidence.ConfidenceScorer;
import pl.faktulove.ocr.confidence.FieldConflict;
import pl.faktulove.ocr.confidence.FieldRuleValidator;
import pl.faktulove.ocr.confidence.RuleCheck;
import pl.faktulove.ocr.exceptions.FieldValidationException;
import pl.faktulove.ocr.exceptions.InvalidTaskStateException;
import pl.faktulove.ocr.extraction.InvoiceField;
import pl.faktulove.ocr.resultservice.model.ExtractedField;
import pl.faktulove.ocr.resultservice.model.OcrResult;
import pl.faktulove.ocr.resultservice.repositories.OcrResultStore;
import pl.faktulove.ocr.resultservice.services.OcrResultService;
import pl.faktulove.ocr.validationservice.dto.ValidationRecordResponse;
import pl.faktulove.ocr.validationservice.dto.ValidationResponse;
import pl.faktulove.ocr.validationservice.model.FieldChange;
import pl.faktulove.ocr.validationservice.model.ValidationRecord;
import pl.faktulove.ocr.validationservice.repositories.ValidationRecordStore;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Applies manual corrections to an OCR result.
 *
 * <p>A request is applied completely or not at all: every correction is checked against
 * the same business rules the scorer uses before anything changes. Corrected fields get
 * confidence 100 and source "corrected", the aggregate is recomputed, and an audit
 * record is appended. When every required field then reaches the review threshold and
 * no invoice exists yet, the invoice store is asked to create one; if that call fails
 * the whole request fails.
 */
@JBossLog
@ApplicationScoped
public class ValidationService {

    @Inject
    OcrResultService resultService;

    @Inject
    OcrResultStore resultStore;

    @Inject
    ValidationRecordStore recordStore;

    @Inject
    FieldRuleValidator ruleValidator;

    @Inject
    ConfidenceScorer confidenceScorer;

    @Inject
    InvoiceStore invoiceStore;

    @Inject
    Clock clock;

    @Transactional
    public ValidationResponse validate(String resultId, Map<String, String> corrections, String callerId) {
        if (corrections == null || corrections.isEmpty()) {
            throw new FieldValidationException(Map.of("corrections", "At least one correction is required"));
        }
        // locked until commit
        OcrResult result = resultService.loadOwnedForUpdate(resultId, callerId);
        Map<InvoiceField, String> accepted = checkAll(resultId, corrections);

        LocalDateTime now = LocalDateTime.now(clock);
        double aggregateBefore = result.getAggregateConfidence();
        List<FieldChange> changes = new ArrayList<>();
        for (Map.Entry<InvoiceField, String> correction : accepted.entrySet()) {
            String name = correction.getKey().getFieldName();
            ExtractedField previous = result.getFields().get(name);
            changes.add(new FieldChange(name,
                    previous == null ? null : previous.getValue(),
                    previous == null ? 0 : previous.getConfidence(),
                    correction.getValue()));
            result.getFields().put(name, ExtractedField.corrected(correction.getValue()));
        }
        rejectConflicts(resultId, accepted.keySet(), result);

        double aggregate = confidenceScorer.aggregate(result.getFields());
        result.setAggregateConfidence(aggregate);
        result.setNeedsReview(confidenceScorer.needsReview(aggregate));
        result.setUpdatedAt(now);

        boolean invoiceCreated = false;
        if (result.getInvoiceRef() == null && confidenceScorer.allRequiredAboveThreshold(result.getFields())) {
            String invoiceRef = invoiceStore.create(resultId, result.getOwnerId(), fieldValues(result));
            result.setInvoiceRef(invoiceRef);
            invoiceCreated = true;
        }

        if (!resultStore.compareAndSet(result)) {
            log.warnf("Result %s changed while corrections were applied", resultId);
            throw new InvalidTaskStateException("Result " + resultId + " was modified concurrently, reload and retry");
        }

        ValidationRecord record = new ValidationRecord(resultId, callerId, changes, now);
        record.setAggregateBefore(aggregateBefore);
        record.setAggregateAfter(aggregate);
        record.setInvoiceRef(invoiceCreated ? result.getInvoiceRef() : null);
        recordStore.append(record);

        log.infof("Result %s corrected by %s: fields %s, aggregate %.1f -> %.1f%s", resultId, callerId,
                record.correctedFieldNames(), aggregateBefore, aggregate,
                invoiceCreated ? ", invoice " + result.getInvoiceRef() + " created" : "");

        Map<String, Double> confidences = new LinkedHashMap<>();
        result.getFields().forEach((name, field) -> confidences.put(name, field.getConfidence()));
        return new ValidationResponse(resultId, record.correctedFieldNames(), confidences, aggregate,
                result.isNeedsReview(), invoiceCreated, result.getInvoiceRef(), record.getId());
    }

    public List<ValidationRecordResponse> history(String resultId, String callerId) {
        resultService.loadOwned(resultId, callerId);
        return recordStore.findByResult(resultId).stream()
                .map(r -> new ValidationRecordResponse(r.getId(), r.getCorrectorId(), r.getChanges(),
                        r.getAggregateBefore(), r.getAggregateAfter(), r.getInvoiceRef(), r.getCreatedAt()))
                .toList();
    }

    private Map<InvoiceField, String> checkAll(String resultId, Map<String, String> corrections) {
        Map<String, String> errors = new TreeMap<>();
        Map<InvoiceField, String> accepted = new EnumMap<>(InvoiceField.class);
        corrections.forEach((name, value) -> InvoiceField.fromName(name).ifPresentOrElse(field -> {
            RuleCheck check = ruleValidator.check(field, value);
            if (check.passed()) {
                accepted.put(field, check.normalizedValue());
            } else {
                errors.put(name, check.message());
            }
        }, () -> errors.put(name, "Unknown field")));

        if (!errors.isEmpty()) {
            log.infof("Corrections for result %s rejected, invalid fields: %s", resultId, errors.keySet());
            throw new FieldValidationException(errors);
        }
        return accepted;
    }

    /**
     * A correction may not leave the invoice contradicting itself; conflicts among fields
     * nobody touched are left to review.
     */
    private void rejectConflicts(String resultId, Set<InvoiceField> corrected, OcrResult result) {
        Map<String, String> errors = new TreeMap<>();
        for (FieldConflict conflict : confidenceScorer.conflicts(result.getFields())) {
            for (InvoiceField field : corrected) {
                if (conflict.involves(field.getFieldName())) {
                    errors.putIfAbsent(field.getFieldName(), conflict.message());
                }
            }
        }
        if (!errors.isEmpty()) {
            log.infof("Corrections for result %s rejected, conflicting fields: %s", resultId, errors.keySet());
            throw new FieldValidationException(errors);
        }
    }

    private static Map<String, String> fieldValues(OcrResult result) {
        Map<String, String> values = new LinkedHashMap<>();
        result.getFields().forEach((name, field) -> {
            if (field.getValue() != null) values.put(name, field.getValue());
        });
        return values;
    }
}
