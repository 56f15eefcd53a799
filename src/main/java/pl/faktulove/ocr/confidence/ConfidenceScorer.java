package pl.faktulove.ocr.confidence;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;
import pl.faktulove.ocr.config.OcrPipelineConfig;
import pl.faktulove.ocr.extraction.ExtractedValue;
import pl.faktulove.ocr.extraction.InvoiceField;
import pl.faktulove.ocr.resultservice.model.ExtractedField;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns engine confidence into field confidence and summarizes a result.
 *
 * <p>A found value that passes its business check gains the validation boost; one that
 * fails loses the conflict penalty, and so does every field caught in a cross-field
 * conflict. Unresolved fields score 0. The aggregate is the
 * lowest required field, so one weak critical field is enough to flag a result.
 */
@JBossLog
@ApplicationScoped
public class ConfidenceScorer {

    public static final double MIN_CONFIDENCE = 0.0;
    public static final double MAX_CONFIDENCE = 100.0;

    @Inject
    FieldRuleValidator ruleValidator;

    @Inject
    CrossFieldRules crossFieldRules;

    @Inject
    OcrPipelineConfig config;

    public Map<String, ExtractedField> score(Map<InvoiceField, ExtractedValue> extracted) {
        Map<String, ExtractedField> fields = new LinkedHashMap<>();
        for (InvoiceField field : InvoiceField.values()) {
            ExtractedValue value = extracted.getOrDefault(field, ExtractedValue.notFound());
            fields.put(field.getFieldName(), scoreField(field, value));
        }
        penalizeConflicts(fields);
        return fields;
    }

    /**
     * Cross-field conflicts among the given values.
     */
    public List<FieldConflict> conflicts(Map<String, ExtractedField> fields) {
        Map<String, String> values = new HashMap<>();
        fields.forEach((name, field) -> {
            if (field.getValue() != null) values.put(name, field.getValue());
        });
        return crossFieldRules.check(values);
    }

    private void penalizeConflicts(Map<String, ExtractedField> fields) {
        Set<String> conflicting = new HashSet<>();
        for (FieldConflict conflict : conflicts(fields)) {
            log.debugf("Cross-field conflict on %s: %s", conflict.fields(), conflict.message());
            conflicting.addAll(conflict.fields());
        }
        for (String name : conflicting) {
            ExtractedField field = fields.get(name);
            field.setConfidence(clamp(field.getConfidence() - config.confidence().conflictPenalty()));
        }
    }

    ExtractedField scoreField(InvoiceField field, ExtractedValue value) {
        if (!value.isFound()) {
            return ExtractedField.engine(null, MIN_CONFIDENCE);
        }
        RuleCheck check = ruleValidator.check(field, value.value());
        double adjusted = check.passed()
                ? value.engineConfidence() + config.confidence().validationBoost()
                : value.engineConfidence() - config.confidence().conflictPenalty();
        return ExtractedField.engine(check.normalizedValue(), clamp(adjusted));
    }

    /**
     * Minimum confidence over the required fields; a missing required field counts as 0.
     */
    public double aggregate(Map<String, ExtractedField> fields) {
        double min = MAX_CONFIDENCE;
        for (InvoiceField field : InvoiceField.requiredFields()) {
            ExtractedField value = fields.get(field.getFieldName());
            min = Math.min(min, value == null ? MIN_CONFIDENCE : value.getConfidence());
        }
        return clamp(min);
    }

    public boolean needsReview(double aggregateConfidence) {
        return aggregateConfidence < config.confidence().reviewThreshold();
    }

    /**
     * True when every required field reaches the review threshold.
     */
    public boolean allRequiredAboveThreshold(Map<String, ExtractedField> fields) {
        return !needsReview(aggregate(fields));
    }

    public ConfidenceLevel level(double aggregateConfidence) {
        if (aggregateConfidence >= config.confidence().autoApproveThreshold()) return ConfidenceLevel.HIGH;
        if (!needsReview(aggregateConfidence)) return ConfidenceLevel.MEDIUM;
        return ConfidenceLevel.LOW;
    }

    public static double clamp(double confidence) {
        return Math.max(MIN_CONFIDENCE, Math.min(MAX_CONFIDENCE, confidence));
    }
}
