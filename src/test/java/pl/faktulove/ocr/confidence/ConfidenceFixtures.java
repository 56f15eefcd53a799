package pl.faktulove.ocr.confidence;

import com.fasterxml.jackson.databind.ObjectMapper;
import pl.faktulove.ocr.config.OcrPipelineConfig;

import java.time.Clock;

/**
 * Wires the scorer for tests outside this package.
 */
public final class ConfidenceFixtures {

    private ConfidenceFixtures() {
    }

    public static FieldRuleValidator ruleValidator(Clock clock) {
        FieldRuleValidator validator = new FieldRuleValidator();
        validator.clock = clock;
        validator.objectMapper = new ObjectMapper();
        return validator;
    }

    public static CrossFieldRules crossFieldRules() {
        CrossFieldRules rules = new CrossFieldRules();
        rules.objectMapper = new ObjectMapper();
        return rules;
    }

    public static ConfidenceScorer scorer(OcrPipelineConfig config, Clock clock) {
        ConfidenceScorer scorer = new ConfidenceScorer();
        scorer.ruleValidator = ruleValidator(clock);
        scorer.crossFieldRules = crossFieldRules();
        scorer.config = config;
        return scorer;
    }
}
