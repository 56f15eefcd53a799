package pl.faktulove.ocr.confidence;

/**
 * Outcome of a business-rule check on one field value.
 *
 * @param passed          whether the value satisfies the rule
 * @param normalizedValue the canonical form of the value when it passed, else the input
 * @param message         why the value failed, null when it passed
 */
public record RuleCheck(boolean passed, String normalizedValue, String message) {

    public static RuleCheck pass(String normalizedValue) {
        return new RuleCheck(true, normalizedValue, null);
    }

    public static RuleCheck fail(String value, String message) {
        return new RuleCheck(false, value, message);
    }
}
