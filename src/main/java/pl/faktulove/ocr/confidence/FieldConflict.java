package pl.faktulove.ocr.confidence;

import java.util.Set;

/**
 * Fields whose values contradict each other.
 */
public record FieldConflict(Set<String> fields, String message) {

    public boolean involves(String fieldName) {
        return fields.contains(fieldName);
    }
}
