package pl.faktulove.ocr.resultservice.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Value of one invoice field on a result. A corrected field always has confidence 100.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Embeddable
public class ExtractedField {

    public static final double CORRECTED_CONFIDENCE = 100.0;

    @Column(name = "field_value", columnDefinition = "TEXT")
    private String value;

    @Column(nullable = false)
    private double confidence;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private FieldSource source;

    public static ExtractedField engine(String value, double confidence) {
        return new ExtractedField(value, confidence, FieldSource.ENGINE);
    }

    public static ExtractedField corrected(String value) {
        return new ExtractedField(value, CORRECTED_CONFIDENCE, FieldSource.CORRECTED);
    }

    public ExtractedField copy() {
        return new ExtractedField(value, confidence, source);
    }
}
