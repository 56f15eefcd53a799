package pl.faktulove.ocr.validationservice.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Embeddable
public class FieldChange {

    @Column(name = "field_name", length = 40, nullable = false)
    private String fieldName;

    @Column(name = "previous_value", columnDefinition = "TEXT")
    private String previousValue;

    @Column(name = "previous_confidence", nullable = false)
    private double previousConfidence;

    @Column(name = "new_value", columnDefinition = "TEXT")
    private String newValue;
}
