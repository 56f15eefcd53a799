package pl.faktulove.ocr.resultservice.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FieldSource {
    ENGINE("engine"),
    CORRECTED("corrected");

    private final String value;

    FieldSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
