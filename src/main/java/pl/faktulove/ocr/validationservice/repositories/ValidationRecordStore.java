package pl.faktulove.ocr.validationservice.repositories;

import pl.faktulove.ocr.validationservice.model.ValidationRecord;

import java.util.List;

public interface ValidationRecordStore {

    void append(ValidationRecord record);

    /**
     * Records of a result, oldest first.
     */
    List<ValidationRecord> findByResult(String resultId);
}
