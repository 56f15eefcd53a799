package pl.faktulove.ocr.statusservice.dto;

import pl.faktulove.ocr.taskqueue.model.enums.ErrorKind;

/**
 * @param kind    failure classification
 * @param message human-readable reason
 * @param advice  {@code WAIT} while a retry is scheduled, {@code REUPLOAD} once the task failed for good
 */
public record LastError(ErrorKind kind, String message, Advice advice) {

    public enum Advice {
        WAIT,
        REUPLOAD
    }
}
