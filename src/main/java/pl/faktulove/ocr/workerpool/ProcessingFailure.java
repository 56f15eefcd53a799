package pl.faktulove.ocr.workerpool;

import pl.faktulove.ocr.taskqueue.model.enums.ErrorKind;

/**
 * A classified failure of one processing attempt. Recorded on the task, never shown
 * to a caller directly.
 */
public class ProcessingFailure extends Exception {

    private final ErrorKind kind;

    public ProcessingFailure(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ProcessingFailure(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
