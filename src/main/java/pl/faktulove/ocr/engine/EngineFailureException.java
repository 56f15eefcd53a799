package pl.faktulove.ocr.engine;

public class EngineFailureException extends Exception {

    private final boolean transientFailure;

    private EngineFailureException(String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public static EngineFailureException transientFailure(String message, Throwable cause) {
        return new EngineFailureException(message, true, cause);
    }

    public static EngineFailureException permanentFailure(String message, Throwable cause) {
        return new EngineFailureException(message, false, cause);
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
