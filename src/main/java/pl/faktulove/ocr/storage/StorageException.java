package pl.faktulove.ocr.storage;

public class StorageException extends RuntimeException {

    private final boolean missing;

    public StorageException(String message, boolean missing, Throwable cause) {
        super(message, cause);
        this.missing = missing;
    }

    /**
     * True when the blob does not exist, as opposed to the store being unreachable.
     */
    public boolean isMissing() {
        return missing;
    }
}
