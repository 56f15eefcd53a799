package pl.faktulove.ocr.storage;

/**
 * Blob persistence for uploaded documents.
 */
public interface DocumentStorage {

    /**
     * Stores the bytes and returns the reference to load them with.
     */
    String save(byte[] content, String mimeType);

    /**
     * @throws StorageException if the blob cannot be read or does not exist
     */
    byte[] load(String storageRef);

    void delete(String storageRef);
}
