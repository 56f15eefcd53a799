package pl.faktulove.ocr.documentservice.repositories;

import pl.faktulove.ocr.documentservice.model.DocumentUpload;

import java.util.Optional;

public interface DocumentUploadStore {

    void insert(DocumentUpload document);

    Optional<DocumentUpload> get(String documentId);

    void clearStorageRef(String documentId);

    void remove(String documentId);
}
