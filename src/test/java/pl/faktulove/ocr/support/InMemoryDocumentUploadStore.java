package pl.faktulove.ocr.support;

import pl.faktulove.ocr.documentservice.model.DocumentUpload;
import pl.faktulove.ocr.documentservice.repositories.DocumentUploadStore;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryDocumentUploadStore implements DocumentUploadStore {

    private final Map<String, DocumentUpload> documents = new ConcurrentHashMap<>();

    @Override
    public void insert(DocumentUpload document) {
        documents.put(document.getId(), document.copy());
    }

    @Override
    public Optional<DocumentUpload> get(String documentId) {
        return Optional.ofNullable(documents.get(documentId)).map(DocumentUpload::copy);
    }

    @Override
    public void clearStorageRef(String documentId) {
        documents.computeIfPresent(documentId, (id, document) -> {
            DocumentUpload cleared = document.copy();
            cleared.setStorageRef(null);
            return cleared;
        });
    }

    @Override
    public void remove(String documentId) {
        documents.remove(documentId);
    }

    public int size() {
        return documents.size();
    }
}
