package pl.faktulove.ocr.documentservice.repositories;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import pl.faktulove.ocr.documentservice.model.DocumentUpload;

import java.util.Optional;

@ApplicationScoped
public class DocumentUploadRepository implements PanacheRepositoryBase<DocumentUpload, String>, DocumentUploadStore {

    @Override
    @Transactional
    public void insert(DocumentUpload document) {
        persist(document);
    }

    @Override
    @Transactional
    public Optional<DocumentUpload> get(String documentId) {
        return findByIdOptional(documentId).map(DocumentUpload::copy);
    }

    @Override
    @Transactional
    public void clearStorageRef(String documentId) {
        update("storageRef = null where id = ?1", documentId);
    }

    @Override
    @Transactional
    public void remove(String documentId) {
        deleteById(documentId);
    }
}
