package pl.faktulove.ocr.security;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import pl.faktulove.ocr.documentservice.repositories.DocumentUploadStore;
import pl.faktulove.ocr.documentservice.model.DocumentUpload;

import java.util.Optional;

@ApplicationScoped
public class RequestUserContext implements UserContext {

    @Inject
    RequestHeaderHolder requestHeaderHolder;

    @Inject
    DocumentUploadStore documentUploadStore;

    @Override
    public String currentCaller() {
        String username = requestHeaderHolder.getUsername();
        return username == null ? RequestHeaderHolder.ANONYMOUS : username;
    }

    @Override
    public Optional<String> ownerOf(String documentId) {
        return documentUploadStore.get(documentId).map(DocumentUpload::getOwnerId);
    }
}
