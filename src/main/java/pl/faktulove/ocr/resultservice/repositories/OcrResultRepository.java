package pl.faktulove.ocr.resultservice.repositories;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.persistence.LockModeType;
import jakarta.transaction.Transactional;
import pl.faktulove.ocr.resultservice.model.OcrResult;

import java.util.List;
import java.util.Optional;

@ApplicationScoped
public class OcrResultRepository implements PanacheRepositoryBase<OcrResult, String>, OcrResultStore {

    @Override
    @Transactional
    public void insert(OcrResult result) {
        persist(result);
    }

    @Override
    @Transactional
    public Optional<OcrResult> get(String resultId) {
        return findByIdOptional(resultId).map(OcrResult::copy);
    }

    @Override
    @Transactional(Transactional.TxType.MANDATORY)
    public Optional<OcrResult> getForUpdate(String resultId) {
        return findByIdOptional(resultId, LockModeType.PESSIMISTIC_WRITE).map(OcrResult::copy);
    }

    @Override
    @Transactional
    public Optional<OcrResult> findByTask(String taskId) {
        return find("taskId", taskId).firstResultOptional().map(OcrResult::copy);
    }

    @Override
    @Transactional
    public List<OcrResult> findByOwner(String ownerId) {
        return find("ownerId", Sort.descending("createdAt"), ownerId)
                .stream().map(OcrResult::copy).toList();
    }

    @Override
    @Transactional
    public boolean compareAndSet(OcrResult result) {
        OcrResult current = findById(result.getId(), LockModeType.PESSIMISTIC_WRITE);
        if (current == null || current.getVersion() != result.getVersion()) {
            return false;
        }
        current.getFields().clear();
        result.getFields().forEach((name, field) -> current.getFields().put(name, field.copy()));
        current.setAggregateConfidence(result.getAggregateConfidence());
        current.setNeedsReview(result.isNeedsReview());
        current.setInvoiceRef(result.getInvoiceRef());
        current.setUpdatedAt(result.getUpdatedAt());
        current.setVersion(current.getVersion() + 1);
        result.setVersion(current.getVersion());
        return true;
    }

    @Override
    @Transactional
    public void remove(String resultId) {
        deleteById(resultId);
    }
}
