package pl.faktulove.ocr.validationservice.repositories;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import pl.faktulove.ocr.validationservice.model.ValidationRecord;

import java.util.List;

@ApplicationScoped
public class ValidationRecordRepository implements PanacheRepositoryBase<ValidationRecord, String>, ValidationRecordStore {

    @Override
    @Transactional
    public void append(ValidationRecord record) {
        persist(record);
    }

    @Override
    @Transactional
    public List<ValidationRecord> findByResult(String resultId) {
        return find("resultId", Sort.ascending("createdAt"), resultId).list();
    }
}
