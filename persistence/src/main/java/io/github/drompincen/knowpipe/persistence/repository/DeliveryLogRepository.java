package io.github.drompincen.knowpipe.persistence.repository;

import io.github.drompincen.knowpipe.persistence.document.DeliveryLogDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface DeliveryLogRepository extends MongoRepository<DeliveryLogDocument, String> {
    List<DeliveryLogDocument> findByTaskIdOrderByRecordedAtAsc(String taskId);
}
