package io.github.drompincen.knowpipe.persistence.repository;

import io.github.drompincen.knowpipe.persistence.document.ScheduledTaskDocument;
import io.github.drompincen.knowpipe.protocol.api.TaskState;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface ScheduledTaskRepository extends MongoRepository<ScheduledTaskDocument, String> {
    List<ScheduledTaskDocument> findByStateIn(List<TaskState> states);
}
