package io.github.drompincen.knowpipe.runtime.notify;

import io.github.drompincen.knowpipe.persistence.document.DeliveryLogDocument;
import io.github.drompincen.knowpipe.persistence.repository.DeliveryLogRepository;
import io.github.drompincen.knowpipe.protocol.api.DeliveryRecord;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

@Component
public class MongoDeliveryLog implements DeliveryLog {

    private final DeliveryLogRepository repository;

    public MongoDeliveryLog(DeliveryLogRepository repository) {
        this.repository = repository;
    }

    @Override
    public void record(DeliveryRecord record) {
        DeliveryLogDocument doc = new DeliveryLogDocument();
        doc.setDeliveryId(UUID.randomUUID().toString());
        doc.setTaskId(record.taskId().toString());
        doc.setChannel(record.channel());
        doc.setSubscriptionId(record.subscriptionId() == null ? null : record.subscriptionId().toString());
        doc.setKind(record.kind());
        doc.setStatus(record.status());
        doc.setAttempts(record.attempts());
        doc.setLastError(record.lastError());
        doc.setRecordedAt(record.recordedAt());
        repository.save(doc);
    }

    @Override
    public List<DeliveryRecord> forTask(UUID taskId) {
        return repository.findByTaskIdOrderByRecordedAtAsc(taskId.toString()).stream()
                .map(d -> new DeliveryRecord(UUID.fromString(d.getTaskId()), d.getChannel(),
                        d.getSubscriptionId() == null ? null : UUID.fromString(d.getSubscriptionId()),
                        d.getKind(), d.getStatus(), d.getAttempts(), d.getLastError(), d.getRecordedAt()))
                .toList();
    }
}
