package io.github.drompincen.knowpipe.runtime.notify;

import io.github.drompincen.knowpipe.persistence.document.DeliveryLogDocument;
import io.github.drompincen.knowpipe.persistence.repository.DeliveryLogRepository;
import io.github.drompincen.knowpipe.protocol.api.DeliveryRecord;
import io.github.drompincen.knowpipe.protocol.api.DeliveryStatus;
import io.github.drompincen.knowpipe.protocol.event.NotificationKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class MongoDeliveryLogTest {

    @Mock private DeliveryLogRepository repository;

    @Test
    void recordsAreStoredAndReadBackPerTask() {
        MongoDeliveryLog log = new MongoDeliveryLog(repository);
        UUID task = UUID.randomUUID();
        DeliveryRecord record = new DeliveryRecord(task, "webhook:hooks.example.com", null, NotificationKind.FAILED,
                DeliveryStatus.FAILED, 3, "HTTP 503", Instant.parse("2026-03-02T09:00:00Z"));

        log.record(record);

        ArgumentCaptor<DeliveryLogDocument> saved = ArgumentCaptor.forClass(DeliveryLogDocument.class);
        verify(repository).save(saved.capture());
        assertThat(saved.getValue().getDeliveryId()).isNotBlank();
        assertThat(saved.getValue().getSubscriptionId()).isNull();

        when(repository.findByTaskIdOrderByRecordedAtAsc(task.toString())).thenReturn(List.of(saved.getValue()));
        assertThat(log.forTask(task)).containsExactly(record);
    }
}
