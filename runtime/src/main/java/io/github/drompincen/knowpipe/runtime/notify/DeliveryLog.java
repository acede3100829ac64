package io.github.drompincen.knowpipe.runtime.notify;

import io.github.drompincen.knowpipe.protocol.api.DeliveryRecord;

import java.util.List;
import java.util.UUID;

/** Audit trail of every delivery outcome, keyed by task and channel. */
public interface DeliveryLog {

    void record(DeliveryRecord record);

    List<DeliveryRecord> forTask(UUID taskId);
}
