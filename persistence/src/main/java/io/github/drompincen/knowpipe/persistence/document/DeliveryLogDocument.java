package io.github.drompincen.knowpipe.persistence.document;

import io.github.drompincen.knowpipe.protocol.api.DeliveryStatus;
import io.github.drompincen.knowpipe.protocol.event.NotificationKind;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "notification_deliveries")
@CompoundIndex(name = "task_channel_idx", def = "{'taskId': 1, 'channel': 1}")
public class DeliveryLogDocument {

    @Id
    private String deliveryId;
    private String taskId;
    private String channel;
    private String subscriptionId;
    private NotificationKind kind;
    private DeliveryStatus status;
    private int attempts;
    private String lastError;
    private Instant recordedAt;

    public DeliveryLogDocument() {}

    public String getDeliveryId() { return deliveryId; }
    public void setDeliveryId(String deliveryId) { this.deliveryId = deliveryId; }
    public String getTaskId() { return taskId; }
    public void setTaskId(String taskId) { this.taskId = taskId; }
    public String getChannel() { return channel; }
    public void setChannel(String channel) { this.channel = channel; }
    public String getSubscriptionId() { return subscriptionId; }
    public void setSubscriptionId(String subscriptionId) { this.subscriptionId = subscriptionId; }
    public NotificationKind getKind() { return kind; }
    public void setKind(NotificationKind kind) { this.kind = kind; }
    public DeliveryStatus getStatus() { return status; }
    public void setStatus(DeliveryStatus status) { this.status = status; }
    public int getAttempts() { return attempts; }
    public void setAttempts(int attempts) { this.attempts = attempts; }
    public String getLastError() { return lastError; }
    public void setLastError(String lastError) { this.lastError = lastError; }
    public Instant getRecordedAt() { return recordedAt; }
    public void setRecordedAt(Instant recordedAt) { this.recordedAt = recordedAt; }
}
