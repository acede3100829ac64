package io.github.drompincen.knowpipe.runtime.notify;

import io.github.drompincen.knowpipe.protocol.api.ChannelType;
import io.github.drompincen.knowpipe.protocol.event.NotificationEvent;
import io.github.drompincen.knowpipe.runtime.error.NotificationDeliveryException;

public interface NotificationChannel {

    /** Stable name, used as the delivery log key together with the task id. */
    String name();

    ChannelType type();

    void deliver(NotificationEvent event) throws NotificationDeliveryException;
}
