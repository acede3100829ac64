package io.github.drompincen.knowpipe.runtime.error;

/** A channel failed to deliver one event. Recorded in the delivery log, never propagated to publishers. */
public class NotificationDeliveryException extends Exception {

    public NotificationDeliveryException(String message) {
        super(message);
    }

    public NotificationDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
