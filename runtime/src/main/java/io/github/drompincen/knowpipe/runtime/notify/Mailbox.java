package io.github.drompincen.knowpipe.runtime.notify;

import io.github.drompincen.knowpipe.protocol.event.NotificationEvent;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Optional;

/**
 * Bounded per-subscriber queue. When full, the oldest STARTED/PROGRESS event makes room; terminal
 * events are never dropped, so the box may exceed its capacity when it holds only terminal events.
 */
class Mailbox {

    private final int capacity;
    private final Deque<NotificationEvent> events = new ArrayDeque<>();

    Mailbox(int capacity) {
        this.capacity = Math.max(1, capacity);
    }

    /**
     * @return the event dropped to make room (possibly {@code event} itself), if any
     */
    synchronized Optional<NotificationEvent> offer(NotificationEvent event) {
        if (events.size() < capacity) {
            events.addLast(event);
            return Optional.empty();
        }
        Iterator<NotificationEvent> it = events.iterator();
        while (it.hasNext()) {
            NotificationEvent queued = it.next();
            if (!queued.kind().isTerminal()) {
                it.remove();
                events.addLast(event);
                return Optional.of(queued);
            }
        }
        if (event.kind().isTerminal()) {
            events.addLast(event);
            return Optional.empty();
        }
        return Optional.of(event);
    }

    synchronized NotificationEvent poll() {
        return events.pollFirst();
    }

    synchronized boolean isEmpty() {
        return events.isEmpty();
    }

    synchronized int size() {
        return events.size();
    }
}
