package io.github.drompincen.knowpipe.runtime.notify;

import io.github.drompincen.knowpipe.protocol.event.NotificationEvent;
import io.github.drompincen.knowpipe.protocol.event.NotificationKind;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class MailboxTest {

    private static NotificationEvent event(NotificationKind kind) {
        return new NotificationEvent(UUID.randomUUID(), kind, Map.of(), Instant.parse("2026-03-02T09:00:00Z"));
    }

    @Test
    void oldestNonTerminalEventMakesRoom() {
        Mailbox box = new Mailbox(2);
        NotificationEvent started = event(NotificationKind.STARTED);
        NotificationEvent progress = event(NotificationKind.PROGRESS);
        NotificationEvent completed = event(NotificationKind.COMPLETED);

        assertThat(box.offer(started)).isEmpty();
        assertThat(box.offer(progress)).isEmpty();
        assertThat(box.offer(completed)).contains(started);

        assertThat(box.poll()).isSameAs(progress);
        assertThat(box.poll()).isSameAs(completed);
        assertThat(box.isEmpty()).isTrue();
    }

    @Test
    void terminalEventsAreNeverDropped() {
        Mailbox box = new Mailbox(1);
        assertThat(box.offer(event(NotificationKind.COMPLETED))).isEmpty();
        assertThat(box.offer(event(NotificationKind.FAILED))).isEmpty();
        assertThat(box.size()).isEqualTo(2);

        NotificationEvent progress = event(NotificationKind.PROGRESS);
        assertThat(box.offer(progress)).contains(progress);
        assertThat(box.size()).isEqualTo(2);
    }
}
