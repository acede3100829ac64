package io.github.drompincen.knowpipe.runtime.notify;

import io.github.drompincen.knowpipe.protocol.api.ChannelType;
import io.github.drompincen.knowpipe.protocol.event.NotificationEvent;

import java.io.PrintStream;

/** One human-readable line per event. */
public class CliChannel implements NotificationChannel {

    private final String name;
    private final PrintStream out;

    public CliChannel(PrintStream out) {
        this("cli", out);
    }

    public CliChannel(String name, PrintStream out) {
        this.name = name;
        this.out = out;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ChannelType type() {
        return ChannelType.CLI;
    }

    @Override
    public void deliver(NotificationEvent event) {
        StringBuilder line = new StringBuilder()
                .append('[').append(event.kind()).append("] task ").append(event.taskId());
        String query = event.payloadString(NotificationEvent.QUERY);
        if (query != null) line.append(" \"").append(query).append('"');
        String percent = event.payloadString(NotificationEvent.PERCENT);
        if (percent != null) line.append(' ').append(percent).append('%');
        String message = event.payloadString(NotificationEvent.MESSAGE);
        if (message != null) line.append(" - ").append(message);
        String error = event.payloadString(NotificationEvent.ERROR);
        if (error != null) line.append(" error: ").append(error);
        synchronized (out) {
            out.println(line);
            out.flush();
        }
    }
}
