package io.github.drompincen.knowpipe.runtime.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.knowpipe.protocol.api.ChannelType;
import io.github.drompincen.knowpipe.protocol.event.NotificationEvent;
import io.github.drompincen.knowpipe.runtime.error.NotificationDeliveryException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/** Appends each event as one JSON line. */
public class FileLogChannel implements NotificationChannel {

    private final Path file;
    private final ObjectMapper objectMapper;

    public FileLogChannel(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return "file:" + file.getFileName();
    }

    @Override
    public ChannelType type() {
        return ChannelType.FILE;
    }

    @Override
    public void deliver(NotificationEvent event) throws NotificationDeliveryException {
        String json;
        try {
            json = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new NotificationDeliveryException("cannot serialize event for task " + event.taskId(), e);
        }
        synchronized (this) {
            try {
                Path parent = file.toAbsolutePath().getParent();
                if (parent != null) Files.createDirectories(parent);
                Files.writeString(file, json + System.lineSeparator(), StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            } catch (IOException e) {
                throw new NotificationDeliveryException("cannot append to " + file, e);
            }
        }
    }
}
