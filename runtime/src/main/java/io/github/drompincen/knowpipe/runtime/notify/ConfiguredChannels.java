package io.github.drompincen.knowpipe.runtime.notify;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.knowpipe.runtime.config.PipelineProperties;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/** Subscribes the channels named in {@code knowpipe.notify.*} at startup. The webhook only receives terminal events. */
@Component
public class ConfiguredChannels {

    private static final Logger log = LoggerFactory.getLogger(ConfiguredChannels.class);

    private final Notifier notifier;
    private final ObjectMapper objectMapper;
    private final PipelineProperties.Notify cfg;
    private final List<UUID> subscriptionIds = new ArrayList<>();

    public ConfiguredChannels(Notifier notifier, ObjectMapper objectMapper, PipelineProperties properties) {
        this.notifier = notifier;
        this.objectMapper = objectMapper;
        this.cfg = properties.getNotify();
    }

    @PostConstruct
    public void register() {
        if (cfg.isCliEnabled()) {
            subscriptionIds.add(notifier.subscribe(new CliChannel(System.out), NotificationPreferences.all()));
        }
        if (cfg.getFileLogPath() != null && !cfg.getFileLogPath().isBlank()) {
            subscriptionIds.add(notifier.subscribe(
                    new FileLogChannel(Path.of(cfg.getFileLogPath()), objectMapper), NotificationPreferences.all()));
        }
        if (cfg.getWebhookUrl() != null && !cfg.getWebhookUrl().isBlank()) {
            subscriptionIds.add(notifier.subscribe(
                    new WebhookChannel(URI.create(cfg.getWebhookUrl()), objectMapper, cfg.getChannelTimeout()),
                    NotificationPreferences.terminalOnly()));
        }
        log.info("[Notifier] {} configured channel(s) subscribed", subscriptionIds.size());
    }

    public List<UUID> subscriptionIds() {
        return List.copyOf(subscriptionIds);
    }
}
