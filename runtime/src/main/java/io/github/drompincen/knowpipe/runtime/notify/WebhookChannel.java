package io.github.drompincen.knowpipe.runtime.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.knowpipe.protocol.api.ChannelType;
import io.github.drompincen.knowpipe.protocol.event.NotificationEvent;
import io.github.drompincen.knowpipe.runtime.error.NotificationDeliveryException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/** POSTs each event as JSON. Any non-2xx response is a failed delivery. */
public class WebhookChannel implements NotificationChannel {

    private final URI endpoint;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public WebhookChannel(URI endpoint, ObjectMapper objectMapper, Duration timeout) {
        this(endpoint, HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build(), objectMapper, timeout);
    }

    public WebhookChannel(URI endpoint, HttpClient httpClient, ObjectMapper objectMapper, Duration timeout) {
        this.endpoint = endpoint;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.timeout = timeout;
    }

    @Override
    public String name() {
        return "webhook:" + endpoint.getHost();
    }

    @Override
    public ChannelType type() {
        return ChannelType.WEBHOOK;
    }

    @Override
    public void deliver(NotificationEvent event) throws NotificationDeliveryException {
        String body;
        try {
            body = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new NotificationDeliveryException("cannot serialize event for task " + event.taskId(), e);
        }
        HttpRequest request = HttpRequest.newBuilder(endpoint)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new NotificationDeliveryException("POST " + endpoint + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NotificationDeliveryException("POST " + endpoint + " interrupted", e);
        }
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new NotificationDeliveryException("POST " + endpoint + " returned HTTP " + status);
        }
    }
}
