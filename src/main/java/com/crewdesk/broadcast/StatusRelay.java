package com.crewdesk.broadcast;

import com.crewdesk.core.config.CrewdeskProperties;
import com.crewdesk.core.events.CrewdeskEvent;
import com.crewdesk.core.events.EventBus;
import com.crewdesk.core.events.EventChannel;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Forwards every lifecycle event to a remote status service as a JSON POST when
 * {@code crewdesk.broadcast.url} is set. Delivery is fire-and-forget: a failed
 * post only produces a {@code relay.status} event and never affects the pipeline.
 */
@Component
public class StatusRelay {

    private static final Logger log = LoggerFactory.getLogger(StatusRelay.class);

    static final String RELAY_STATUS = "relay.status";

    private final EventBus eventBus;
    private final ObjectMapper objectMapper;
    private final String url;
    private final HttpClient httpClient;
    private EventBus.Subscription subscription;

    @Autowired
    public StatusRelay(EventBus eventBus, ObjectMapper objectMapper, CrewdeskProperties properties) {
        this(eventBus, objectMapper, properties.getBroadcast().getUrl(),
                HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build());
    }

    StatusRelay(EventBus eventBus, ObjectMapper objectMapper, String url, HttpClient httpClient) {
        this.eventBus = eventBus;
        this.objectMapper = objectMapper;
        this.url = url;
        this.httpClient = httpClient;
    }

    @PostConstruct
    public void start() {
        if (!isEnabled()) {
            log.debug("Status relay disabled (no crewdesk.broadcast.url)");
            return;
        }
        subscription = eventBus.subscribeAll(EventChannel.allExcept(EventChannel.RELAY), this::relay);
        log.info("Relaying task events to {}", url);
    }

    public boolean isEnabled() {
        return url != null && !url.isBlank();
    }

    CompletableFuture<Boolean> relay(CrewdeskEvent event) {
        if (RELAY_STATUS.equals(event.eventType())) {
            return CompletableFuture.completedFuture(false);
        }
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(Duration.ofSeconds(10))
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(event)))
                    .build();
        } catch (Exception e) {
            reportFailure(event, e.getMessage());
            return CompletableFuture.completedFuture(false);
        }
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.discarding())
                .handle((response, error) -> {
                    if (error != null) {
                        reportFailure(event, error.getMessage());
                        return false;
                    }
                    if (response.statusCode() >= 300) {
                        reportFailure(event, "HTTP " + response.statusCode());
                        return false;
                    }
                    return true;
                });
    }

    private void reportFailure(CrewdeskEvent event, String error) {
        log.warn("Status relay failed for {} ({}): {}", event.eventType(), event.taskId(), error);
        eventBus.publish(CrewdeskEvent.of(RELAY_STATUS, event.taskId(),
                Map.of("ok", false, "event", event.eventType(), "error", String.valueOf(error))));
    }

    @PreDestroy
    public void stop() {
        if (subscription != null) {
            subscription.unsubscribe();
        }
    }
}
