package com.crewdesk.dispatch.api;

import com.crewdesk.core.events.CrewdeskEvent;
import com.crewdesk.core.events.EventBus;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Bridges {@link EventBus} subscriptions to {@link SseEmitter} instances.
 * <p>
 * One emitter per client, subscribed either to a single task or to every
 * event. Emitters are unsubscribed on completion, timeout or error. A
 * heartbeat comment goes out periodically so idle proxies keep the
 * connection open.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    /** Default emitter timeout: 30 minutes. */
    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;

    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    private static final String ALL_TASKS = "*";

    private final EventBus eventBus;
    private final long timeoutMs;

    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventBus eventBus) {
        this(eventBus, DEFAULT_TIMEOUT_MS);
    }

    SseStreamingService(EventBus eventBus, long timeoutMs) {
        this.eventBus = eventBus;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(
                this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS,
                HEARTBEAT_INTERVAL_SECONDS,
                TimeUnit.SECONDS
        );
        log.info("SSE heartbeat scheduler started (interval={}s)", HEARTBEAT_INTERVAL_SECONDS);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdown();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        activeRegistrations.forEach(r -> r.subscription().unsubscribe());
        activeRegistrations.clear();
        log.info("SSE heartbeat scheduler stopped");
    }

    private void sendHeartbeats() {
        if (activeRegistrations.isEmpty()) {
            return;
        }
        log.debug("Sending heartbeat to {} active SSE emitters", activeRegistrations.size());
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter().send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException e) {
                // cleanup happens in the emitter's onError/onCompletion callbacks
                log.debug("Heartbeat failed for stream {}: {}", registration.scope(), e.getMessage());
            } catch (IllegalStateException e) {
                log.debug("Heartbeat skipped for stream {} (emitter not active)", registration.scope());
            }
        }
    }

    /**
     * Creates an emitter that streams the events of one task, starting with
     * the ones published before the client connected.
     */
    public SseEmitter createEmitter(String taskId) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        sendConnected(emitter, taskId);
        EventBus.Subscription subscription = eventBus.subscribeWithHistory(taskId, event -> sendEvent(emitter, event));
        return register(taskId, emitter, subscription);
    }

    /**
     * Creates an emitter that streams every live event, across tasks.
     */
    public SseEmitter createGlobalEmitter() {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        sendConnected(emitter, ALL_TASKS);
        EventBus.Subscription subscription = eventBus.subscribeAll(event -> sendEvent(emitter, event));
        return register(ALL_TASKS, emitter, subscription);
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    private SseEmitter register(String scope, SseEmitter emitter, EventBus.Subscription subscription) {
        var registration = new EmitterRegistration(scope, emitter, subscription);
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> cleanup(registration));
        emitter.onTimeout(() -> {
            log.debug("SSE emitter timed out for stream {}", scope);
            cleanup(registration);
        });
        emitter.onError(ex -> {
            log.debug("SSE emitter error for stream {}: {}", scope, ex.getMessage());
            cleanup(registration);
        });

        log.info("SSE emitter created for stream {} (timeout={}ms)", scope, timeoutMs);
        return emitter;
    }

    private static void sendConnected(SseEmitter emitter, String scope) {
        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException e) {
            log.warn("Failed to send initial comment for stream {}: {}", scope, e.getMessage());
        }
    }

    private void sendEvent(SseEmitter emitter, CrewdeskEvent event) {
        try {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("taskId", event.taskId());
            if (event.subtaskId() != null) {
                data.put("subtaskId", event.subtaskId());
            }
            data.putAll(event.payload());
            data.put("timestamp", event.timestamp().toString());

            emitter.send(SseEmitter.event()
                    .name(event.eventType())
                    .data(data));
        } catch (IOException | IllegalStateException e) {
            log.debug("Failed to send SSE event {} for task {}: {}",
                    event.eventType(), event.taskId(), e.getMessage());
        }
    }

    private void cleanup(EmitterRegistration registration) {
        registration.subscription().unsubscribe();
        activeRegistrations.remove(registration);
        log.debug("Cleaned up SSE registration for stream {}", registration.scope());
    }

    private record EmitterRegistration(
            String scope,
            SseEmitter emitter,
            EventBus.Subscription subscription
    ) {}
}
