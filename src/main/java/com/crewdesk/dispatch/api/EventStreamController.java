package com.crewdesk.dispatch.api;

import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * GET /api/v1/events: every lifecycle event across tasks.
 */
@RestController
public class EventStreamController {

    private final SseStreamingService sseStreamingService;

    public EventStreamController(SseStreamingService sseStreamingService) {
        this.sseStreamingService = sseStreamingService;
    }

    @GetMapping(value = "/api/v1/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events() {
        return sseStreamingService.createGlobalEmitter();
    }
}
