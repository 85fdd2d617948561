package com.crewdesk.dispatch.api;

import com.crewdesk.core.events.CrewdeskEvent;
import com.crewdesk.core.events.EventBus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SseStreamingServiceTest {

    private EventBus eventBus;
    private SseStreamingService service;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
        service = new SseStreamingService(eventBus);
    }

    @Nested
    @DisplayName("emitter creation")
    class CreateEmitterTests {

        @Test
        @DisplayName("each client gets its own emitter")
        void separateEmitters() {
            SseEmitter first = service.createEmitter("t-1");
            SseEmitter second = service.createEmitter("t-1");

            assertNotSame(first, second);
            assertEquals(2, service.activeEmitterCount());
        }

        @Test
        @DisplayName("global emitters are tracked alongside task emitters")
        void globalEmitter() {
            service.createEmitter("t-1");
            assertNotNull(service.createGlobalEmitter());

            assertEquals(2, service.activeEmitterCount());
        }
    }

    @Nested
    @DisplayName("subscriptions")
    class SubscriptionTests {

        private EventBus mockBus;
        private EventBus.Subscription subscription;
        private SseStreamingService mockedService;

        @BeforeEach
        void setUp() {
            mockBus = mock(EventBus.class);
            subscription = mock(EventBus.Subscription.class);
            when(mockBus.subscribeWithHistory(any(), any())).thenReturn(subscription);
            when(mockBus.subscribeAll(any())).thenReturn(subscription);
            mockedService = new SseStreamingService(mockBus);
        }

        @Test
        @DisplayName("task emitters subscribe to that task only, with its history")
        void taskScoped() {
            mockedService.createEmitter("t-7");

            verify(mockBus).subscribeWithHistory(eq("t-7"), any());
        }

        @Test
        @DisplayName("global emitters subscribe to every event")
        void globalScoped() {
            mockedService.createGlobalEmitter();

            verify(mockBus).subscribeAll(any());
        }

        @Test
        @SuppressWarnings("unchecked")
        @DisplayName("an event for a closed emitter is dropped without failing the publisher")
        void closedEmitter() {
            SseEmitter emitter = mockedService.createEmitter("t-7");
            ArgumentCaptor<Consumer<CrewdeskEvent>> consumer = ArgumentCaptor.forClass(Consumer.class);
            verify(mockBus).subscribeWithHistory(eq("t-7"), consumer.capture());

            emitter.complete();

            assertDoesNotThrow(() -> consumer.getValue().accept(
                    CrewdeskEvent.of("task.started", "t-7", Map.of("position", 0))));
        }

        @Test
        @DisplayName("shutdown unsubscribes every open stream")
        void shutdownUnsubscribes() {
            mockedService.createEmitter("t-1");
            mockedService.createGlobalEmitter();

            mockedService.stopHeartbeat();

            verify(subscription, times(2)).unsubscribe();
            assertEquals(0, mockedService.activeEmitterCount());
        }
    }

    @Nested
    @DisplayName("concurrent operations")
    class ConcurrentTests {

        @Test
        @DisplayName("concurrent publishing to an open stream does not throw")
        void concurrentPublishDoesNotThrow() throws InterruptedException {
            service.createEmitter("t-1");
            service.createGlobalEmitter();

            int threadCount = 5;
            CountDownLatch latch = new CountDownLatch(threadCount);
            for (int t = 0; t < threadCount; t++) {
                final int threadId = t;
                new Thread(() -> {
                    for (int i = 0; i < 20; i++) {
                        eventBus.publish(CrewdeskEvent.of("agent.update", "t-1",
                                Map.of("thread", threadId, "seq", i)));
                    }
                    latch.countDown();
                }).start();
            }

            assertTrue(latch.await(5, TimeUnit.SECONDS));
            assertEquals(2, service.activeEmitterCount());
        }
    }
}
