package com.crewdesk.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory router for task lifecycle events.
 * <p>
 * Subscribers pick a scope (one task or every task) and a set of
 * {@link EventChannel}s. Each published event gets a sequence number and is
 * kept in a bounded per-task history, so a client that attaches to a task
 * after it was submitted can replay what it missed and then follow live
 * events without gaps or duplicates. A subscriber that throws never affects
 * delivery to the others.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    static final int HISTORY_PER_TASK = 200;
    static final int HISTORY_TASKS = 64;

    private final CopyOnWriteArrayList<Registration> registrations = new CopyOnWriteArrayList<>();

    /** Guarded by itself; also orders sequence numbers with history appends. */
    private final Map<String, Deque<Sequenced>> history = new LinkedHashMap<>(16, 0.75f, true) {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, Deque<Sequenced>> eldest) {
            return size() > HISTORY_TASKS;
        }
    };
    private long sequence;

    private record Sequenced(long seq, CrewdeskEvent event) {}

    private record Registration(String taskId, Set<EventChannel> channels, long after,
                                Consumer<CrewdeskEvent> consumer) {
        boolean accepts(long seq, String eventTaskId, EventChannel channel) {
            return seq > after
                    && channels.contains(channel)
                    && (taskId == null || taskId.equals(eventTaskId));
        }
    }

    public void publish(CrewdeskEvent event) {
        EventChannel channel = EventChannel.forType(event.eventType());
        long seq;
        synchronized (history) {
            seq = ++sequence;
            if (event.taskId() != null) {
                Deque<Sequenced> events = history.computeIfAbsent(event.taskId(), k -> new ArrayDeque<>());
                if (events.size() >= HISTORY_PER_TASK) {
                    events.removeFirst();
                }
                events.addLast(new Sequenced(seq, event));
            }
        }
        log.debug("Publishing #{} {} for task {}", seq, event.eventType(), event.taskId());
        for (Registration registration : registrations) {
            if (registration.accepts(seq, event.taskId(), channel)) {
                deliverSafely(registration.consumer(), event);
            }
        }
    }

    /** Every channel of one task, live events only. */
    public Subscription subscribe(String taskId, Consumer<CrewdeskEvent> consumer) {
        return subscribe(taskId, EventChannel.all(), consumer);
    }

    public Subscription subscribe(String taskId, Set<EventChannel> channels, Consumer<CrewdeskEvent> consumer) {
        return register(taskId, channels, consumer, false);
    }

    /**
     * Every channel of one task, starting with the events already published for
     * it (oldest first, up to {@value #HISTORY_PER_TASK}).
     */
    public Subscription subscribeWithHistory(String taskId, Consumer<CrewdeskEvent> consumer) {
        return register(taskId, EventChannel.all(), consumer, true);
    }

    /** Every channel of every task. */
    public Subscription subscribeAll(Consumer<CrewdeskEvent> consumer) {
        return subscribeAll(EventChannel.all(), consumer);
    }

    public Subscription subscribeAll(Set<EventChannel> channels, Consumer<CrewdeskEvent> consumer) {
        return register(null, channels, consumer, false);
    }

    /** Snapshot of the retained events of a task, oldest first. */
    public List<CrewdeskEvent> history(String taskId) {
        synchronized (history) {
            Deque<Sequenced> events = history.get(taskId);
            return events == null ? List.of() : events.stream().map(Sequenced::event).toList();
        }
    }

    private Subscription register(String taskId, Set<EventChannel> channels, Consumer<CrewdeskEvent> consumer,
                                  boolean replay) {
        Set<EventChannel> routed = channels.isEmpty() ? EnumSet.noneOf(EventChannel.class) : EnumSet.copyOf(channels);
        List<CrewdeskEvent> missed = new ArrayList<>();
        Registration registration;
        synchronized (history) {
            if (replay) {
                Deque<Sequenced> events = history.get(taskId);
                if (events != null) {
                    events.forEach(e -> missed.add(e.event()));
                }
                // replayed before any later publish can take a sequence number
                missed.forEach(event -> deliverSafely(consumer, event));
            }
            registration = new Registration(taskId, routed, sequence, consumer);
            registrations.add(registration);
        }
        log.debug("Subscribed to {} on {}{}", taskId == null ? "all tasks" : "task " + taskId, routed,
                replay ? " (replayed " + missed.size() + ")" : "");
        return () -> registrations.remove(registration);
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<CrewdeskEvent> subscriber, CrewdeskEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
