package com.iplicense.search.analytics;

import com.iplicense.search.common.IdGenerator;
import com.iplicense.search.common.PermissionContext;
import com.iplicense.search.query.EntityKind;
import com.iplicense.search.query.InvalidSearchRequestException;
import com.iplicense.search.query.SearchQuery;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Search event channel. {@link #record} enqueues and returns the event id at once; a single daemon writer
 * drains the bounded queue into the sink. A full queue drops the event.
 */
@Component
public class AnalyticsRecorder {
    private static final Logger logger = LoggerFactory.getLogger(AnalyticsRecorder.class);

    private final AnalyticsEventRepository repository;
    private final AnalyticsProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final BlockingQueue<PendingEvent> queue;
    private final ConcurrentMap<String, PendingEvent> pending = new ConcurrentHashMap<>();

    private volatile boolean running;
    private Thread writer;

    public AnalyticsRecorder(
        AnalyticsEventRepository repository,
        AnalyticsProperties properties,
        MeterRegistry meterRegistry,
        Clock clock
    ) {
        this.repository = repository;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.queue = new ArrayBlockingQueue<>(Math.max(1, properties.getQueueCapacity()));
    }

    @PostConstruct
    public synchronized void start() {
        if (running || !properties.isEnabled()) {
            return;
        }
        running = true;
        writer = new Thread(this::runWriter, "search-analytics-writer");
        writer.setDaemon(true);
        writer.start();
    }

    @PreDestroy
    public void stop() {
        Thread current;
        synchronized (this) {
            running = false;
            current = writer;
            writer = null;
        }
        if (current == null) {
            return;
        }
        try {
            current.join(TimeUnit.SECONDS.toMillis(2));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
        if (!queue.isEmpty()) {
            logger.warn("analytics writer stopped with {} events still queued", queue.size());
        }
    }

    /**
     * Enqueues one search event. Never throws and never blocks on the sink.
     *
     * @return the id assigned to the event
     */
    public String record(
        SearchQuery query,
        int resultsCount,
        long executionTimeMs,
        PermissionContext caller,
        AnalyticsEvent.Outcome outcome
    ) {
        String eventId = IdGenerator.newEventId();
        if (!properties.isEnabled()) {
            return eventId;
        }
        try {
            PermissionContext context = caller == null ? PermissionContext.ANONYMOUS : caller;
            AnalyticsEvent event = new AnalyticsEvent(
                eventId,
                query.getNormalizedText(),
                new ArrayList<>(query.getEntityKinds()),
                query.getFilters().toMap(),
                resultsCount,
                executionTimeMs,
                context.userId(),
                context.sessionId(),
                outcome,
                null,
                clock.instant()
            );
            PendingEvent entry = new PendingEvent(event);
            pending.put(eventId, entry);
            if (queue.offer(entry)) {
                meterRegistry.counter("ss_analytics_events_accepted_total").increment();
            } else {
                pending.remove(eventId);
                meterRegistry.counter("ss_analytics_events_dropped_total").increment();
                logger.warn("analytics queue full, dropping event_id={} capacity={}", eventId, properties.getQueueCapacity());
            }
        } catch (RuntimeException ex) {
            logger.warn("failed to enqueue search event event_id={}: {}", eventId, ex.getMessage());
        }
        return eventId;
    }

    /**
     * Attaches click-through data to a recorded event. Last write wins.
     *
     * @throws UnknownSearchEventException when no event with this id exists
     */
    public void attachClick(String eventId, String resultId, int position, EntityKind entityKind) {
        if (eventId == null || eventId.isBlank()) {
            throw new InvalidSearchRequestException("eventId is required");
        }
        if (resultId == null || resultId.isBlank()) {
            throw new InvalidSearchRequestException("resultId is required");
        }
        if (position < 0) {
            throw new InvalidSearchRequestException("resultPosition must be >= 0");
        }
        ClickAttachment click = new ClickAttachment(resultId.trim(), position, entityKind);

        PendingEvent entry = pending.get(eventId);
        if (entry != null) {
            synchronized (entry) {
                if (!entry.written) {
                    entry.event = entry.event.withClick(click);
                    return;
                }
            }
        }
        int updated = repository.attachClick(eventId, click);
        if (updated == 0) {
            throw new UnknownSearchEventException(eventId);
        }
    }

    /** Writes up to one batch of queued events on the calling thread. */
    int drainOnce() {
        List<PendingEvent> batch = new ArrayList<>();
        queue.drainTo(batch, Math.max(1, properties.getDrainBatchSize()));
        for (PendingEvent entry : batch) {
            write(entry);
        }
        return batch.size();
    }

    int queuedCount() {
        return queue.size();
    }

    private void runWriter() {
        while (running || !queue.isEmpty()) {
            try {
                PendingEvent first = queue.poll(properties.getPollIntervalMs(), TimeUnit.MILLISECONDS);
                if (first == null) {
                    continue;
                }
                write(first);
                drainOnce();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                return;
            } catch (RuntimeException ex) {
                logger.error("analytics writer loop error", ex);
            }
        }
    }

    private void write(PendingEvent entry) {
        synchronized (entry) {
            try {
                repository.insert(entry.event);
                meterRegistry.counter("ss_analytics_events_written_total").increment();
            } catch (RuntimeException ex) {
                meterRegistry.counter("ss_analytics_events_failed_total").increment();
                logger.warn("analytics write failed event_id={}: {}", entry.event.id(), ex.getMessage());
            } finally {
                entry.written = true;
                pending.remove(entry.event.id());
            }
        }
    }

    private static final class PendingEvent {
        private AnalyticsEvent event;
        private boolean written;

        private PendingEvent(AnalyticsEvent event) {
            this.event = event;
        }
    }
}
