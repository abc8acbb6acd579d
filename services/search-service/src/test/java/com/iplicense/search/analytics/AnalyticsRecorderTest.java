package com.iplicense.search.analytics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.iplicense.search.common.CallerRole;
import com.iplicense.search.common.PermissionContext;
import com.iplicense.search.config.SearchConfig;
import com.iplicense.search.query.EntityKind;
import com.iplicense.search.query.InvalidSearchRequestException;
import com.iplicense.search.query.QueryNormalizer;
import com.iplicense.search.query.SearchFilters;
import com.iplicense.search.query.SearchQuery;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AnalyticsRecorderTest {
    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");
    private static final PermissionContext CALLER = new PermissionContext("u-1", "s-1", CallerRole.VIEWER, null, null);

    @Mock
    private AnalyticsEventRepository repository;

    private AnalyticsProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private SearchQuery query;

    @BeforeEach
    void setUp() {
        properties = new AnalyticsProperties();
        properties.setQueueCapacity(2);
        meterRegistry = new SimpleMeterRegistry();
        query = new QueryNormalizer().normalize(
            "  Brand   logo ",
            List.of("assets", "licenses"),
            SearchFilters.NONE,
            1,
            20,
            null,
            null,
            SearchConfig.builder().build()
        );
    }

    @Test
    void recordReturnsImmediatelyAndDrainWritesEvent() {
        AnalyticsRecorder recorder = recorder();

        String eventId = recorder.record(query, 4, 37L, CALLER, AnalyticsEvent.Outcome.COMPLETE);

        assertThat(eventId).isNotBlank();
        assertEquals(1, recorder.queuedCount());
        verify(repository, never()).insert(any());

        assertEquals(1, recorder.drainOnce());
        ArgumentCaptor<AnalyticsEvent> captor = ArgumentCaptor.forClass(AnalyticsEvent.class);
        verify(repository).insert(captor.capture());
        AnalyticsEvent event = captor.getValue();
        assertEquals(eventId, event.id());
        assertEquals(query.getNormalizedText(), event.query());
        assertThat(event.entities()).containsExactly(EntityKind.ASSETS, EntityKind.LICENSES);
        assertEquals(4, event.resultsCount());
        assertEquals(37L, event.executionTimeMs());
        assertEquals("u-1", event.userId());
        assertEquals("s-1", event.sessionId());
        assertEquals(NOW, event.createdAt());
        assertThat(event.hasClick()).isFalse();
        assertThat(meterRegistry.counter("ss_analytics_events_written_total").count()).isEqualTo(1.0);
    }

    @Test
    void clickOnQueuedEventIsWrittenWithTheEvent() {
        AnalyticsRecorder recorder = recorder();
        String eventId = recorder.record(query, 4, 10L, CALLER, AnalyticsEvent.Outcome.COMPLETE);

        recorder.attachClick(eventId, " a-9 ", 2, EntityKind.ASSETS);
        recorder.drainOnce();

        ArgumentCaptor<AnalyticsEvent> captor = ArgumentCaptor.forClass(AnalyticsEvent.class);
        verify(repository).insert(captor.capture());
        assertEquals(new ClickAttachment("a-9", 2, EntityKind.ASSETS), captor.getValue().click());
        verify(repository, never()).attachClick(any(), any());
    }

    @Test
    void clickOnWrittenEventUpdatesStoredRow() {
        AnalyticsRecorder recorder = recorder();
        String eventId = recorder.record(query, 4, 10L, CALLER, AnalyticsEvent.Outcome.COMPLETE);
        recorder.drainOnce();
        when(repository.attachClick(eq(eventId), any())).thenReturn(1);

        recorder.attachClick(eventId, "c-1", 0, EntityKind.CREATORS);

        verify(repository).attachClick(eventId, new ClickAttachment("c-1", 0, EntityKind.CREATORS));
    }

    @Test
    void clickOnUnknownEventFails() {
        when(repository.attachClick(eq("missing"), any())).thenReturn(0);
        AnalyticsRecorder recorder = recorder();

        assertThatThrownBy(() -> recorder.attachClick("missing", "a-1", 0, EntityKind.ASSETS))
            .isInstanceOf(UnknownSearchEventException.class)
            .hasMessageContaining("missing");
    }

    @Test
    void malformedClickIsRejected() {
        AnalyticsRecorder recorder = recorder();

        assertThatThrownBy(() -> recorder.attachClick(" ", "a-1", 0, EntityKind.ASSETS))
            .isInstanceOf(InvalidSearchRequestException.class);
        assertThatThrownBy(() -> recorder.attachClick("evt", "", 0, EntityKind.ASSETS))
            .isInstanceOf(InvalidSearchRequestException.class);
        assertThatThrownBy(() -> recorder.attachClick("evt", "a-1", -1, EntityKind.ASSETS))
            .isInstanceOf(InvalidSearchRequestException.class);
    }

    @Test
    void fullQueueDropsNewEvents() {
        AnalyticsRecorder recorder = recorder();

        recorder.record(query, 1, 1L, CALLER, AnalyticsEvent.Outcome.COMPLETE);
        recorder.record(query, 1, 1L, CALLER, AnalyticsEvent.Outcome.COMPLETE);
        String dropped = recorder.record(query, 1, 1L, CALLER, AnalyticsEvent.Outcome.COMPLETE);

        assertThat(dropped).isNotBlank();
        assertEquals(2, recorder.queuedCount());
        assertThat(meterRegistry.counter("ss_analytics_events_dropped_total").count()).isEqualTo(1.0);
    }

    @Test
    void sinkFailureIsCountedAndNotPropagated() {
        doThrow(new AnalyticsWriteException("sink down", null)).when(repository).insert(any());
        AnalyticsRecorder recorder = recorder();
        recorder.record(query, 1, 1L, CALLER, AnalyticsEvent.Outcome.PARTIAL);

        assertEquals(1, recorder.drainOnce());

        assertEquals(0, recorder.queuedCount());
        assertThat(meterRegistry.counter("ss_analytics_events_failed_total").count()).isEqualTo(1.0);
    }

    @Test
    void anonymousCallerIsRecordedWithoutUser() {
        AnalyticsRecorder recorder = recorder();
        recorder.record(query, 0, 5L, null, AnalyticsEvent.Outcome.CANCELLED);
        recorder.drainOnce();

        ArgumentCaptor<AnalyticsEvent> captor = ArgumentCaptor.forClass(AnalyticsEvent.class);
        verify(repository).insert(captor.capture());
        assertThat(captor.getValue().userId()).isNull();
        assertEquals(AnalyticsEvent.Outcome.CANCELLED, captor.getValue().outcome());
    }

    @Test
    void disabledRecorderQueuesNothing() {
        properties.setEnabled(false);
        AnalyticsRecorder recorder = recorder();

        String eventId = recorder.record(query, 1, 1L, CALLER, AnalyticsEvent.Outcome.COMPLETE);

        assertThat(eventId).isNotBlank();
        assertEquals(0, recorder.queuedCount());
    }

    private AnalyticsRecorder recorder() {
        return new AnalyticsRecorder(repository, properties, meterRegistry, Clock.fixed(NOW, ZoneOffset.UTC));
    }
}
