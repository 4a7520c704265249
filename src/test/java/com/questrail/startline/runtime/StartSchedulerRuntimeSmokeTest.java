package com.questrail.startline.runtime;

import com.questrail.startline.api.FleetEntryRequest;
import com.questrail.startline.api.ScheduleDefinition;
import com.questrail.startline.api.StartScheduler;
import com.questrail.startline.codec.StartEventDatagramCodec;
import com.questrail.startline.config.BroadcastConfig;
import com.questrail.startline.internal.timeline.SequenceCountdown;
import com.questrail.startline.model.StartSchedule;
import com.questrail.startline.observability.RecordingStartEventSink;
import com.questrail.startline.observability.StartEventType;
import com.questrail.startline.time.DeterministicScheduler;
import com.questrail.startline.time.ManualMonotonicClock;
import com.questrail.startline.time.ManualWallClock;
import com.questrail.startline.transport.FakeDatagramEndpoint;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class StartSchedulerRuntimeSmokeTest {

    private static final InetSocketAddress SHORE_DISPLAY = new InetSocketAddress("127.0.0.1", 47470);

    private static ScheduleDefinition saturday() {
        return ScheduleDefinition.builder()
                .withRegattaId("club-champs")
                .withName("Saturday")
                .withScheduledDate(LocalDate.of(2026, 6, 14))
                .withFirstWarningTime(Instant.parse("2026-06-14T10:00:00Z"))
                .build();
    }

    @Test
    void fullStackWithFakeTransport() {
        ManualMonotonicClock monotonic = new ManualMonotonicClock();
        ManualWallClock wall = new ManualWallClock(Instant.parse("2026-06-14T09:00:00Z"));
        DeterministicScheduler timer = new DeterministicScheduler(monotonic);
        FakeDatagramEndpoint endpoint = new FakeDatagramEndpoint();
        RecordingStartEventSink events = new RecordingStartEventSink();
        List<SequenceCountdown.Countdown> countdowns = new CopyOnWriteArrayList<>();
        AtomicInteger ids = new AtomicInteger();

        StartSchedulerRuntime runtime = StartSchedulerRuntime.builder()
                .withBroadcast(BroadcastConfig.to(SHORE_DISPLAY))
                .withDatagramEndpoint(endpoint)
                .withMonotonicClock(monotonic)
                .withMonotonicScheduler(timer)
                .withWallClock(wall)
                .withEventSink(events)
                .withCountdownListener((scheduleId, c) -> countdowns.add(c))
                .withIdGenerator(() -> "id-" + ids.incrementAndGet())
                .build();

        runtime.start();
        assertTrue(runtime.broadcaster().orElseThrow().isTransportUp());

        StartScheduler scheduler = runtime.scheduler();
        StartSchedule s = scheduler.createSchedule(saturday());
        scheduler.addFleets(s.id(), List.of(FleetEntryRequest.of("Lasers", 1), FleetEntryRequest.of("420s", 1)));
        scheduler.markReady(s.id());
        wall.set(Instant.parse("2026-06-14T10:00:00Z"));
        scheduler.startSequence(s.id());

        assertEquals(List.of(
                StartEventType.SCHEDULE_CREATED,
                StartEventType.FLEETS_ADDED,
                StartEventType.SCHEDULE_READY,
                StartEventType.SEQUENCE_STARTED,
                StartEventType.WARNING_SIGNALED), events.eventTypes());

        List<FakeDatagramEndpoint.Sent> sent = endpoint.sent();
        assertEquals(5, sent.size());
        assertEquals(SHORE_DISPLAY, sent.get(4).remote());
        assertEquals(StartEventType.WARNING_SIGNALED,
                new StartEventDatagramCodec().decode(sent.get(4).payload()).eventType());

        assertTrue(runtime.ticker().isArmed(s.id()));
        monotonic.advance(Duration.ofSeconds(1));
        wall.advance(Duration.ofSeconds(1));
        timer.runDueTasks();

        assertEquals(1, countdowns.size());
        assertEquals(299, countdowns.get(0).secondsRemaining());

        runtime.stop();

        assertFalse(endpoint.isStarted());
        assertFalse(runtime.ticker().isArmed(s.id()));
        assertEquals(0, timer.pendingCount());
    }

    @Test
    void defaultRuntimeRunsWithoutBroadcast() {
        StartSchedulerRuntime runtime = StartSchedulerRuntime.builder().build();
        runtime.start();
        try {
            assertTrue(runtime.broadcaster().isEmpty());

            StartSchedule s = runtime.scheduler().createSchedule(saturday());

            assertEquals(List.of(s.id()), runtime.scheduler().getSchedules("club-champs").stream()
                    .map(StartSchedule::id).toList());
        } finally {
            runtime.stop();
        }
    }
}
