package com.questrail.startline.internal.exec;

import com.questrail.startline.internal.time.Cancellable;
import com.questrail.startline.internal.time.MonotonicClock;
import com.questrail.startline.internal.time.MonotonicScheduler;
import com.questrail.startline.internal.time.WallClock;
import com.questrail.startline.internal.timeline.SequenceCountdown;
import com.questrail.startline.model.FleetStartEntry;
import com.questrail.startline.model.ScheduleStatus;
import com.questrail.startline.model.StartSchedule;
import com.questrail.startline.observability.CommandRejectedEvent;
import com.questrail.startline.observability.NullStartEventSink;
import com.questrail.startline.observability.SchedulerErrorEvent;
import com.questrail.startline.observability.StartEvent;
import com.questrail.startline.observability.StartEventSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * CountdownTicker
 * =============================================================================
 * One logical timer per ACTIVE schedule, publishing the countdown of the
 * fleet in sequence at a fixed cadence.
 *
 * <h2>Arming</h2>
 * The ticker listens to the scheduler's event stream. {@code SEQUENCE_STARTED}
 * and {@code RESUMED} arm the schedule's timer; {@code SCHEDULE_COMPLETED} and
 * {@code SCHEDULE_DELETED} disarm it. A tick that finds the schedule gone or
 * no longer ACTIVE disarms it as well.
 *
 * <h2>Cadence</h2>
 * Ticks are placed on the {@link MonotonicClock} timeline at
 * {@code armedAt + n * interval}, so a slow listener delays one tick without
 * shifting the ones after it. The countdown itself is computed from the
 * {@link WallClock}, the clock the actual warning time was stamped with.
 *
 * <h2>Read only</h2>
 * The ticker reads committed snapshots and never issues commands. Signals
 * are always made by the race officer.
 */
public final class CountdownTicker implements StartEventSink
{
    private static final Logger log = LoggerFactory.getLogger(CountdownTicker.class);

    private final Function<String, Optional<StartSchedule>> snapshots;
    private final CountdownListener listener;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock monotonicClock;
    private final WallClock wallClock;
    private final Duration interval;
    private final StartEventSink errorSink;

    private final ConcurrentMap<String, Timer> timers = new ConcurrentHashMap<>();

    public CountdownTicker(Function<String, Optional<StartSchedule>> snapshots,
                           CountdownListener listener,
                           MonotonicScheduler scheduler,
                           MonotonicClock monotonicClock,
                           WallClock wallClock,
                           Duration interval,
                           StartEventSink errorSink)
    {
        this.snapshots = Objects.requireNonNull(snapshots, "snapshots");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.monotonicClock = Objects.requireNonNull(monotonicClock, "monotonicClock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.errorSink = Objects.requireNonNullElse(errorSink, NullStartEventSink.INSTANCE);

        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive");
        }
    }

    // ---------------------------------------------------------------------
    // StartEventSink
    // ---------------------------------------------------------------------

    @Override
    public void onEvent(StartEvent event) {
        switch (event.eventType()) {
            case SEQUENCE_STARTED, RESUMED -> arm(event.scheduleId());
            case SCHEDULE_COMPLETED, SCHEDULE_DELETED -> disarm(event.scheduleId());
            default -> {
                // signals change what the next tick reports, not whether it happens
            }
        }
    }

    @Override
    public void onCommandRejected(CommandRejectedEvent event) {
        // a refused command changes nothing the ticker reads
    }

    @Override
    public void onError(SchedulerErrorEvent event) {
        // errors are reported by the sinks that log them
    }

    // ---------------------------------------------------------------------
    // Timer management
    // ---------------------------------------------------------------------

    /**
     * Starts ticking for a schedule. Arming an armed schedule has no effect.
     */
    public void arm(String scheduleId) {
        Objects.requireNonNull(scheduleId, "scheduleId");
        timers.computeIfAbsent(scheduleId, id -> {
            Timer t = new Timer(id, monotonicClock.nowNanos());
            log.debug("Countdown armed for schedule {}", id);
            t.scheduleNext();
            return t;
        });
    }

    public void disarm(String scheduleId) {
        Timer t = timers.remove(scheduleId);
        if (t != null) {
            t.cancel();
            log.debug("Countdown disarmed for schedule {}", scheduleId);
        }
    }

    public void disarmAll() {
        for (String id : Set.copyOf(timers.keySet())) {
            disarm(id);
        }
    }

    public boolean isArmed(String scheduleId) {
        return timers.containsKey(scheduleId);
    }

    private void tick(Timer timer) {
        if (timers.get(timer.scheduleId) != timer) {
            return;
        }

        Optional<StartSchedule> snapshot = snapshots.apply(timer.scheduleId);
        if (snapshot.isEmpty() || snapshot.get().status() != ScheduleStatus.ACTIVE) {
            timers.remove(timer.scheduleId, timer);
            log.debug("Countdown stopped for schedule {}: schedule is not active", timer.scheduleId);
            return;
        }

        StartSchedule schedule = snapshot.get();
        Optional<FleetStartEntry> inSequence = schedule.signalingEntry();
        if (inSequence.isPresent()) {
            Optional<SequenceCountdown.Countdown> countdown =
                    SequenceCountdown.of(inSequence.get(), schedule.sequence(), wallClock.now());
            if (countdown.isPresent()) {
                publish(timer.scheduleId, countdown.get());
            }
        }

        if (timers.get(timer.scheduleId) == timer) {
            timer.scheduleNext();
        }
    }

    private void publish(String scheduleId, SequenceCountdown.Countdown countdown) {
        try {
            listener.onCountdown(scheduleId, countdown);
        } catch (RuntimeException e) {
            errorSink.onError(new SchedulerErrorEvent(
                    wallClock.now(),
                    "Countdown listener failed for schedule " + scheduleId,
                    e));
        }
    }

    private final class Timer {
        private final String scheduleId;
        private long nextDeadline;
        private volatile Cancellable pending;

        private Timer(String scheduleId, long armedAtNanos) {
            this.scheduleId = scheduleId;
            this.nextDeadline = armedAtNanos;
        }

        private synchronized void scheduleNext() {
            nextDeadline += interval.toNanos();
            pending = scheduler.scheduleAtNanos(nextDeadline, () -> tick(this));
        }

        private void cancel() {
            Cancellable c = pending;
            if (c != null) {
                c.cancel();
            }
        }
    }
}
