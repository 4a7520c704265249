package com.questrail.startline.observability;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Record of one successful change to a start schedule.
 *
 * <p>This is the shape consumed by the committee log and by broadcast
 * listeners. {@code details} keeps insertion order so log lines read the same
 * way every time.</p>
 *
 * @param eventType  what happened
 * @param scheduleId the schedule affected
 * @param entryId    the fleet entry affected, or {@code null} for schedule-level events
 * @param timestamp  wall-clock time the change was committed
 * @param details    event-specific key/value pairs
 */
public record StartEvent(
    StartEventType eventType,
    String scheduleId,
    String entryId,
    Instant timestamp,
    Map<String, String> details
) {
    public StartEvent {
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(scheduleId, "scheduleId");
        Objects.requireNonNull(timestamp, "timestamp");
        details = details == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static StartEvent forSchedule(StartEventType type, String scheduleId, Instant timestamp,
                                         Map<String, String> details) {
        return new StartEvent(type, scheduleId, null, timestamp, details);
    }

    public static StartEvent forEntry(StartEventType type, String scheduleId, String entryId, Instant timestamp,
                                      Map<String, String> details) {
        return new StartEvent(type, scheduleId, Objects.requireNonNull(entryId, "entryId"), timestamp, details);
    }

    public Optional<String> entry() {
        return Optional.ofNullable(entryId);
    }

    public Optional<String> detail(String key) {
        return Optional.ofNullable(details.get(key));
    }
}
