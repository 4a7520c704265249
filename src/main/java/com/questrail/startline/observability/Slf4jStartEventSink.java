package com.questrail.startline.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of StartEventSink that writes the committee log via SLF4J.
 */
public final class Slf4jStartEventSink implements StartEventSink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jStartEventSink.class);

    @Override
    public void onEvent(StartEvent event) {
        CommitteeLogEntry entry = CommitteeLogEntry.describe(event);
        if ("schedule".equals(entry.category())) {
            log.info("Schedule {}: {} {}", event.scheduleId(), entry.title(), event.details());
            return;
        }
        log.info("Schedule {} [{}] {} | flags={} sounds={} | {}",
            event.scheduleId(),
            entry.category(),
            entry.title(),
            entry.flags(),
            entry.soundSignals(),
            entry.description());
    }

    @Override
    public void onCommandRejected(CommandRejectedEvent event) {
        log.warn("Schedule {}: {} rejected: {}",
            event.scheduleId(),
            event.command(),
            event.reason().getMessage());
    }

    @Override
    public void onError(SchedulerErrorEvent event) {
        log.error("Start scheduler error: {}", event.message(), event.cause());
    }
}
