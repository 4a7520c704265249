package com.questrail.startline.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Fans the event stream out to several sinks, typically the committee log and
 * the broadcast channel.
 *
 * <p>A delegate that throws is reported through the remaining delegates'
 * {@link #onError(SchedulerErrorEvent)} and does not stop delivery to the others.</p>
 */
public final class CompositeStartEventSink implements StartEventSink {
    private static final Logger log = LoggerFactory.getLogger(CompositeStartEventSink.class);

    private final List<StartEventSink> delegates;

    public CompositeStartEventSink(List<StartEventSink> delegates) {
        this.delegates = List.copyOf(Objects.requireNonNull(delegates, "delegates"));
    }

    @Override
    public void onEvent(StartEvent event) {
        for (StartEventSink sink : delegates) {
            try {
                sink.onEvent(event);
            } catch (RuntimeException e) {
                reportFailure(sink, "onEvent " + event.eventType(), e);
            }
        }
    }

    @Override
    public void onCommandRejected(CommandRejectedEvent event) {
        for (StartEventSink sink : delegates) {
            try {
                sink.onCommandRejected(event);
            } catch (RuntimeException e) {
                reportFailure(sink, "onCommandRejected " + event.command(), e);
            }
        }
    }

    @Override
    public void onError(SchedulerErrorEvent event) {
        for (StartEventSink sink : delegates) {
            try {
                sink.onError(event);
            } catch (RuntimeException e) {
                log.error("Sink {} failed while reporting error '{}'", sink, event.message(), e);
            }
        }
    }

    private void reportFailure(StartEventSink failed, String what, RuntimeException e) {
        SchedulerErrorEvent error = new SchedulerErrorEvent(Instant.now(),
                "Event sink " + failed.getClass().getSimpleName() + " failed in " + what, e);
        for (StartEventSink sink : delegates) {
            if (sink == failed) {
                continue;
            }
            try {
                sink.onError(error);
            } catch (RuntimeException nested) {
                log.error("Sink {} failed while reporting error '{}'", sink, error.message(), nested);
            }
        }
        log.debug("Event sink failure reported: {}", error.message());
    }
}
