package com.questrail.startline.transport.udp;

import com.questrail.startline.codec.StartEventDatagramCodec;
import com.questrail.startline.codec.StartEventDecodeException;
import com.questrail.startline.observability.CommandRejectedEvent;
import com.questrail.startline.observability.NullStartEventSink;
import com.questrail.startline.observability.SchedulerErrorEvent;
import com.questrail.startline.observability.StartEvent;
import com.questrail.startline.observability.StartEventSink;
import com.questrail.startline.transport.DatagramEndpoint;
import com.questrail.startline.transport.DatagramEndpointListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketAddress;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * UdpEventBroadcaster
 * =============================================================================
 * Publishes every committed {@link StartEvent} as one datagram, for shore
 * displays, mark boats and other listeners on the race network.
 *
 * <h2>Outbound</h2>
 * <pre>
 *   StartEvent ─▶ StartEventDatagramCodec ─▶ DatagramEndpoint.send(target)
 * </pre>
 * Events produced while the transport is down are dropped and counted. The
 * broadcast is best-effort; the committee log is the record.
 *
 * <h2>Inbound</h2>
 * Datagrams from other boats are decoded and handed to the optional inbound
 * sink. Datagrams that do not decode are dropped.
 */
public final class UdpEventBroadcaster implements StartEventSink, DatagramEndpointListener
{
    private static final Logger log = LoggerFactory.getLogger(UdpEventBroadcaster.class);

    private final DatagramEndpoint endpoint;
    private final SocketAddress target;
    private final StartEventDatagramCodec codec;
    private final StartEventSink inbound;

    private final AtomicLong sent = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private volatile boolean transportUp;

    public UdpEventBroadcaster(DatagramEndpoint endpoint,
                               SocketAddress target,
                               StartEventDatagramCodec codec,
                               StartEventSink inbound)
    {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.target = Objects.requireNonNull(target, "target");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.inbound = Objects.requireNonNullElse(inbound, NullStartEventSink.INSTANCE);
    }

    public void start() {
        endpoint.setListener(this);
        endpoint.start();
    }

    public void stop() {
        endpoint.stop();
    }

    public boolean isTransportUp() {
        return transportUp;
    }

    public long sentCount() {
        return sent.get();
    }

    public long droppedCount() {
        return dropped.get();
    }

    // ---------------------------------------------------------------------
    // StartEventSink
    // ---------------------------------------------------------------------

    @Override
    public void onEvent(StartEvent event) {
        if (!transportUp) {
            dropped.incrementAndGet();
            log.debug("Broadcast down, dropped {} for schedule {}", event.eventType(), event.scheduleId());
            return;
        }
        endpoint.send(target, codec.encode(event));
        sent.incrementAndGet();
    }

    @Override
    public void onCommandRejected(CommandRejectedEvent event) {
        // refusals are local to the officer who issued them
    }

    @Override
    public void onError(SchedulerErrorEvent event) {
        // errors are logged, not broadcast
    }

    // ---------------------------------------------------------------------
    // DatagramEndpointListener
    // ---------------------------------------------------------------------

    @Override
    public void onTransportUp() {
        transportUp = true;
        log.info("Start event broadcast up, sending to {}", target);
    }

    @Override
    public void onTransportDown(Throwable cause) {
        transportUp = false;
        if (cause != null) {
            log.warn("Start event broadcast down", cause);
        }
        else {
            log.info("Start event broadcast stopped");
        }
    }

    @Override
    public void onDatagram(SocketAddress remote, byte[] payload) {
        StartEvent event;
        try {
            event = codec.decode(payload);
        } catch (StartEventDecodeException e) {
            log.debug("Dropped undecodable datagram from {}: {}", remote, e.getMessage());
            return;
        }
        inbound.onEvent(event);
    }
}
