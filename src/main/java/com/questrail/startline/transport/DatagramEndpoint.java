package com.questrail.startline.transport;

import java.net.SocketAddress;

/**
 * DatagramEndpoint
 * -----------------------------------------------------------------------------
 * Port for a datagram transport used by the event broadcast.
 *
 * <p>Implementations move bytes only; encoding events is the codec's job.
 * They may be backed by Netty or by a test double.</p>
 */
public interface DatagramEndpoint
{
    /**
     * Binds and begins receiving. The listener is told
     * {@link DatagramEndpointListener#onTransportUp()} once the socket is usable.
     */
    void start();

    /**
     * Releases the socket. The listener is told
     * {@link DatagramEndpointListener#onTransportDown(Throwable)}.
     */
    void stop();

    /**
     * Sends one datagram. Payloads offered while the transport is down are dropped.
     */
    void send(SocketAddress remote, byte[] payload);

    /**
     * Must be called before {@link #start()}.
     */
    void setListener(DatagramEndpointListener listener);
}
