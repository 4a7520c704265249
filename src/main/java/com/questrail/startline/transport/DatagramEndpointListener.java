package com.questrail.startline.transport;

import java.net.SocketAddress;

/**
 * Callbacks from a {@link DatagramEndpoint}, delivered one at a time.
 */
public interface DatagramEndpointListener
{
    void onTransportUp();

    /**
     * @param cause the failure, or {@code null} for an orderly shutdown
     */
    void onTransportDown(Throwable cause);

    /**
     * One complete inbound datagram, copied out of any framework buffer.
     */
    void onDatagram(SocketAddress remote, byte[] payload);
}
