/**
 * Transport ports for the start event broadcast.
 *
 * <p>Everything above the Netty adapter sees only {@code byte[]} payloads,
 * {@link java.net.SocketAddress} peers and up/down notifications. Netty types
 * stay inside {@code transport.udp.netty}.</p>
 */
package com.questrail.startline.transport;
