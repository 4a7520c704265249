package com.questrail.startline.config;

import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * UDP notification channel settings.
 *
 * @param enabled     whether events are broadcast at all
 * @param bindAddress local address the datagram socket binds to
 * @param target      where datagrams are sent; usually a subnet broadcast address
 * @param broadcast   whether {@code SO_BROADCAST} is set on the socket
 */
public record BroadcastConfig(
    boolean enabled,
    InetSocketAddress bindAddress,
    InetSocketAddress target,
    boolean broadcast
) {
    public static final int DEFAULT_PORT = 47_470;

    public BroadcastConfig {
        if (enabled) {
            Objects.requireNonNull(bindAddress, "bindAddress");
            Objects.requireNonNull(target, "target");
        }
    }

    public static BroadcastConfig disabled() {
        return new BroadcastConfig(false, null, null, false);
    }

    public static BroadcastConfig to(InetSocketAddress target) {
        return new BroadcastConfig(true, new InetSocketAddress(0), target, true);
    }
}
