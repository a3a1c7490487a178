package com.devicehub.manager.address;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.InetSocketAddress;

/**
 * Detects the IPv4 address of the interface the OS would use to reach other hosts.
 *
 * <p>Connecting a UDP socket sends no packets; it only makes the OS pick a route and
 * bind the local address. Without a usable route the loopback address is returned.</p>
 */
public class LocalNetworkAddressResolver implements DeviceAddressResolver {

    private static final Logger log = LoggerFactory.getLogger(LocalNetworkAddressResolver.class);

    private static final String PROBE_HOST = "10.255.255.255";
    private static final int PROBE_PORT = 1;

    @Override
    public String resolve() {
        try (DatagramSocket socket = new DatagramSocket()) {
            socket.connect(new InetSocketAddress(PROBE_HOST, PROBE_PORT));
            InetAddress local = socket.getLocalAddress();
            if (local != null && !local.isAnyLocalAddress()) {
                return local.getHostAddress();
            }
        } catch (IOException | UncheckedIOException e) {
            log.debug("No outbound route, falling back to loopback: {}", e.getMessage());
        }
        return InetAddress.getLoopbackAddress().getHostAddress();
    }
}
