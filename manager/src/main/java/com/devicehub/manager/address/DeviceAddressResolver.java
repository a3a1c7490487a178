package com.devicehub.manager.address;

import com.devicehub.manager.ManagerConfig;

import java.util.Objects;

/**
 * Supplies the network address of the local device.
 *
 * <p>The address names the bus channel a manager listens on and is part of every
 * output channel and manager logger name.</p>
 */
@FunctionalInterface
public interface DeviceAddressResolver {

    /**
     * Resolve the device address.
     *
     * @return the address, never null
     */
    String resolve();

    /**
     * A resolver that always returns the given address.
     */
    static DeviceAddressResolver fixed(String address) {
        Objects.requireNonNull(address, "address");
        return () -> address;
    }

    /**
     * A resolver that detects the address of the interface used for outbound traffic.
     */
    static DeviceAddressResolver localNetwork() {
        return new LocalNetworkAddressResolver();
    }

    /**
     * Use the configured device address if there is one, otherwise detect it.
     */
    static DeviceAddressResolver fromConfig(ManagerConfig config) {
        return config.hasDeviceAddress() ? fixed(config.getDeviceAddress()) : localNetwork();
    }
}
