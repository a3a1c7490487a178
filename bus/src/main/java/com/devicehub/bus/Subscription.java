package com.devicehub.bus;

/**
 * Handle for a registered request handler or message listener.
 * Closing it stops further deliveries.
 */
public interface Subscription extends AutoCloseable {

    /**
     * Get the channel this subscription is attached to.
     */
    String getChannel();

    @Override
    void close();
}
