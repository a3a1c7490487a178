package com.devicehub.bus;

/**
 * Reply sent by a handler that received a request it does not serve.
 */
public final class IgnoreRequestMessage extends Message {
}
