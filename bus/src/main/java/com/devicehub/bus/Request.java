package com.devicehub.bus;

/**
 * A message that expects exactly one reply.
 */
public abstract class Request extends Message {
}
