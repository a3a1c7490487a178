package com.devicehub.bus;

/**
 * Generic acknowledgement for requests that have no other reply payload.
 */
public final class SuccessMessage extends Message {
}
