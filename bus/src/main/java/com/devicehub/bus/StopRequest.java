package com.devicehub.bus;

/**
 * Asks the receiver of the request to stop. Carries no payload.
 */
public final class StopRequest extends Request {
}
