package com.devicehub.manager.message;

import com.devicehub.bus.Message;

/**
 * Reply to a {@link StartComponentRequest} that could not be served.
 */
public final class NotStartedMessage extends Message {

    private final Throwable cause;

    public NotStartedMessage(Throwable cause) {
        this.cause = cause;
    }

    public Throwable getCause() {
        return cause;
    }

    @Override
    public String toString() {
        return "NotStartedMessage{cause=" + cause + ", requestId=" + getRequestId() + "}";
    }
}
