package com.devicehub.bus;

/**
 * Base type of everything carried over a {@link MessageBus}.
 *
 * <p>The request id is a correlation field stamped by the bus: a request receives a
 * fresh id when it is sent and the reply to it is stamped with the same id. A message
 * object that is handed out as a reply must therefore not be shared between requesters.</p>
 */
public abstract class Message {

    private volatile Long requestId;

    /**
     * Get the correlation id, or null if the message was never sent as or in reply to a request.
     */
    public Long getRequestId() {
        return requestId;
    }

    public void setRequestId(Long requestId) {
        this.requestId = requestId;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{requestId=" + requestId + "}";
    }
}
