package com.devicehub.bus;

/**
 * Handles requests delivered on a channel.
 *
 * <p>The handler is invoked once per request and its return value is the reply.
 * A thrown exception fails the requester's future instead.</p>
 */
@FunctionalInterface
public interface RequestHandler {

    /**
     * Handle a request.
     *
     * @param channel the channel the request was sent to
     * @param request the request
     * @return the reply, never null
     * @throws Exception if the request cannot be handled
     */
    Message handle(String channel, Request request) throws Exception;
}
