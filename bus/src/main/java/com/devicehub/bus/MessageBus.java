package com.devicehub.bus;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Publish/subscribe and request/reply transport shared by the processes of a device.
 *
 * <p>Channels are plain strings. A channel has at most one request handler, which is
 * how a component manager claims the channel named after its device address. Every
 * request yields exactly one reply (or a failed future); replies are stamped with the
 * request's {@link Message#getRequestId() request id}.</p>
 *
 * <pre>{@code
 * MessageBus bus = new LocalMessageBus("device");
 * Subscription sub = bus.registerRequestHandler("10.0.0.5", (channel, request) -> new SuccessMessage());
 * Message reply = bus.request("10.0.0.5", new StopRequest(), Duration.ofSeconds(1));
 * }</pre>
 */
public interface MessageBus extends AutoCloseable {

    /**
     * Register the request handler for a channel.
     *
     * @param channel the channel to serve
     * @param handler the handler invoked once per request
     * @return a subscription that unregisters the handler when closed
     * @throws IllegalArgumentException if the channel already has a handler
     * @throws IllegalStateException if the bus is closed
     */
    Subscription registerRequestHandler(String channel, RequestHandler handler);

    /**
     * Send a request and return the future reply.
     *
     * @param channel the channel of the handler
     * @param request the request
     * @return a future completed with the reply, or exceptionally if delivery or handling fails
     */
    CompletableFuture<Message> request(String channel, Request request);

    /**
     * Send a request and wait for the reply.
     *
     * @param channel the channel of the handler
     * @param request the request
     * @param timeout how long to wait for the reply
     * @return the reply
     * @throws BusException if no reply arrives in time or the request failed
     */
    Message request(String channel, Request request, Duration timeout) throws BusException;

    /**
     * Publish a message to all listeners of a channel.
     */
    void publish(String channel, Message message);

    /**
     * Listen to messages published on a channel.
     *
     * @return a subscription that removes the listener when closed
     */
    Subscription subscribe(String channel, Consumer<Message> listener);

    /**
     * Close the bus and release its dispatch threads.
     */
    @Override
    void close();
}
