package com.devicehub.bus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * In-process {@link MessageBus}.
 *
 * <p>Each registered request handler gets its own single-threaded dispatcher, so the
 * requests sent to one channel are handled one at a time and answered in delivery
 * order. Published messages are delivered synchronously on the publishing thread;
 * a failing listener is logged and does not affect the other listeners.</p>
 */
public class LocalMessageBus implements MessageBus {

    private static final Logger log = LoggerFactory.getLogger(LocalMessageBus.class);

    private static final long CLOSE_TIMEOUT_MS = 1000;

    private final String name;
    private final ConcurrentHashMap<String, HandlerRegistration> handlers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, List<Consumer<Message>>> listeners = new ConcurrentHashMap<>();
    private final AtomicLong requestIds = new AtomicLong();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public LocalMessageBus(String name) {
        this.name = name;
    }

    public LocalMessageBus() {
        this("local-bus");
    }

    @Override
    public Subscription registerRequestHandler(String channel, RequestHandler handler) {
        if (closed.get()) {
            throw new IllegalStateException("Message bus is closed: " + name);
        }

        ExecutorService dispatcher = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "bus-" + channel);
            t.setDaemon(true);
            return t;
        });
        HandlerRegistration registration = new HandlerRegistration(channel, handler, dispatcher);

        if (handlers.putIfAbsent(channel, registration) != null) {
            dispatcher.shutdown();
            throw new IllegalArgumentException("Request handler already registered on channel: " + channel);
        }

        log.debug("[{}] Registered request handler on channel {}", name, channel);
        return registration;
    }

    @Override
    public CompletableFuture<Message> request(String channel, Request request) {
        CompletableFuture<Message> reply = new CompletableFuture<>();

        if (closed.get()) {
            reply.completeExceptionally(new BusException("Message bus is closed: " + name));
            return reply;
        }

        HandlerRegistration registration = handlers.get(channel);
        if (registration == null) {
            reply.completeExceptionally(new BusException("No request handler on channel: " + channel));
            return reply;
        }

        long requestId = requestIds.incrementAndGet();
        request.setRequestId(requestId);

        try {
            registration.dispatcher.execute(() -> dispatch(registration, request, requestId, reply));
        } catch (RejectedExecutionException e) {
            reply.completeExceptionally(new BusException("Request handler on channel " + channel + " is closed", e));
        }
        return reply;
    }

    @Override
    public Message request(String channel, Request request, Duration timeout) throws BusException {
        CompletableFuture<Message> future = request(channel, request);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(false);
            throw new BusException("No reply on channel " + channel + " within " + timeout.toMillis() + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof BusException busException) {
                throw busException;
            }
            throw new BusException("Request on channel " + channel + " failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BusException("Interrupted while waiting for reply on channel " + channel, e);
        }
    }

    @Override
    public void publish(String channel, Message message) {
        List<Consumer<Message>> channelListeners = listeners.get(channel);
        if (channelListeners == null) {
            return;
        }
        for (Consumer<Message> listener : channelListeners) {
            try {
                listener.accept(message);
            } catch (Exception e) {
                log.error("[{}] Listener on channel {} failed", name, channel, e);
            }
        }
    }

    @Override
    public Subscription subscribe(String channel, Consumer<Message> listener) {
        listeners.computeIfAbsent(channel, k -> new CopyOnWriteArrayList<>()).add(listener);
        return new Subscription() {
            @Override
            public String getChannel() {
                return channel;
            }

            @Override
            public void close() {
                List<Consumer<Message>> channelListeners = listeners.get(channel);
                if (channelListeners != null) {
                    channelListeners.remove(listener);
                }
            }
        };
    }

    /**
     * Check whether a request handler is registered on the channel.
     */
    public boolean hasRequestHandler(String channel) {
        return handlers.containsKey(channel);
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }

        List<HandlerRegistration> registrations = List.copyOf(handlers.values());
        log.info("[{}] Closing message bus ({} request handlers)", name, registrations.size());
        for (HandlerRegistration registration : registrations) {
            registration.close();
        }
        for (HandlerRegistration registration : registrations) {
            registration.awaitTermination();
        }
        handlers.clear();
        listeners.clear();
    }

    private void dispatch(HandlerRegistration registration, Request request, long requestId,
                          CompletableFuture<Message> reply) {
        try {
            Message response = registration.handler.handle(registration.channel, request);
            if (response == null) {
                reply.completeExceptionally(new BusException(
                        "Request handler on channel " + registration.channel + " returned no reply"));
                return;
            }
            response.setRequestId(requestId);
            reply.complete(response);
        } catch (Exception | LinkageError e) {
            log.debug("[{}] Request handler on channel {} failed", name, registration.channel, e);
            reply.completeExceptionally(e);
        }
    }

    private final class HandlerRegistration implements Subscription {
        private final String channel;
        private final RequestHandler handler;
        private final ExecutorService dispatcher;

        private HandlerRegistration(String channel, RequestHandler handler, ExecutorService dispatcher) {
            this.channel = channel;
            this.handler = handler;
            this.dispatcher = dispatcher;
        }

        @Override
        public String getChannel() {
            return channel;
        }

        @Override
        public void close() {
            // Requests already queued are still answered
            handlers.remove(channel, this);
            dispatcher.shutdown();
        }

        private void awaitTermination() {
            try {
                if (!dispatcher.awaitTermination(CLOSE_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                    log.warn("[{}] Dispatcher for channel {} did not terminate within {}ms",
                            name, channel, CLOSE_TIMEOUT_MS);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
