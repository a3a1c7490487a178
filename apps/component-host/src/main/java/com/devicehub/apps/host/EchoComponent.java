package com.devicehub.apps.host;

import com.devicehub.bus.Message;
import com.devicehub.bus.Subscription;
import com.devicehub.manager.component.ComponentContext;
import com.devicehub.manager.component.HostedComponent;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Republishes every message received on {@code <outputChannel>:input} onto its output channel.
 */
public class EchoComponent extends HostedComponent {

    public static final String INPUT_SUFFIX = ":input";

    private final AtomicLong echoed = new AtomicLong();
    private volatile Subscription input;

    public EchoComponent(ComponentContext context) {
        super(context);
    }

    /**
     * Get the channel this component listens on.
     */
    public static String inputChannel(String outputChannel) {
        return outputChannel + INPUT_SUFFIX;
    }

    @Override
    protected void startUp() {
        String channel = inputChannel(getContext().getOutputChannel());
        input = getContext().getBus().subscribe(channel, this::echo);
        logger.debug("[{}] Listening on {}", getName(), channel);
    }

    private void echo(Message message) {
        if (isStopRequested()) {
            return;
        }
        publish(message);
        echoed.incrementAndGet();
    }

    @Override
    protected void shutDown() {
        Subscription current = input;
        if (current != null) {
            current.close();
        }
        logger.info("[{}] Echoed {} messages", getName(), echoed.get());
    }

    public long getEchoedCount() {
        return echoed.get();
    }
}
