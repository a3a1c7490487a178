package com.devicehub.manager;

import com.devicehub.bus.BusException;
import com.devicehub.bus.IgnoreRequestMessage;
import com.devicehub.bus.Message;
import com.devicehub.bus.MessageBus;
import com.devicehub.bus.StopRequest;
import com.devicehub.bus.SuccessMessage;
import com.devicehub.manager.message.NotStartedMessage;
import com.devicehub.manager.message.StartComponentRequest;
import com.devicehub.manager.message.StartedComponentInformation;
import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

import java.time.Duration;
import java.util.Objects;

/**
 * Requester side of the manager protocol.
 *
 * <pre>{@code
 * ComponentManagerClient client = new ComponentManagerClient(bus);
 * StartedComponentInformation info = client.startComponent("10.0.0.5", "echo", Level.INFO, conf);
 * bus.subscribe(info.getOutputChannel(), message -> ...);
 * }</pre>
 */
public class ComponentManagerClient {

    private static final Logger log = LoggerFactory.getLogger(ComponentManagerClient.class);

    public static final Duration DEFAULT_REPLY_TIMEOUT = Duration.ofSeconds(15);

    private final MessageBus bus;
    private final Duration replyTimeout;

    public ComponentManagerClient(MessageBus bus, Duration replyTimeout) {
        this.bus = Objects.requireNonNull(bus, "bus");
        this.replyTimeout = Objects.requireNonNull(replyTimeout, "replyTimeout");
    }

    public ComponentManagerClient(MessageBus bus) {
        this(bus, DEFAULT_REPLY_TIMEOUT);
    }

    /**
     * Ask the manager on a device to start a component.
     *
     * <p>The reply timeout should exceed the component's startup timeout, since the
     * manager only replies once the component is ready or has timed out.</p>
     *
     * @param deviceAddress the device whose manager should start the component
     * @param componentName the registered component name
     * @param logLevel the level the component should log at
     * @param conf configuration handed to the component, may be null
     * @return where the component publishes its output
     * @throws ComponentStartException if the manager did not start the component
     * @throws BusException if no reply arrived
     */
    public StartedComponentInformation startComponent(String deviceAddress, String componentName,
                                                      Level logLevel, Config conf) throws BusException {
        StartComponentRequest request = new StartComponentRequest(componentName, logLevel, conf);
        Message reply = bus.request(deviceAddress, request, replyTimeout);

        if (reply instanceof StartedComponentInformation information) {
            log.debug("Component {} on {} publishes to {}", componentName, deviceAddress,
                    information.getOutputChannel());
            return information;
        }
        if (reply instanceof NotStartedMessage notStarted) {
            throw new ComponentStartException(componentName,
                    "Component " + componentName + " could not be started on " + deviceAddress,
                    notStarted.getCause());
        }
        if (reply instanceof IgnoreRequestMessage) {
            throw new ComponentStartException(componentName,
                    "Manager on " + deviceAddress + " does not serve component " + componentName);
        }
        throw new ComponentStartException(componentName, "Unexpected reply " + reply);
    }

    public StartedComponentInformation startComponent(String deviceAddress, String componentName) throws BusException {
        return startComponent(deviceAddress, componentName, Level.INFO, null);
    }

    /**
     * Ask the manager on a device to stop.
     *
     * @return true if the manager acknowledged the request
     * @throws BusException if no reply arrived
     */
    public boolean requestStop(String deviceAddress) throws BusException {
        Message reply = bus.request(deviceAddress, new StopRequest(), replyTimeout);
        boolean acknowledged = reply instanceof SuccessMessage;
        if (!acknowledged) {
            log.warn("Manager on {} did not acknowledge stop: {}", deviceAddress, reply);
        }
        return acknowledged;
    }

    public Duration getReplyTimeout() {
        return replyTimeout;
    }
}
