package com.devicehub.manager.component;

import com.devicehub.bus.LocalMessageBus;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Test;
import org.slf4j.event.Level;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class HostedComponentTest {

    private final List<String> calls = new CopyOnWriteArrayList<>();

    private static ComponentContext context() {
        return new ComponentContext("sensor", "10.0.0.5", "sensor:10.0.0.5", new Signal(), new Signal(),
                Level.DEBUG, ConfigFactory.empty(), new LocalMessageBus());
    }

    class TracingComponent extends HostedComponent {
        private final boolean failStartUp;

        TracingComponent(ComponentContext context, boolean failStartUp) {
            super(context);
            this.failStartUp = failStartUp;
        }

        @Override
        protected void startUp() {
            calls.add("startUp");
            if (failStartUp) {
                throw new IllegalStateException("sensor offline");
            }
        }

        @Override
        protected void runUntilStopped() throws Exception {
            calls.add("run");
            super.runUntilStopped();
        }

        @Override
        protected void shutDown() {
            calls.add("shutDown");
        }
    }

    @Test
    void runsLifecycleUntilStopped() throws Exception {
        ComponentContext context = context();
        TracingComponent component = new TracingComponent(context, false);
        Thread thread = new Thread(component, "sensor");
        thread.start();

        assertTrue(context.getReadySignal().await(Duration.ofSeconds(2)));
        assertTrue(thread.isAlive());
        assertFalse(component.isStopRequested());

        context.getStopSignal().set();
        thread.join(2000);

        assertFalse(thread.isAlive());
        assertTrue(component.isStopRequested());
        assertEquals(List.of("startUp", "run", "shutDown"), calls);
    }

    @Test
    void failedStartUpNeverSignalsReadyButStillShutsDown() throws Exception {
        ComponentContext context = context();
        Thread thread = new Thread(new TracingComponent(context, true), "sensor");
        thread.start();
        thread.join(2000);

        assertFalse(thread.isAlive());
        assertFalse(context.getReadySignal().isSet());
        assertEquals(List.of("startUp", "shutDown"), calls);
    }

    @Test
    void defaultOutputChannelCombinesNameAndAddress() {
        ComponentClass componentClass = ComponentClass.of("sensor", ctx -> new TracingComponent(ctx, false));

        assertEquals("sensor:10.0.0.5", componentClass.getOutputChannel("10.0.0.5"));
        assertEquals(ComponentClass.DEFAULT_STARTUP_TIMEOUT, componentClass.getStartupTimeout());
    }
}
