package com.devicehub.manager;

import com.devicehub.bus.LocalMessageBus;
import com.devicehub.bus.Message;
import com.devicehub.manager.ManagerFixtures.IdleComponent;
import com.devicehub.manager.ManagerFixtures.RecordingListener;
import com.devicehub.manager.component.ComponentClass;
import com.devicehub.manager.message.NotStartedMessage;
import com.devicehub.manager.message.StartComponentRequest;
import com.devicehub.manager.message.StartedComponentInformation;
import com.devicehub.manager.registry.ComponentRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests that a singleton manager launches each component at most once and answers
 * later requests from its cache.
 */
class SingletonComponentManagerTest {

    private static final String DEVICE = "10.0.0.5";

    private LocalMessageBus bus;
    private RecordingListener listener;
    private SingletonComponentManager manager;
    private AtomicInteger echoLaunches;
    private AtomicInteger cameraAttempts;

    @BeforeEach
    void setUp() {
        bus = new LocalMessageBus("test-bus");
        listener = new RecordingListener();
        echoLaunches = new AtomicInteger();
        cameraAttempts = new AtomicInteger();

        ComponentRegistry registry = ComponentRegistry.of(
                ComponentClass.of("echo", context -> {
                    echoLaunches.incrementAndGet();
                    return new IdleComponent(context);
                }),
                ComponentClass.of("motor", IdleComponent::new),
                ComponentClass.of("camera", context -> {
                    // First attempt fails, later ones succeed
                    if (cameraAttempts.incrementAndGet() == 1) {
                        throw new IllegalStateException("camera busy");
                    }
                    return new IdleComponent(context);
                }));

        ManagerConfig config = ManagerConfig.builder()
                .singleton(true)
                .pollInterval(Duration.ofMillis(20))
                .shutdownGracePeriod(Duration.ofSeconds(1))
                .build();
        manager = new SingletonComponentManager(registry, bus, DEVICE, config);
        manager.addListener(listener);
    }

    @AfterEach
    void tearDown() {
        manager.shutdown();
        bus.close();
    }

    @Test
    void repeatedStartsShareOneInstance() {
        Message first = manager.handleRequest(new StartComponentRequest("echo"));
        Message second = manager.handleRequest(new StartComponentRequest("echo"));

        StartedComponentInformation firstInfo = assertInstanceOf(StartedComponentInformation.class, first);
        StartedComponentInformation secondInfo = assertInstanceOf(StartedComponentInformation.class, second);

        assertEquals("echo:" + DEVICE, firstInfo.getOutputChannel());
        assertEquals(firstInfo.getOutputChannel(), secondInfo.getOutputChannel());
        assertTrue(firstInfo.isSingleton());
        assertTrue(secondInfo.isSingleton());
        assertNotSame(firstInfo, secondInfo, "Every requester gets its own reply object");

        assertEquals(1, echoLaunches.get());
        assertEquals(1, manager.getActiveComponentCount());
        assertEquals(List.of("echo"), listener.started);
        assertEquals(List.of("echo"), listener.reused);
    }

    @Test
    void repliesOverBusCarryTheirOwnRequestIds() throws Exception {
        manager.initialize();

        StartComponentRequest firstRequest = new StartComponentRequest("echo");
        StartComponentRequest secondRequest = new StartComponentRequest("echo");
        Message first = bus.request(DEVICE, firstRequest, Duration.ofSeconds(2));
        Message second = bus.request(DEVICE, secondRequest, Duration.ofSeconds(2));

        assertEquals(firstRequest.getRequestId(), first.getRequestId());
        assertEquals(secondRequest.getRequestId(), second.getRequestId());
        assertNotEquals(first.getRequestId(), second.getRequestId());
        assertNull(manager.getCachedComponents().get("echo").getRequestId(),
                "Cached reply is never sent itself");
    }

    @Test
    void differentComponentsAreCachedSeparately() {
        StartedComponentInformation echo = (StartedComponentInformation) manager.handleRequest(new StartComponentRequest("echo"));
        StartedComponentInformation motor = (StartedComponentInformation) manager.handleRequest(new StartComponentRequest("motor"));

        assertEquals("echo:" + DEVICE, echo.getOutputChannel());
        assertEquals("motor:" + DEVICE, motor.getOutputChannel());
        assertEquals(2, manager.getActiveComponentCount());
        assertTrue(manager.isCached("echo"));
        assertTrue(manager.isCached("motor"));
        assertEquals(2, manager.getCachedComponents().size());
        assertEquals("echo:" + DEVICE, manager.getCachedComponents().get("echo").getOutputChannel());
    }

    @Test
    void failedStartIsNotCached() {
        Message first = manager.handleRequest(new StartComponentRequest("camera"));
        assertInstanceOf(NotStartedMessage.class, first);
        assertFalse(manager.isCached("camera"));

        Message second = manager.handleRequest(new StartComponentRequest("camera"));
        StartedComponentInformation info = assertInstanceOf(StartedComponentInformation.class, second);
        assertTrue(info.isSingleton());
        assertEquals(2, cameraAttempts.get());
        assertTrue(manager.isCached("camera"));
    }

    @Test
    void unknownComponentIsIgnoredAndNotCached() {
        StartOutcome outcome = manager.startComponent(new StartComponentRequest("lidar"));

        assertEquals(StartOutcome.Kind.IGNORED, outcome.kind());
        assertFalse(manager.isCached("lidar"));
        assertTrue(manager.getCachedComponents().isEmpty());
    }

    @Test
    void concurrentFirstStartsLaunchOnce() throws Exception {
        int requesters = 8;
        ExecutorService executor = Executors.newFixedThreadPool(requesters);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<StartOutcome>> outcomes = new ArrayList<>();
            for (int i = 0; i < requesters; i++) {
                outcomes.add(executor.submit(() -> {
                    go.await();
                    return manager.startComponent(new StartComponentRequest("echo"));
                }));
            }
            go.countDown();

            for (Future<StartOutcome> outcome : outcomes) {
                StartOutcome result = outcome.get(5, TimeUnit.SECONDS);
                assertEquals(StartOutcome.Kind.STARTED, result.kind());
                assertEquals("echo:" + DEVICE, ((StartOutcome.Started) result).information().getOutputChannel());
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, echoLaunches.get());
        assertEquals(1, manager.getActiveComponentCount());
        assertEquals(requesters - 1, listener.reused.size());
    }

    @Test
    void noReuseAfterShutdown() {
        manager.handleRequest(new StartComponentRequest("echo"));
        manager.shutdown();

        assertEquals(StartOutcome.Kind.IGNORED, manager.startComponent(new StartComponentRequest("echo")).kind());
        assertEquals(1, echoLaunches.get());
    }
}
