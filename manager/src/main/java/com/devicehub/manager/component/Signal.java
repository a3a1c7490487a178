package com.devicehub.manager.component;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot flag shared between a component and its manager.
 *
 * <p>Once set, a signal stays set. Used as the ready signal (set by a component once it
 * accepts input) and the stop signal (set by the manager to request cooperative termination).</p>
 */
public final class Signal {

    private final CountDownLatch latch = new CountDownLatch(1);

    /**
     * Set the signal, releasing all current and future waiters.
     */
    public void set() {
        latch.countDown();
    }

    public boolean isSet() {
        return latch.getCount() == 0;
    }

    /**
     * Wait until the signal is set or the timeout elapses.
     *
     * @param timeout the maximum time to wait
     * @return true if the signal is set
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return latch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * Wait until the signal is set.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    public void await() throws InterruptedException {
        latch.await();
    }

    @Override
    public String toString() {
        return "Signal{set=" + isSet() + "}";
    }
}
