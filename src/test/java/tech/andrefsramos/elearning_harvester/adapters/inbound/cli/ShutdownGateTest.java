package tech.andrefsramos.elearning_harvester.adapters.inbound.cli;

import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class ShutdownGateTest {

    @Test
    void hook_cancels_the_run_and_waits_until_released() throws Exception {
        ShutdownGate gate = new ShutdownGate(10_000);
        Thread hook = new Thread(gate::onShutdown, "harvest-shutdown-test");

        hook.start();
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!gate.signal().isCancelled() && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
        assertTrue(gate.signal().isCancelled());

        hook.join(200);
        assertTrue(hook.isAlive(), "hook deve aguardar a gravação do CSV");

        gate.release();
        hook.join(5_000);
        assertFalse(hook.isAlive());
        assertTrue(gate.isReleased());
    }

    @Test
    void hook_gives_up_after_the_wait_budget() throws Exception {
        ShutdownGate gate = new ShutdownGate(100);
        Thread hook = new Thread(gate::onShutdown, "harvest-shutdown-test");

        long start = System.nanoTime();
        hook.start();
        hook.join(5_000);

        assertFalse(hook.isAlive());
        assertTrue(gate.signal().isCancelled());
        assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) >= 100);
        assertFalse(gate.isReleased());
    }

    @Test
    void release_before_shutdown_lets_the_hook_return_immediately() {
        ShutdownGate gate = new ShutdownGate(10_000);
        gate.release();

        assertTimeoutPreemptively(java.time.Duration.ofSeconds(2), gate::onShutdown);
        assertTrue(gate.signal().isCancelled());
    }
}
