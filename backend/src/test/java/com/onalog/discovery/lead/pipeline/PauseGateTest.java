package com.onalog.discovery.lead.pipeline;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class PauseGateTest {
    private final ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor();

    @AfterEach
    void tearDown() {
        timer.shutdownNow();
    }

    @Test
    void openGateDoesNotBlock() {
        PauseGate gate = new PauseGate(1L, timer, Duration.ofMinutes(5));

        assertThat(gate.isPaused()).isFalse();
        assertThat(gate.awaitIfPaused()).isTrue();
    }

    @Test
    void pausedGateHoldsWaiterUntilResume() throws Exception {
        PauseGate gate = new PauseGate(2L, timer, Duration.ofMinutes(5));
        gate.pause();
        CountDownLatch passed = new CountDownLatch(1);

        Thread waiter = new Thread(() -> {
            if (gate.awaitIfPaused()) {
                passed.countDown();
            }
        });
        waiter.start();

        assertThat(passed.await(200, TimeUnit.MILLISECONDS)).isFalse();
        gate.resume();
        assertThat(passed.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(gate.isPaused()).isFalse();
    }

    @Test
    void failsafeReopensForgottenPause() throws Exception {
        PauseGate gate = new PauseGate(3L, timer, Duration.ofMillis(100));
        gate.pause();

        CountDownLatch passed = new CountDownLatch(1);
        new Thread(() -> {
            gate.awaitIfPaused();
            passed.countDown();
        }).start();

        assertThat(passed.await(3, TimeUnit.SECONDS)).isTrue();
        assertThat(gate.isPaused()).isFalse();
    }

    @Test
    void interruptedWaiterGivesUp() throws Exception {
        PauseGate gate = new PauseGate(4L, timer, Duration.ofMinutes(5));
        gate.pause();
        boolean[] result = {true};

        Thread waiter = new Thread(() -> result[0] = gate.awaitIfPaused());
        waiter.start();
        Thread.sleep(100);
        waiter.interrupt();
        waiter.join(2000);

        assertThat(waiter.isAlive()).isFalse();
        assertThat(result[0]).isFalse();
        assertThat(gate.isPaused()).isTrue();
    }
}
