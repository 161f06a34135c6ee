package org.openhab.binding.ewelink.internal.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.junit.jupiter.api.Test;
import org.openhab.binding.ewelink.internal.model.SwitchState;

/**
 * Tests for {@link SwitchSequence} and {@link SequenceRunner}.
 */
@NonNullByDefault
@SuppressWarnings("null")
class SequenceRunnerTest {

    private static final SwitchState ON = SwitchState.ON;
    private static final SwitchState OFF = SwitchState.OFF;

    private final List<SwitchState> sent = Collections.synchronizedList(new ArrayList<>());
    private final List<Long> sentAt = Collections.synchronizedList(new ArrayList<>());

    private void remember(String deviceId, SwitchState state) {
        sent.add(state);
        sentAt.add(System.nanoTime());
    }

    @Test
    void blinkAlternatesAndEndsOn() {
        SwitchSequence sequence = SwitchSequence.blink();

        assertEquals(List.of(ON, OFF, ON, OFF, ON, OFF, ON), sequence.getSteps());
        assertEquals(Duration.ofSeconds(1), sequence.getDelay());
        assertEquals(3, SwitchSequence.blink(1, Duration.ZERO).size());
        assertThrows(IllegalArgumentException.class, () -> SwitchSequence.blink(0, Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> new SwitchSequence(List.of(), Duration.ZERO));
    }

    @Test
    void stepsAreSentInOrderWithTheDelayBetweenThem() throws Exception {
        Duration delay = Duration.ofMillis(40);

        SequenceRunner.Outcome outcome = new SequenceRunner(this::remember).run("dev", SwitchSequence.blink(3, delay));

        assertEquals(List.of(ON, OFF, ON, OFF, ON, OFF, ON), sent);
        assertEquals(7, outcome.getCompletedSteps());
        assertEquals(ON, outcome.getLastCommandedState());
        assertFalse(outcome.isCancelled());
        for (int i = 1; i < sentAt.size(); i++) {
            long gapMillis = TimeUnit.NANOSECONDS.toMillis(sentAt.get(i) - sentAt.get(i - 1));
            assertTrue(gapMillis >= delay.toMillis(), "gap " + i + " was " + gapMillis + "ms");
        }
    }

    @Test
    void failedStepAbortsTheRemainingSteps() {
        SwitchCommandTarget failingAtFourthStep = (deviceId, state) -> {
            if (sent.size() == 3) {
                sent.add(state);
                throw new EWeLinkApiException(ErrorKind.DEVICE_COMMAND_REJECTED, "device offline", 4002,
                        "device offline");
            }
            sent.add(state);
        };

        SequenceAbortedException e = assertThrows(SequenceAbortedException.class,
                () -> new SequenceRunner(failingAtFourthStep).run("dev", SwitchSequence.blink(3, Duration.ZERO)));

        assertEquals(4, e.getFailedStep());
        assertEquals(OFF, e.getAttemptedState());
        assertEquals(ON, e.getLastCommandedState());
        assertEquals(ErrorKind.DEVICE_COMMAND_REJECTED, e.getKind());
        assertEquals("device offline", e.getProviderMessage());
        assertEquals(4, sent.size());
    }

    @Test
    void failingFirstStepHasNoLastCommandedState() {
        SequenceAbortedException e = assertThrows(SequenceAbortedException.class,
                () -> new SequenceRunner((deviceId, state) -> {
                    throw new EWeLinkApiException(ErrorKind.NETWORK_UNAVAILABLE, "down");
                }).run("dev", SwitchSequence.blink()));

        assertEquals(1, e.getFailedStep());
        assertEquals(null, e.getLastCommandedState());
        assertEquals(ErrorKind.NETWORK_UNAVAILABLE, e.getKind());
    }

    @Test
    void cancelFromAnotherThreadStopsBeforeTheNextStep() throws Exception {
        CountDownLatch firstSent = new CountDownLatch(1);
        SequenceRunner runner = new SequenceRunner((deviceId, state) -> {
            remember(deviceId, state);
            firstSent.countDown();
        });
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<SequenceRunner.Outcome> result = executor
                    .submit(() -> runner.run("dev", SwitchSequence.blink(3, Duration.ofSeconds(10))));
            assertTrue(firstSent.await(5, TimeUnit.SECONDS));

            runner.cancel();
            SequenceRunner.Outcome outcome = result.get(5, TimeUnit.SECONDS);

            assertTrue(outcome.isCancelled());
            assertEquals(1, outcome.getCompletedSteps());
            assertEquals(ON, outcome.getLastCommandedState());
            assertEquals(List.of(ON), sent);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void cancelledRunnerSendsNothing() throws Exception {
        SequenceRunner runner = new SequenceRunner(this::remember);
        runner.cancel();

        SequenceRunner.Outcome outcome = runner.run("dev", SwitchSequence.blink(2, Duration.ZERO));

        assertTrue(runner.isCancelled());
        assertTrue(outcome.isCancelled());
        assertEquals(0, outcome.getCompletedSteps());
        assertTrue(sent.isEmpty());
    }
}
