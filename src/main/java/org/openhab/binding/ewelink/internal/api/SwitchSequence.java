package org.openhab.binding.ewelink.internal.api;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.openhab.binding.ewelink.internal.model.SwitchState;

/**
 * An ordered list of switch states with a fixed pause between consecutive steps.
 */
@NonNullByDefault
public final class SwitchSequence {
    public static final int DEFAULT_BLINK_CYCLES = 3;
    public static final Duration DEFAULT_BLINK_DELAY = Duration.ofSeconds(1);

    private final List<SwitchState> steps;
    private final Duration delay;

    public SwitchSequence(List<SwitchState> steps, Duration delay) {
        if (steps.isEmpty()) {
            throw new IllegalArgumentException("A sequence needs at least one step");
        }
        if (delay.isNegative()) {
            throw new IllegalArgumentException("Delay must not be negative");
        }
        this.steps = List.copyOf(steps);
        this.delay = Objects.requireNonNull(delay, "delay");
    }

    /**
     * ON, OFF repeated {@code cycles} times, then a final ON.
     */
    public static SwitchSequence blink(int cycles, Duration delay) {
        if (cycles < 1) {
            throw new IllegalArgumentException("cycles must be at least 1");
        }
        List<SwitchState> steps = new ArrayList<>(cycles * 2 + 1);
        for (int i = 0; i < cycles; i++) {
            steps.add(SwitchState.ON);
            steps.add(SwitchState.OFF);
        }
        steps.add(SwitchState.ON);
        return new SwitchSequence(steps, delay);
    }

    public static SwitchSequence blink() {
        return blink(DEFAULT_BLINK_CYCLES, DEFAULT_BLINK_DELAY);
    }

    public List<SwitchState> getSteps() {
        return steps;
    }

    public Duration getDelay() {
        return delay;
    }

    public int size() {
        return steps.size();
    }

    @Override
    public String toString() {
        return "SwitchSequence" + steps + " every " + delay.toMillis() + "ms";
    }
}
