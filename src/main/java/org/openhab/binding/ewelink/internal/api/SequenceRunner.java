package org.openhab.binding.ewelink.internal.api;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;
import org.openhab.binding.ewelink.internal.model.SwitchState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Plays a {@link SwitchSequence} on one device. A step is only sent after the previous one succeeded and the
 * sequence delay has passed. {@link #cancel()} stops the run before the next step; it may be called from any
 * thread. A runner plays one sequence only.
 */
@NonNullByDefault
public class SequenceRunner {
    private final Logger logger = Objects.requireNonNull(LoggerFactory.getLogger(SequenceRunner.class));

    private final SwitchCommandTarget target;
    private final CountDownLatch cancelled = new CountDownLatch(1);

    public SequenceRunner(SwitchCommandTarget target) {
        this.target = Objects.requireNonNull(target, "target");
    }

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * @return how far the sequence got; only a cancelled run ends before the last step
     * @throws SequenceAbortedException if a step failed
     */
    public Outcome run(String deviceId, SwitchSequence sequence) throws SequenceAbortedException {
        List<SwitchState> steps = sequence.getSteps();
        long delayMillis = sequence.getDelay().toMillis();
        SwitchState last = null;
        for (int i = 0; i < steps.size(); i++) {
            if (i > 0 && waitOrCancelled(delayMillis)) {
                logger.debug("Sequence on {} cancelled after {} of {} steps", deviceId, i, steps.size());
                return new Outcome(i, last, true);
            }
            if (isCancelled()) {
                return new Outcome(i, last, true);
            }
            SwitchState step = steps.get(i);
            try {
                target.setState(deviceId, step);
            } catch (EWeLinkApiException e) {
                throw new SequenceAbortedException(i + 1, step, last, e);
            }
            last = step;
        }
        return new Outcome(steps.size(), last, false);
    }

    private boolean waitOrCancelled(long delayMillis) {
        try {
            return cancelled.await(delayMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            return true;
        }
    }

    /**
     * Result of a run that was not aborted by a failure.
     */
    public static final class Outcome {
        private final int completedSteps;
        private final @Nullable SwitchState lastCommandedState;
        private final boolean cancelled;

        Outcome(int completedSteps, @Nullable SwitchState lastCommandedState, boolean cancelled) {
            this.completedSteps = completedSteps;
            this.lastCommandedState = lastCommandedState;
            this.cancelled = cancelled;
        }

        public int getCompletedSteps() {
            return completedSteps;
        }

        public @Nullable SwitchState getLastCommandedState() {
            return lastCommandedState;
        }

        public boolean isCancelled() {
            return cancelled;
        }
    }
}
