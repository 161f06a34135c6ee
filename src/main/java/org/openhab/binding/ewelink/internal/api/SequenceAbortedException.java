package org.openhab.binding.ewelink.internal.api;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;
import org.openhab.binding.ewelink.internal.model.SwitchState;

/**
 * A step of a {@link SwitchSequence} failed and the remaining steps were not sent.
 */
@NonNullByDefault
public class SequenceAbortedException extends EWeLinkApiException {
    private static final long serialVersionUID = 1L;

    private final int failedStep;
    private final SwitchState attemptedState;
    private final @Nullable SwitchState lastCommandedState;

    /**
     * @param failedStep 1-based number of the step that failed
     * @param lastCommandedState state of the last step that succeeded, null if none did
     */
    public SequenceAbortedException(int failedStep, SwitchState attemptedState,
            @Nullable SwitchState lastCommandedState, EWeLinkApiException cause) {
        super(cause.getKind(),
                "Sequence aborted at step " + failedStep + " (" + attemptedState + "), last commanded state "
                        + lastCommandedState + ": " + cause.getMessage(),
                cause.getProviderCode(), cause.getProviderMessage(), cause);
        this.failedStep = failedStep;
        this.attemptedState = attemptedState;
        this.lastCommandedState = lastCommandedState;
    }

    public int getFailedStep() {
        return failedStep;
    }

    public SwitchState getAttemptedState() {
        return attemptedState;
    }

    public @Nullable SwitchState getLastCommandedState() {
        return lastCommandedState;
    }
}
