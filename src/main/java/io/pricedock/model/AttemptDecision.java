package io.pricedock.model;

/**
 * Outcome of the blocking check. {@code blocker} is the newest run that caused the
 * action and is {@code null} for {@link AttemptAction#START}.
 */
public record AttemptDecision(AttemptAction action, ImportRun blocker) {
    public static AttemptDecision start() {
        return new AttemptDecision(AttemptAction.START, null);
    }

    public String describe() {
        if (blocker == null) {
            return action.name();
        }
        return action.name() + ": " + blocker.describe();
    }
}
