package io.github.dailies.runtime.reset;

/**
 * Outcome of one scheduler pass.
 *
 * @param evaluated candidates loaded for this tick
 * @param reset     tasks flipped back to incomplete
 * @param skipped   candidates whose recurrence could not be evaluated
 * @param failed    candidates whose update was rejected by the store
 * @param aborted   true when the candidate set could not be loaded at all
 */
public record TickReport(int evaluated, int reset, int skipped, int failed, boolean aborted) {

    public static TickReport abortedTick() {
        return new TickReport(0, 0, 0, 0, true);
    }
}
