package io.github.yok.csvimporter.core;

/**
 * Phases of one import run.
 *
 * <p>
 * A run moves forward only: {@code SAMPLING -> RECONCILING -> LOADING -> COMPLETED}. Any failure
 * moves it to {@code FAILED}. Terminal phases accept no further transition.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public enum ImportPhase {
    NEW, SAMPLING, RECONCILING, LOADING, COMPLETED, FAILED;

    /**
     * Returns whether a run in this phase may move to {@code next}.
     *
     * @param next requested phase
     * @return {@code true} if the transition is allowed
     */
    public boolean canMoveTo(ImportPhase next) {
        if (isTerminal()) {
            return false;
        }
        return next == FAILED || next.ordinal() == ordinal() + 1;
    }

    /**
     * Returns whether this phase is terminal.
     *
     * @return {@code true} for COMPLETED and FAILED
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
