package io.github.yok.csvimporter.core;

/**
 * Asks whether a destructive plan may proceed.
 *
 * @author Yasuharu.Okawauchi
 */
@FunctionalInterface
public interface ReplaceConfirmation {

    /**
     * Confirmation that always proceeds.
     */
    ReplaceConfirmation ALWAYS = plan -> true;

    /**
     * Returns whether the plan may be executed.
     *
     * @param plan destructive plan
     * @return {@code true} to proceed
     */
    boolean confirm(ReconciledPlan plan);
}
