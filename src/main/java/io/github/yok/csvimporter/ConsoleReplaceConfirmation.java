package io.github.yok.csvimporter;

import io.github.yok.csvimporter.core.ReconciledPlan;
import io.github.yok.csvimporter.core.ReplaceConfirmation;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.Locale;

/**
 * Asks on the console before an existing table is dropped. Only {@code y} or {@code yes} proceeds.
 *
 * @author Yasuharu.Okawauchi
 */
public class ConsoleReplaceConfirmation implements ReplaceConfirmation {

    private final BufferedReader in;
    private final PrintStream out;

    /**
     * Creates a confirmation over the given console streams.
     *
     * @param in answers
     * @param out prompt output
     */
    public ConsoleReplaceConfirmation(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    @Override
    public boolean confirm(ReconciledPlan plan) {
        out.print("Table " + plan.getQualifiedName()
                + " exists and will be dropped with all its rows. Continue? [y/N]: ");
        out.flush();
        try {
            String answer = in.readLine();
            if (answer == null) {
                return false;
            }
            String normalized = answer.trim().toLowerCase(Locale.ROOT);
            return "y".equals(normalized) || "yes".equals(normalized);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read confirmation", e);
        }
    }
}
