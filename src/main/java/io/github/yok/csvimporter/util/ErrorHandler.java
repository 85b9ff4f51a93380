package io.github.yok.csvimporter.util;

import io.github.yok.csvimporter.core.LoadAbortedException;
import io.github.yok.csvimporter.core.LoadSummary;
import lombok.Generated;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Reports a fatal import error: logs it with its stack trace and echoes a concise message to
 * {@code System.err}.
 *
 * <p>
 * The JVM is not terminated here; {@code Main} turns the reported failure into a non-zero exit
 * code. In tests, the current thread can be switched to throwing {@link IllegalStateException}
 * instead of printing.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class ErrorHandler {

    /**
     * Exit code of a failed import.
     */
    public static final int EXIT_FAILURE = 1;

    private static final ThreadLocal<Boolean> EXIT_DISABLED =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    @Generated
    private ErrorHandler() {}

    /**
     * Switch to "throw exception instead of reporting" for the current thread (useful for tests).
     */
    public static void disableExitForCurrentThread() {
        EXIT_DISABLED.set(Boolean.TRUE);
    }

    /**
     * Restore normal behavior for the current thread.
     */
    public static void restoreExitForCurrentThread() {
        EXIT_DISABLED.remove();
    }

    /**
     * Logs the message and cause at error level and prints a concise message to
     * {@code System.err}.
     *
     * <p>
     * For a {@link LoadAbortedException} the concise message also states how many rows had been
     * committed before the load stopped.
     * </p>
     *
     * @param message message to log
     * @param cause root cause
     * @return {@link #EXIT_FAILURE}
     * @throws IllegalStateException if reporting is disabled for the current thread
     */
    public static int errorAndExit(String message, Throwable cause) {
        log.error("{}\n{}", message, ExceptionUtils.getStackTrace(cause));
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message, cause);
        }
        System.err.println("ERROR: " + message + "\n" + describe(cause));
        return EXIT_FAILURE;
    }

    /**
     * Builds the one-line description printed for a failure.
     *
     * @param cause failure
     * @return root cause message, extended with the committed row count for aborted loads
     */
    static String describe(Throwable cause) {
        String rootCause = ExceptionUtils.getRootCauseMessage(cause);
        if (cause instanceof LoadAbortedException) {
            LoadSummary summary = ((LoadAbortedException) cause).getSummary();
            if (summary != null) {
                return rootCause + " (" + summary.getInsertedRows()
                        + " rows committed before the failure)";
            }
        }
        return rootCause;
    }
}
