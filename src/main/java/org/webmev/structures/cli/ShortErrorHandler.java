package org.webmev.structures.cli;

import java.io.PrintWriter;
import java.io.UncheckedIOException;
import picocli.CommandLine;

/**
 * Reports failures that stopped a validation run (as opposed to documents that failed validation)
 * on one line, with their own exit code.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    /**
     * The run could not complete: unreadable catalogue, unreadable input, unexpected error.
     */
    static final int RUN_FAILED = 3;

    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        PrintWriter err = commandLine.getErr();
        err.println(commandLine.getColorScheme().errorText(describe(ex)));
        if (Boolean.getBoolean("mev.debug")) {
            ex.printStackTrace(err);
        }
        return RUN_FAILED;
    }

    static String describe(Throwable ex) {
        if (ex instanceof IllegalStateException) {
            // raised by the resource type catalogue loader
            return "Configuration error: " + message(ex);
        }
        if (ex instanceof UncheckedIOException) {
            return "Input error: " + message(ex);
        }
        return message(ex);
    }

    private static String message(Throwable ex) {
        String message = ex.getMessage();
        return message == null || message.isBlank() ? ex.getClass().getSimpleName() : message;
    }
}
