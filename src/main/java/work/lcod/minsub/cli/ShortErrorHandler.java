package work.lcod.minsub.cli;

import picocli.CommandLine;
import work.lcod.minsub.errors.MinsubException;

/**
 * Keeps CLI failures short and focused on the root cause.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    static final int VALIDATION_EXIT_CODE = 2;

    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            message = ex.getClass().getSimpleName();
        }
        commandLine.getErr().println(commandLine.getColorScheme().errorText(message));
        if (Boolean.getBoolean("minsub.debug")) {
            ex.printStackTrace(commandLine.getErr());
        }
        if (ex instanceof MinsubException) {
            return VALIDATION_EXIT_CODE;
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }
}
