package work.infraplan.hcl.cli;

import picocli.CommandLine;
import work.infraplan.hcl.config.ConfigParseException;
import work.infraplan.hcl.plan.ModuleCycleException;
import work.infraplan.hcl.plan.PlanSynthesisException;

/**
 * Prints one line per failure, prefixed with the stage that failed. Stack traces only with
 * {@code -Dinfraplan.debug=true}.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    static final String DEBUG_PROPERTY = "infraplan.debug";

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
        commandLine.getErr().println(commandLine.getColorScheme().errorText(stage(ex) + message));
        if (Boolean.getBoolean(DEBUG_PROPERTY)) {
            ex.printStackTrace(commandLine.getErr());
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }

    static String stage(Exception ex) {
        if (ex instanceof ConfigParseException) {
            return "configuration error: ";
        }
        if (ex instanceof ModuleCycleException) {
            return "module tree error: ";
        }
        if (ex instanceof PlanSynthesisException) {
            return "plan error: ";
        }
        return "";
    }
}
