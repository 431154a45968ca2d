package work.infraplan.hcl.shared;

import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

/**
 * Extracts {@code -var} and {@code -var-file} values from a raw plan flags string such as
 * {@code -var='env=prod' -var-file=prod.tfvars -refresh=false}.
 *
 * <p>The string is split shell-style and the tokens are parsed with picocli, so both
 * {@code -flag=value} and {@code -flag value} forms are accepted, with one or two leading
 * dashes. Other tokens are ignored; a bare {@code --} ends flag processing.
 */
public final class VarFlagParser {
    private VarFlagParser() {}

    public static PlanVars parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return PlanVars.empty();
        }
        var flags = new VarFlags();
        try {
            new CommandLine(flags)
                .setExpandAtFiles(false)
                .parseArgs(tokenize(raw).toArray(new String[0]));
        } catch (CommandLine.MissingParameterException ex) {
            throw new VarFlagSyntaxException(missingArgumentMessage(ex), ex);
        } catch (CommandLine.ParameterException ex) {
            throw new VarFlagSyntaxException(ex.getMessage(), ex);
        }
        return new PlanVars(flags.vars, flags.files);
    }

    private static String missingArgumentMessage(CommandLine.MissingParameterException ex) {
        for (CommandLine.Model.ArgSpec missing : ex.getMissing()) {
            if (missing instanceof CommandLine.Model.OptionSpec option) {
                return "flag needs an argument: " + option.shortestName();
            }
        }
        return ex.getMessage();
    }

    @CommandLine.Command(name = "plan-flags")
    private static final class VarFlags {
        @CommandLine.Option(names = {"-var", "--var"})
        List<String> vars = new ArrayList<>();

        @CommandLine.Option(names = {"-var-file", "--var-file"})
        List<String> files = new ArrayList<>();

        // everything else a plan accepts (-refresh, -target, positional plan file, ...)
        @CommandLine.Unmatched
        List<String> ignored = new ArrayList<>();
    }

    /**
     * Splits on whitespace, honouring single quotes (literal) and double quotes (with
     * {@code \"} and {@code \\} escapes). Quotes are removed from the resulting tokens.
     */
    static List<String> tokenize(String raw) {
        var tokens = new ArrayList<String>();
        var current = new StringBuilder();
        boolean inToken = false;
        char quote = 0;
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (quote == '\'') {
                if (c == '\'') {
                    quote = 0;
                } else {
                    current.append(c);
                }
            } else if (quote == '"') {
                if (c == '"') {
                    quote = 0;
                } else if (c == '\\' && i + 1 < raw.length() && (raw.charAt(i + 1) == '"' || raw.charAt(i + 1) == '\\')) {
                    current.append(raw.charAt(++i));
                } else {
                    current.append(c);
                }
            } else if (Character.isWhitespace(c)) {
                if (inToken) {
                    tokens.add(current.toString());
                    current.setLength(0);
                    inToken = false;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
                inToken = true;
            } else {
                current.append(c);
                inToken = true;
            }
        }
        if (quote != 0) {
            throw new VarFlagSyntaxException("unterminated " + (quote == '"' ? "double" : "single") + " quote in plan flags: " + raw);
        }
        if (inToken) {
            tokens.add(current.toString());
        }
        return tokens;
    }
}
