package work.infraplan.hcl.config;

import java.util.List;

/**
 * Variable inputs for a parser. Later entries win when they set the same variable.
 *
 * @param varFiles variable file paths, in precedence order
 * @param inputVars {@code name=value} assignments, in precedence order
 */
public record ParserOptions(List<String> varFiles, List<String> inputVars) {
    public ParserOptions {
        varFiles = varFiles == null ? List.of() : List.copyOf(varFiles);
        inputVars = inputVars == null ? List.of() : List.copyOf(inputVars);
    }

    public static ParserOptions none() {
        return new ParserOptions(List.of(), List.of());
    }
}
