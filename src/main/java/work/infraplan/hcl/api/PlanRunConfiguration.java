package work.infraplan.hcl.api;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable description of one project to synthesize a plan for.
 *
 * @param path configuration directory or tree file
 * @param planFlags raw plan flags, scanned for {@code -var} and {@code -var-file}
 * @param varFiles var files applied after those named in {@code planFlags}
 * @param vars {@code name=value} assignments applied after those named in {@code planFlags}
 */
public record PlanRunConfiguration(
    Path path,
    String planFlags,
    List<String> varFiles,
    List<String> vars,
    LogLevel logLevel
) {
    public PlanRunConfiguration {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(logLevel, "logLevel");
        planFlags = planFlags == null ? "" : planFlags;
        varFiles = varFiles == null ? List.of() : List.copyOf(varFiles);
        vars = vars == null ? List.of() : List.copyOf(vars);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path path;
        private String planFlags = "";
        private final List<String> varFiles = new ArrayList<>();
        private final List<String> vars = new ArrayList<>();
        private LogLevel logLevel = LogLevel.WARN;

        public Builder path(Path path) {
            this.path = path;
            return this;
        }

        public Builder planFlags(String planFlags) {
            this.planFlags = planFlags;
            return this;
        }

        public Builder varFiles(List<String> varFiles) {
            if (varFiles != null) {
                this.varFiles.addAll(varFiles);
            }
            return this;
        }

        public Builder varFile(String varFile) {
            this.varFiles.add(varFile);
            return this;
        }

        public Builder vars(List<String> vars) {
            if (vars != null) {
                this.vars.addAll(vars);
            }
            return this;
        }

        public Builder var(String assignment) {
            this.vars.add(assignment);
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public PlanRunConfiguration build() {
            return new PlanRunConfiguration(path, planFlags, varFiles, vars, logLevel);
        }
    }
}
