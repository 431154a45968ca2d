package work.infraplan.hcl.shared;

import java.util.ArrayList;
import java.util.List;

public record PlanVars(List<String> vars, List<String> files) {
    public PlanVars {
        vars = vars == null ? List.of() : List.copyOf(vars);
        files = files == null ? List.of() : List.copyOf(files);
    }

    public static PlanVars empty() {
        return new PlanVars(List.of(), List.of());
    }

    /**
     * Appends explicit overrides after the current entries so they take precedence.
     */
    public PlanVars withOverrides(List<String> extraVars, List<String> extraFiles) {
        var mergedVars = new ArrayList<>(vars);
        if (extraVars != null) {
            mergedVars.addAll(extraVars);
        }
        var mergedFiles = new ArrayList<>(files);
        if (extraFiles != null) {
            mergedFiles.addAll(extraFiles);
        }
        return new PlanVars(mergedVars, mergedFiles);
    }
}
