package work.infraplan.hcl.plan;

import java.util.List;

/**
 * Raised when a module tree loops back on itself or nests deeper than the walker allows.
 */
public final class ModuleCycleException extends PlanSynthesisException {
    private final List<String> path;

    public ModuleCycleException(String message, List<String> path) {
        super(message + ": " + String.join(" -> ", path));
        this.path = List.copyOf(path);
    }

    public List<String> path() {
        return path;
    }
}
