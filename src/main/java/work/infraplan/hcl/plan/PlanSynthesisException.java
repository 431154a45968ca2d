package work.infraplan.hcl.plan;

public class PlanSynthesisException extends RuntimeException {
    public PlanSynthesisException(String message) {
        super(message);
    }

    public PlanSynthesisException(String message, Throwable cause) {
        super(message, cause);
    }
}
