package work.infraplan.hcl.shared;

public final class VarFlagSyntaxException extends IllegalArgumentException {
    public VarFlagSyntaxException(String message) {
        super(message);
    }

    public VarFlagSyntaxException(String message, Throwable cause) {
        super(message, cause);
    }
}
