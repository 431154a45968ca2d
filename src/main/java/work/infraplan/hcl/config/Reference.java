package work.infraplan.hcl.config;

import java.util.List;
import java.util.Objects;

/**
 * A symbolic pointer from an attribute to another configuration address.
 *
 * <p>The canonical rendering ({@link #toString()}) spells variables as {@code variable.<name>};
 * {@link #jsonString()} uses the {@code var.<name>} form found in plan documents. Everything
 * else renders identically in both forms.
 */
public final class Reference {
    private static final String VARIABLE_PREFIX = "variable";
    private static final String VAR_PREFIX = "var";

    private final Kind kind;
    private final List<String> segments;

    private Reference(Kind kind, List<String> segments) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.segments = List.copyOf(segments);
    }

    public static Reference parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("reference must not be blank");
        }
        String[] parts = text.trim().split("\\.");
        for (String part : parts) {
            if (part.isEmpty()) {
                throw new IllegalArgumentException("Malformed reference: " + text);
            }
        }
        Kind kind = Kind.fromPrefix(parts[0]);
        List<String> rest = kind == Kind.RESOURCE
            ? List.of(parts)
            : List.of(parts).subList(1, parts.length);
        if (rest.isEmpty()) {
            throw new IllegalArgumentException("Reference has no target: " + text);
        }
        return new Reference(kind, rest);
    }

    public Kind kind() {
        return kind;
    }

    public List<String> segments() {
        return segments;
    }

    public boolean isVariable() {
        return kind == Kind.VARIABLE;
    }

    public String target() {
        return segments.get(0);
    }

    public String jsonString() {
        return render(kind == Kind.VARIABLE ? VAR_PREFIX : kind.prefix);
    }

    @Override
    public String toString() {
        return render(kind.prefix);
    }

    private String render(String prefix) {
        String path = String.join(".", segments);
        return prefix == null ? path : prefix + "." + path;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Reference that)) {
            return false;
        }
        return kind == that.kind && segments.equals(that.segments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, segments);
    }

    public enum Kind {
        VARIABLE(VARIABLE_PREFIX),
        LOCAL("local"),
        MODULE("module"),
        DATA("data"),
        RESOURCE(null);

        private final String prefix;

        Kind(String prefix) {
            this.prefix = prefix;
        }

        static Kind fromPrefix(String head) {
            if (VAR_PREFIX.equals(head) || VARIABLE_PREFIX.equals(head)) {
                return VARIABLE;
            }
            for (Kind kind : values()) {
                if (kind.prefix != null && kind.prefix.equals(head)) {
                    return kind;
                }
            }
            return RESOURCE;
        }
    }
}
