package work.infraplan.hcl.config;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Objects;

/**
 * A single {@code name = expression} entry of a block. {@code value} is {@code null} when the
 * parser could not resolve the expression statically.
 */
public record Attribute(String name, JsonNode value, List<Reference> references) {
    public Attribute {
        Objects.requireNonNull(name, "name");
        references = references == null ? List.of() : List.copyOf(references);
    }

    public static Attribute literal(String name, JsonNode value) {
        return new Attribute(name, value, List.of());
    }

    public boolean hasReferences() {
        return !references.isEmpty();
    }

    public boolean hasValue() {
        return value != null && !value.isNull() && !value.isMissingNode();
    }
}
