package work.infraplan.hcl.plan.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;

/**
 * Either the references a {@code count} expression depends on, or its constant value.
 */
@JsonPropertyOrder({"references", "constant_value"})
public record CountExpression(
    @JsonInclude(JsonInclude.Include.NON_EMPTY) @JsonProperty("references") List<String> references,
    @JsonInclude(JsonInclude.Include.NON_NULL) @JsonProperty("constant_value") Long constantValue
) {
    public CountExpression {
        references = references == null ? List.of() : List.copyOf(references);
        if (!references.isEmpty() && constantValue != null) {
            throw new IllegalArgumentException("count expression cannot carry both references and a constant");
        }
    }

    public static CountExpression ofReferences(List<String> references) {
        return new CountExpression(references, null);
    }

    public static CountExpression ofConstant(long value) {
        return new CountExpression(List.of(), value);
    }
}
