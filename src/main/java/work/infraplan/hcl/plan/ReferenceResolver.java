package work.infraplan.hcl.plan;

import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import work.infraplan.hcl.config.Attribute;
import work.infraplan.hcl.config.Block;
import work.infraplan.hcl.config.Reference;
import work.infraplan.hcl.plan.model.CountExpression;

/**
 * Extracts the {@code expressions} and {@code count_expression} views of a block.
 */
public final class ReferenceResolver {
    static final String REFERENCES = "references";

    private static final BigDecimal MIN_LONG = BigDecimal.valueOf(Long.MIN_VALUE);
    private static final BigDecimal MAX_LONG = BigDecimal.valueOf(Long.MAX_VALUE);

    private ReferenceResolver() {}

    /**
     * Per-attribute reference lists, with child blocks grouped into arrays by kind. Attributes
     * without references and children without any referencing attribute are left out.
     */
    public static Map<String, Object> expressions(Block block) {
        var expressions = new LinkedHashMap<String, Object>();
        for (Attribute attribute : block.attributes()) {
            if (ValueMarshaller.COUNT.equals(attribute.name()) || !attribute.hasReferences()) {
                continue;
            }
            expressions.put(attribute.name(), Map.of(REFERENCES, jsonStrings(attribute.references())));
        }

        var childExpressions = new LinkedHashMap<String, List<Object>>();
        for (Block child : block.children()) {
            if (child.blockKind().isMeta()) {
                continue;
            }
            Map<String, Object> nested = expressions(child);
            if (!nested.isEmpty()) {
                childExpressions.computeIfAbsent(child.kind(), key -> new ArrayList<>()).add(nested);
            }
        }
        expressions.putAll(childExpressions);
        return expressions;
    }

    /**
     * The block's {@code count} as either references or a constant; empty when the block has
     * no {@code count} attribute.
     */
    public static Optional<CountExpression> countExpression(Block block) {
        Optional<Attribute> count = block.attribute(ValueMarshaller.COUNT);
        if (count.isEmpty()) {
            return Optional.empty();
        }
        Attribute attribute = count.get();
        if (attribute.hasReferences()) {
            return Optional.of(CountExpression.ofReferences(jsonStrings(attribute.references())));
        }
        return Optional.of(CountExpression.ofConstant(truncate(attribute.value())));
    }

    private static List<String> jsonStrings(List<Reference> references) {
        Set<String> distinct = new LinkedHashSet<>();
        for (Reference reference : references) {
            distinct.add(reference.jsonString());
        }
        return List.copyOf(distinct);
    }

    static long truncate(JsonNode value) {
        if (value == null) {
            return 0L;
        }
        BigDecimal decimal;
        if (value.isNumber()) {
            decimal = value.decimalValue();
        } else if (value.isTextual()) {
            try {
                decimal = new BigDecimal(value.asText().trim());
            } catch (NumberFormatException ex) {
                return 0L;
            }
        } else if (value.isBoolean()) {
            return value.booleanValue() ? 1L : 0L;
        } else {
            return 0L;
        }
        BigDecimal whole = decimal.setScale(0, RoundingMode.DOWN);
        if (whole.compareTo(MAX_LONG) > 0) {
            return Long.MAX_VALUE;
        }
        if (whole.compareTo(MIN_LONG) < 0) {
            return Long.MIN_VALUE;
        }
        return whole.longValueExact();
    }
}
