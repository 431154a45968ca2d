package work.infraplan.hcl.plan;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Map;
import work.infraplan.hcl.config.Block;
import work.infraplan.hcl.config.BlockKind;

/**
 * Converts block attribute values into the JSON value trees found under {@code values} and
 * {@code after} in a plan.
 */
public final class ValueMarshaller {
    static final String COUNT = "count";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private ValueMarshaller() {}

    /**
     * Marshals a block's own attributes and folds its child blocks into arrays keyed by child
     * kind. Returns {@code null} when the block has no values and no plannable children.
     */
    public static ObjectNode marshalBlock(Block block) {
        ObjectNode values = marshal(block.blockKind(), block.values());
        return foldChildren(block, values);
    }

    /**
     * Marshals a flat value map. {@code count} is dropped for resources and module calls since
     * it is reported as a count expression instead.
     */
    public static ObjectNode marshal(BlockKind kind, Map<String, JsonNode> values) {
        if (values == null) {
            return null;
        }
        ObjectNode result = NODES.objectNode();
        for (var entry : values.entrySet()) {
            if (kind.isCountable() && COUNT.equals(entry.getKey())) {
                continue;
            }
            JsonNode value = entry.getValue();
            result.set(entry.getKey(), value == null || value.isMissingNode() ? NullNode.getInstance() : value.deepCopy());
        }
        return result;
    }

    private static ObjectNode foldChildren(Block block, ObjectNode values) {
        for (Block child : block.children()) {
            if (child.blockKind().isMeta()) {
                continue;
            }
            ObjectNode childValues = marshalBlock(child);
            if (values == null) {
                values = NODES.objectNode();
            }
            JsonNode existing = values.get(child.kind());
            ArrayNode bucket = existing instanceof ArrayNode array ? array : values.putArray(child.kind());
            bucket.add(childValues == null ? NullNode.getInstance() : childValues);
        }
        return values;
    }
}
