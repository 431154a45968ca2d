package work.infraplan.hcl.config;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A parsed configuration block (resource, provider, module call or nested sub-block) as
 * handed over by a {@link ConfigParser}.
 */
public interface Block {
    String kind();

    String typeLabel();

    String nameLabel();

    String fullAddress();

    String localAddress();

    Optional<String> moduleAddress();

    /**
     * Module call path in provider-key form ({@code network}, {@code vpc:subnets}); empty at the
     * root.
     */
    String moduleName();

    Optional<Long> repetitionIndex();

    /**
     * Provider named by the block: the explicit {@code provider} attribute when present,
     * otherwise the prefix of the type label.
     */
    String providerLabel();

    boolean isInsideNonRootModule();

    List<Attribute> attributes();

    List<Block> children();

    default BlockKind blockKind() {
        return BlockKind.of(kind());
    }

    default Optional<Attribute> attribute(String name) {
        for (Attribute attribute : attributes()) {
            if (attribute.name().equals(name)) {
                return Optional.of(attribute);
            }
        }
        return Optional.empty();
    }

    default Map<String, JsonNode> values() {
        var values = new LinkedHashMap<String, JsonNode>();
        for (Attribute attribute : attributes()) {
            values.put(attribute.name(), attribute.value());
        }
        return values;
    }
}
