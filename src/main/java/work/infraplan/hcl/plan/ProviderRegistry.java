package work.infraplan.hcl.plan;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.infraplan.hcl.config.Attribute;
import work.infraplan.hcl.config.Block;
import work.infraplan.hcl.plan.model.ProviderConfig;

/**
 * Provider configurations declared during one translation, and the default provider key
 * used by resources that do not name one.
 *
 * <p>The default is the first provider registered in the whole translation, whatever its
 * type: a resource of another provider type without an explicit {@code provider} still gets
 * that key.
 */
public final class ProviderRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(ProviderRegistry.class);

    static final String ALIAS = "alias";
    static final String REGION = "region";
    static final String PROVIDER = "provider";
    static final String CONSTANT_VALUE = "constant_value";

    private final Map<String, ProviderConfig> configs = new LinkedHashMap<>();
    private String defaultKey = "";

    /**
     * Records a provider block under {@code <type>} or {@code <type>.<alias>} and returns that
     * key. A later declaration with the same key replaces the earlier one.
     */
    public String register(Block provider) {
        String key = provider.typeLabel();
        Optional<Attribute> alias = provider.attribute(ALIAS);
        if (alias.isPresent() && alias.get().hasValue()) {
            key = key + "." + alias.get().value().asText();
        }

        String region = provider.attribute(REGION)
            .filter(Attribute::hasValue)
            .map(attribute -> attribute.value().asText())
            .orElse("");

        var expressions = new LinkedHashMap<String, Object>();
        expressions.put(REGION, Map.of(CONSTANT_VALUE, region));
        configs.put(key, new ProviderConfig(key, expressions));

        if (defaultKey.isEmpty()) {
            defaultKey = key;
            LOG.debug("Default provider set to {}", key);
        }
        return key;
    }

    public String resolve(Block resource) {
        Optional<Attribute> explicit = resource.attribute(PROVIDER);
        if (explicit.isPresent()) {
            Attribute provider = explicit.get();
            if (provider.hasReferences()) {
                return provider.references().get(0).toString();
            }
            if (provider.hasValue() && provider.value().isTextual()) {
                return provider.value().asText();
            }
        }
        return defaultKey;
    }

    public String defaultKey() {
        return defaultKey;
    }

    public Map<String, ProviderConfig> configs() {
        return Collections.unmodifiableMap(configs);
    }
}
