package work.infraplan.hcl.plan.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonPropertyOrder({"provider_config", "root_module"})
public record Configuration(
    @JsonProperty("provider_config") Map<String, ProviderConfig> providerConfig,
    @JsonProperty("root_module") ModuleConfig rootModule
) {
    public Configuration {
        providerConfig = providerConfig == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(providerConfig));
    }
}
