package work.infraplan.hcl.plan.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonPropertyOrder({
    "address", "mode", "type", "name", "provider_config_key", "expressions", "schema_version", "count_expression"
})
public record ResourceData(
    @JsonProperty("address") String address,
    @JsonProperty("mode") String mode,
    @JsonProperty("type") String type,
    @JsonProperty("name") String name,
    @JsonProperty("provider_config_key") String providerConfigKey,
    @JsonInclude(JsonInclude.Include.NON_EMPTY) @JsonProperty("expressions") Map<String, Object> expressions,
    @JsonProperty("schema_version") int schemaVersion,
    @JsonInclude(JsonInclude.Include.NON_NULL) @JsonProperty("count_expression") CountExpression countExpression
) {
    public ResourceData {
        expressions = expressions == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(expressions));
    }
}
