package work.infraplan.hcl.plan.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonPropertyOrder({"name", "expressions"})
public record ProviderConfig(
    @JsonProperty("name") String name,
    @JsonInclude(JsonInclude.Include.NON_EMPTY) @JsonProperty("expressions") Map<String, Object> expressions
) {
    public ProviderConfig {
        expressions = expressions == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(expressions));
    }
}
