package work.infraplan.hcl.plan.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static configuration of one module: one entry per distinct resource address and the
 * module calls it makes.
 */
@JsonPropertyOrder({"resources", "module_calls"})
public record ModuleConfig(
    @JsonInclude(JsonInclude.Include.NON_EMPTY) @JsonProperty("resources") List<ResourceData> resources,
    @JsonInclude(JsonInclude.Include.NON_EMPTY) @JsonProperty("module_calls") Map<String, ModuleCall> moduleCalls
) {
    public ModuleConfig {
        resources = resources == null ? List.of() : List.copyOf(resources);
        moduleCalls = moduleCalls == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(moduleCalls));
    }

    @JsonPropertyOrder({"source", "module"})
    public record ModuleCall(
        @JsonProperty("source") String source,
        @JsonProperty("module") ModuleConfig module
    ) {}
}
