package work.infraplan.hcl.plan.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;

@JsonPropertyOrder({"resources", "address", "child_modules"})
public record PlanModule(
    @JsonInclude(JsonInclude.Include.NON_EMPTY) @JsonProperty("resources") List<ResourceJson> resources,
    @JsonInclude(JsonInclude.Include.NON_NULL) @JsonProperty("address") String address,
    @JsonInclude(JsonInclude.Include.NON_EMPTY) @JsonProperty("child_modules") List<PlanModule> childModules
) {
    public PlanModule {
        resources = resources == null ? List.of() : List.copyOf(resources);
        childModules = childModules == null ? List.of() : List.copyOf(childModules);
    }
}
