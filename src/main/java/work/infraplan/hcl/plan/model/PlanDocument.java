package work.infraplan.hcl.plan.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;
import java.util.Objects;

/**
 * A synthesized plan in the layout of {@code terraform show -json}.
 */
@JsonPropertyOrder({"format_version", "terraform_version", "planned_values", "resource_changes", "configuration"})
public record PlanDocument(
    @JsonProperty("format_version") String formatVersion,
    @JsonProperty("terraform_version") String terraformVersion,
    @JsonProperty("planned_values") PlannedValues plannedValues,
    @JsonProperty("resource_changes") List<ResourceChange> resourceChanges,
    @JsonProperty("configuration") Configuration configuration
) {
    public static final String FORMAT_VERSION = "1.0";
    public static final String TERRAFORM_VERSION = "1.1.0";

    public PlanDocument {
        Objects.requireNonNull(plannedValues, "plannedValues");
        Objects.requireNonNull(configuration, "configuration");
        resourceChanges = resourceChanges == null ? List.of() : List.copyOf(resourceChanges);
    }

    public static PlanDocument of(PlanModule plannedRoot, List<ResourceChange> changes, Configuration configuration) {
        return new PlanDocument(
            FORMAT_VERSION,
            TERRAFORM_VERSION,
            new PlannedValues(plannedRoot),
            changes,
            configuration
        );
    }

    public record PlannedValues(@JsonProperty("root_module") PlanModule rootModule) {}
}
