package work.infraplan.hcl.plan.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

@JsonPropertyOrder({"address", "module_address", "mode", "type", "name", "index", "change"})
public record ResourceChange(
    @JsonProperty("address") String address,
    @JsonInclude(JsonInclude.Include.NON_NULL) @JsonProperty("module_address") String moduleAddress,
    @JsonProperty("mode") String mode,
    @JsonProperty("type") String type,
    @JsonProperty("name") String name,
    @JsonInclude(JsonInclude.Include.NON_NULL) @JsonProperty("index") Long index,
    @JsonProperty("change") Change change
) {
    public static final String CREATE = "create";

    /**
     * Only creations are synthesized, so {@code before} is always {@code null}.
     */
    @JsonPropertyOrder({"actions", "before", "after"})
    public record Change(
        @JsonProperty("actions") List<String> actions,
        @JsonInclude(JsonInclude.Include.ALWAYS) @JsonProperty("before") JsonNode before,
        @JsonInclude(JsonInclude.Include.ALWAYS) @JsonProperty("after") JsonNode after
    ) {
        public Change {
            actions = List.copyOf(actions);
        }

        public static Change create(JsonNode after) {
            return new Change(List.of(CREATE), null, after);
        }
    }
}
