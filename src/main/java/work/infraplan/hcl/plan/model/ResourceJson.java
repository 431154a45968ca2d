package work.infraplan.hcl.plan.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;

@JsonPropertyOrder({"address", "mode", "type", "name", "index", "schema_version", "values"})
public record ResourceJson(
    @JsonProperty("address") String address,
    @JsonProperty("mode") String mode,
    @JsonProperty("type") String type,
    @JsonProperty("name") String name,
    @JsonInclude(JsonInclude.Include.NON_NULL) @JsonProperty("index") Long index,
    @JsonProperty("schema_version") int schemaVersion,
    @JsonProperty("values") JsonNode values
) {}
