package work.infraplan.hcl.plan;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.nio.charset.StandardCharsets;
import work.infraplan.hcl.plan.model.PlanDocument;

public final class PlanJsonWriter {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectWriter WRITER = JSON.writerWithDefaultPrettyPrinter();

    private PlanJsonWriter() {}

    public static String toJson(PlanDocument plan) {
        try {
            return WRITER.writeValueAsString(plan);
        } catch (JsonProcessingException ex) {
            throw new PlanSynthesisException("error handling built plan json from hcl: " + ex.getOriginalMessage(), ex);
        }
    }

    public static byte[] toBytes(PlanDocument plan) {
        return toJson(plan).getBytes(StandardCharsets.UTF_8);
    }
}
