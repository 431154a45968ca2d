package work.infraplan.hcl.config.tree;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.infraplan.hcl.config.ConfigParseException;

class VariableFilesTest {
    private static final Path TREES = Path.of("src", "test", "resources", "trees").toAbsolutePath();

    @Test
    void readsTomlVarFile() {
        var values = VariableFiles.load(TREES.resolve("prod.tfvars"));

        assertEquals(3L, values.get("instance_count").asLong());
        assertTrue(values.get("instance_count").isIntegralNumber());
        assertEquals("ami-0prod", values.get("ami_id").asText());
    }

    @Test
    void readsJsonVarFile() {
        var values = VariableFiles.load(TREES.resolve("override.tfvars.json"));

        assertEquals("ami-0json", values.get("ami_id").asText());
    }

    @Test
    void keepsDottedKeysWhole(@TempDir Path tmp) throws Exception {
        Path file = tmp.resolve("quoted.tfvars");
        Files.writeString(file, "\"a.b\" = \"x\"\ntags = { env = \"prod\" }\nzones = [\"a\", \"b\"]\n");

        var values = VariableFiles.load(file);

        assertEquals("x", values.get("a.b").asText());
        assertEquals("prod", values.get("tags").get("env").asText());
        assertEquals(2, values.get("zones").size());
    }

    @Test
    void invalidTomlIsAParseError(@TempDir Path tmp) throws Exception {
        Path file = tmp.resolve("bad.tfvars");
        Files.writeString(file, "name = = \"x\"\n");

        assertThrows(ConfigParseException.class, () -> VariableFiles.load(file));
    }

    @Test
    void splitsAssignmentsOnFirstEquals() {
        var entry = VariableFiles.parseAssignment("filter=a=b");

        assertEquals("filter", entry.getKey());
        assertEquals("a=b", entry.getValue().asText());
        assertThrows(ConfigParseException.class, () -> VariableFiles.parseAssignment("=value"));
    }
}
