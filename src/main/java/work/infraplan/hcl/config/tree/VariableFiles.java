package work.infraplan.hcl.config.tree;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.infraplan.hcl.config.ConfigParseException;

/**
 * Loads variable values from var files and {@code name=value} assignments.
 *
 * <p>{@code *.json} files are read as JSON objects. Any other file is read as TOML, which
 * covers the flat {@code name = "value"} layout of typical tfvars files.
 */
public final class VariableFiles {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private VariableFiles() {}

    public static Map<String, JsonNode> load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ConfigParseException("Variable file not found: " + path);
        }
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        try {
            if (fileName.endsWith(".json")) {
                return loadJson(path);
            }
            return loadToml(path);
        } catch (IOException ex) {
            throw new ConfigParseException("Failed to read variable file: " + path, ex);
        }
    }

    public static Map.Entry<String, JsonNode> parseAssignment(String assignment) {
        int eq = assignment == null ? -1 : assignment.indexOf('=');
        if (eq <= 0) {
            throw new ConfigParseException("Invalid variable assignment, expected name=value: " + assignment);
        }
        String name = assignment.substring(0, eq).trim();
        return Map.entry(name, TextNode.valueOf(assignment.substring(eq + 1)));
    }

    private static Map<String, JsonNode> loadJson(Path path) throws IOException {
        JsonNode root = JSON.readTree(path.toFile());
        if (root == null || !root.isObject()) {
            throw new ConfigParseException("Variable file must contain a JSON object: " + path);
        }
        var values = new LinkedHashMap<String, JsonNode>();
        root.fields().forEachRemaining(entry -> values.put(entry.getKey(), entry.getValue()));
        return values;
    }

    private static Map<String, JsonNode> loadToml(Path path) throws IOException {
        TomlParseResult result = Toml.parse(Files.readString(path));
        if (result.hasErrors()) {
            throw new ConfigParseException("Invalid variable file " + path + ": " + result.errors().get(0).toString());
        }
        var values = new LinkedHashMap<String, JsonNode>();
        for (String key : result.keySet()) {
            values.put(key, toJson(result.get(List.of(key))));
        }
        return values;
    }

    private static JsonNode toJson(Object value) {
        if (value == null) {
            return NODES.nullNode();
        }
        if (value instanceof String str) {
            return NODES.textNode(str);
        }
        if (value instanceof Long number) {
            return NODES.numberNode(number);
        }
        if (value instanceof Double number) {
            return NODES.numberNode(number);
        }
        if (value instanceof Boolean bool) {
            return NODES.booleanNode(bool);
        }
        if (value instanceof TomlArray array) {
            ArrayNode node = NODES.arrayNode();
            for (int i = 0; i < array.size(); i++) {
                node.add(toJson(array.get(i)));
            }
            return node;
        }
        if (value instanceof TomlTable table) {
            ObjectNode node = NODES.objectNode();
            for (String key : table.keySet()) {
                node.set(key, toJson(table.get(List.of(key))));
            }
            return node;
        }
        return NODES.textNode(value.toString());
    }
}
