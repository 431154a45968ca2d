package work.infraplan.hcl.config.tree;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.infraplan.hcl.config.Attribute;
import work.infraplan.hcl.config.Block;
import work.infraplan.hcl.config.BlockKind;
import work.infraplan.hcl.config.ConfigBlock;
import work.infraplan.hcl.config.ConfigModule;
import work.infraplan.hcl.config.ConfigParseException;
import work.infraplan.hcl.config.ConfigParser;
import work.infraplan.hcl.config.Module;
import work.infraplan.hcl.config.ParserOptions;
import work.infraplan.hcl.config.Reference;

/**
 * Reads a parsed configuration tree serialized as YAML or JSON.
 *
 * <pre>
 * variables:
 *   instance_count: 2
 * blocks:
 *   - kind: provider
 *     type: aws
 *     attributes: { region: eu-west-1 }
 *   - kind: resource
 *     type: aws_instance
 *     name: web
 *     attributes:
 *       count: { $ref: var.instance_count }
 *       ami: ami-123
 *     blocks:
 *       - kind: root_block_device
 *         attributes: { volume_size: 20 }
 * modules:
 *   - name: network
 *     source: ./modules/network
 *     inputs: { cidr: 10.0.0.0/16 }
 *     blocks: [ ... ]
 * </pre>
 *
 * <p>An attribute written as {@code {$ref: ..., $value: ...}} carries references; without
 * {@code $value} its value is taken from the first referenced variable that is set. Resources
 * with a resolvable {@code count} are expanded into indexed instances.
 */
public final class TreeFileParser implements ConfigParser {
    private static final Logger LOG = LoggerFactory.getLogger(TreeFileParser.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    static final List<String> TREE_FILE_NAMES = List.of(
        "infraplan.tree.yaml",
        "infraplan.tree.yml",
        "infraplan.tree.json"
    );
    public static final long DEFAULT_MAX_INSTANCES = 10_000L;
    static final String REF_KEY = "$ref";
    static final String VALUE_KEY = "$value";

    private final Path path;
    private final ParserOptions options;
    private final long maxInstances;

    public TreeFileParser(Path path, ParserOptions options) {
        this(path, options, DEFAULT_MAX_INSTANCES);
    }

    public TreeFileParser(Path path, ParserOptions options, long maxInstances) {
        if (maxInstances < 1) {
            throw new IllegalArgumentException("maxInstances must be positive");
        }
        this.path = Objects.requireNonNull(path, "path");
        this.options = options == null ? ParserOptions.none() : options;
        this.maxInstances = maxInstances;
    }

    @Override
    public Module parseDirectory() {
        Path treeFile = locateTreeFile();
        JsonNode root;
        try (var in = Files.newInputStream(treeFile)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException ex) {
            throw new ConfigParseException("Failed to read configuration tree: " + treeFile, ex);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            return ConfigModule.root(List.of(), List.of());
        }
        requireObject(root, "configuration tree");

        Map<String, JsonNode> scope = readVariables(root.get("variables"));
        Path baseDir = treeFile.toAbsolutePath().getParent();
        for (String file : options.varFiles()) {
            scope.putAll(VariableFiles.load(baseDir.resolve(file)));
        }
        for (String assignment : options.inputVars()) {
            var entry = VariableFiles.parseAssignment(assignment);
            scope.put(entry.getKey(), entry.getValue());
        }
        return readModule(root, "", "", scope);
    }

    private Path locateTreeFile() {
        if (Files.isRegularFile(path)) {
            return path;
        }
        if (Files.isDirectory(path)) {
            for (String candidate : TREE_FILE_NAMES) {
                Path file = path.resolve(candidate);
                if (Files.isRegularFile(file)) {
                    return file;
                }
            }
            throw new ConfigParseException("No configuration tree found in " + path + " (expected one of " + TREE_FILE_NAMES + ")");
        }
        throw new ConfigParseException("Configuration path not found: " + path);
    }

    private Module readModule(JsonNode node, String name, String source, Map<String, JsonNode> scope) {
        List<Block> blocks = new ArrayList<>();
        for (JsonNode blockNode : arrayOf(node.get("blocks"), "blocks")) {
            blocks.addAll(readTopLevelBlock(blockNode, name, scope));
        }
        List<Module> modules = new ArrayList<>();
        for (JsonNode moduleNode : arrayOf(node.get("modules"), "modules")) {
            requireObject(moduleNode, "module");
            String callName = requireText(moduleNode, "name");
            String childName = name.isEmpty() ? "module." + callName : name + ".module." + callName;
            Map<String, JsonNode> childScope = readVariables(moduleNode.get("variables"));
            JsonNode inputs = moduleNode.get("inputs");
            if (inputs != null && inputs.isObject()) {
                inputs.fields().forEachRemaining(entry -> {
                    Attribute input = readAttribute(entry.getKey(), entry.getValue(), scope);
                    if (input.hasValue()) {
                        childScope.put(entry.getKey(), input.value());
                    }
                });
            }
            modules.add(readModule(moduleNode, childName, moduleNode.path("source").asText(""), childScope));
        }
        return new ConfigModule(name, source, blocks, modules);
    }

    private List<Block> readTopLevelBlock(JsonNode node, String modulePath, Map<String, JsonNode> scope) {
        requireObject(node, "block");
        String kind = requireText(node, "kind");
        List<Attribute> attributes = readAttributes(node.get("attributes"), scope);
        List<Block> children = readChildren(node.get("blocks"), modulePath, scope);

        Attribute count = findAttribute(attributes, "count");
        if (BlockKind.of(kind) != BlockKind.RESOURCE || count == null) {
            return List.of(buildBlock(node, kind, modulePath, null, attributes, children));
        }
        long instances = instanceCount(node, count);
        if (instances > maxInstances) {
            throw new ConfigParseException("count of " + node.path("type").asText() + "." + node.path("name").asText()
                + " is " + instances + ", above the limit of " + maxInstances + " instances");
        }
        List<Block> expanded = new ArrayList<>();
        for (long i = 0; i < instances; i++) {
            expanded.add(buildBlock(node, kind, modulePath, i, attributes, children));
        }
        return expanded;
    }

    private List<Block> readChildren(JsonNode node, String modulePath, Map<String, JsonNode> scope) {
        List<Block> children = new ArrayList<>();
        for (JsonNode childNode : arrayOf(node, "blocks")) {
            requireObject(childNode, "block");
            String kind = requireText(childNode, "kind");
            children.add(buildBlock(
                childNode,
                kind,
                modulePath,
                null,
                readAttributes(childNode.get("attributes"), scope),
                readChildren(childNode.get("blocks"), modulePath, scope)
            ));
        }
        return children;
    }

    private static Block buildBlock(
        JsonNode node,
        String kind,
        String modulePath,
        Long index,
        List<Attribute> attributes,
        List<Block> children
    ) {
        return ConfigBlock.builder(kind)
            .typeLabel(node.path("type").asText(""))
            .name(node.path("name").asText(""))
            .index(index)
            .modulePath(modulePath)
            .attributes(attributes)
            .children(children)
            .build();
    }

    private long instanceCount(JsonNode node, Attribute count) {
        JsonNode value = count.value();
        if (value != null && value.isNumber()) {
            return Math.max(0L, value.asLong());
        }
        if (value != null && value.isTextual()) {
            try {
                return Math.max(0L, Long.parseLong(value.asText().trim()));
            } catch (NumberFormatException ex) {
                LOG.warn("Non-numeric count '{}' on {}.{}, planning a single instance", value.asText(), node.path("type").asText(), node.path("name").asText());
                return 1L;
            }
        }
        LOG.warn("Unresolved count on {}.{}, planning a single instance", node.path("type").asText(), node.path("name").asText());
        return 1L;
    }

    private List<Attribute> readAttributes(JsonNode node, Map<String, JsonNode> scope) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        requireObject(node, "attributes");
        List<Attribute> attributes = new ArrayList<>();
        node.fields().forEachRemaining(entry -> attributes.add(readAttribute(entry.getKey(), entry.getValue(), scope)));
        return attributes;
    }

    private Attribute readAttribute(String name, JsonNode node, Map<String, JsonNode> scope) {
        if (node == null || !node.isObject() || !node.has(REF_KEY)) {
            return Attribute.literal(name, node == null ? null : node.deepCopy());
        }
        List<Reference> references = new ArrayList<>();
        JsonNode refs = node.get(REF_KEY);
        if (refs.isArray()) {
            for (JsonNode ref : refs) {
                references.add(parseReference(name, ref));
            }
        } else {
            references.add(parseReference(name, refs));
        }
        JsonNode value = node.has(VALUE_KEY) ? node.get(VALUE_KEY).deepCopy() : resolve(references, scope);
        return new Attribute(name, value, references);
    }

    private static JsonNode resolve(List<Reference> references, Map<String, JsonNode> scope) {
        for (Reference reference : references) {
            if (reference.isVariable() && scope.containsKey(reference.target())) {
                JsonNode value = scope.get(reference.target());
                return value == null ? null : value.deepCopy();
            }
        }
        return null;
    }

    private static Reference parseReference(String attribute, JsonNode node) {
        if (!node.isTextual()) {
            throw new ConfigParseException("Reference of attribute '" + attribute + "' must be a string: " + node);
        }
        try {
            return Reference.parse(node.asText());
        } catch (IllegalArgumentException ex) {
            throw new ConfigParseException("Invalid reference in attribute '" + attribute + "': " + ex.getMessage(), ex);
        }
    }

    private static Map<String, JsonNode> readVariables(JsonNode node) {
        var variables = new LinkedHashMap<String, JsonNode>();
        if (node == null || node.isNull()) {
            return variables;
        }
        requireObject(node, "variables");
        node.fields().forEachRemaining(entry -> variables.put(entry.getKey(), entry.getValue()));
        return variables;
    }

    private static Attribute findAttribute(List<Attribute> attributes, String name) {
        for (Attribute attribute : attributes) {
            if (attribute.name().equals(name)) {
                return attribute;
            }
        }
        return null;
    }

    private static Iterable<JsonNode> arrayOf(JsonNode node, String field) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new ConfigParseException("'" + field + "' must be a list: " + node);
        }
        return node;
    }

    private static void requireObject(JsonNode node, String what) {
        if (!node.isObject()) {
            throw new ConfigParseException(what + " must be an object: " + node);
        }
    }

    private static String requireText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new ConfigParseException("Missing '" + field + "' in " + node);
        }
        return value.asText();
    }
}
