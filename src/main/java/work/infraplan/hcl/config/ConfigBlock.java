package work.infraplan.hcl.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable {@link Block} with addresses derived from its labels, index and module path.
 */
public final class ConfigBlock implements Block {
    private static final String MODULE_PREFIX = "module.";

    private final String kind;
    private final String typeLabel;
    private final String name;
    private final Long index;
    private final String modulePath;
    private final List<Attribute> attributes;
    private final List<Block> children;

    private ConfigBlock(Builder builder) {
        this.kind = Objects.requireNonNull(builder.kind, "kind");
        this.typeLabel = builder.typeLabel == null ? "" : builder.typeLabel;
        this.name = builder.name == null ? "" : builder.name;
        this.index = builder.index;
        this.modulePath = builder.modulePath == null ? "" : builder.modulePath;
        this.attributes = List.copyOf(builder.attributes);
        this.children = List.copyOf(builder.children);
    }

    public static Builder builder(String kind) {
        return new Builder(kind);
    }

    public static Builder resource(String type, String name) {
        return new Builder("resource").typeLabel(type).name(name);
    }

    public static Builder provider(String type) {
        return new Builder("provider").typeLabel(type);
    }

    @Override
    public String kind() {
        return kind;
    }

    @Override
    public String typeLabel() {
        return typeLabel;
    }

    @Override
    public String nameLabel() {
        return index == null ? name : name + "[" + index + "]";
    }

    @Override
    public String fullAddress() {
        String local = localAddress();
        return modulePath.isEmpty() ? local : modulePath + "." + local;
    }

    @Override
    public String localAddress() {
        switch (blockKind()) {
            case RESOURCE:
                return typeLabel + "." + nameLabel();
            case MODULE:
                return MODULE_PREFIX + nameLabel();
            case PROVIDER:
                return "provider." + typeLabel;
            default:
                return kind;
        }
    }

    @Override
    public Optional<String> moduleAddress() {
        return modulePath.isEmpty() ? Optional.empty() : Optional.of(modulePath);
    }

    @Override
    public String moduleName() {
        if (modulePath.isEmpty()) {
            return "";
        }
        String trimmed = modulePath.startsWith(MODULE_PREFIX)
            ? modulePath.substring(MODULE_PREFIX.length())
            : modulePath;
        return trimmed.replace("." + MODULE_PREFIX, ":");
    }

    @Override
    public Optional<Long> repetitionIndex() {
        return Optional.ofNullable(index);
    }

    @Override
    public String providerLabel() {
        Optional<Attribute> explicit = attribute("provider");
        if (explicit.isPresent()) {
            Attribute provider = explicit.get();
            if (provider.hasReferences()) {
                return provider.references().get(0).toString();
            }
            if (provider.hasValue() && provider.value().isTextual()) {
                return provider.value().asText();
            }
        }
        int underscore = typeLabel.indexOf('_');
        return underscore < 0 ? typeLabel : typeLabel.substring(0, underscore);
    }

    @Override
    public boolean isInsideNonRootModule() {
        return !modulePath.isEmpty();
    }

    @Override
    public List<Attribute> attributes() {
        return attributes;
    }

    @Override
    public List<Block> children() {
        return children;
    }

    @Override
    public String toString() {
        return fullAddress();
    }

    public static final class Builder {
        private final String kind;
        private String typeLabel;
        private String name;
        private Long index;
        private String modulePath;
        private final List<Attribute> attributes = new ArrayList<>();
        private final List<Block> children = new ArrayList<>();

        private Builder(String kind) {
            this.kind = kind;
        }

        public Builder typeLabel(String typeLabel) {
            this.typeLabel = typeLabel;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder index(Long index) {
            this.index = index;
            return this;
        }

        public Builder modulePath(String modulePath) {
            this.modulePath = modulePath;
            return this;
        }

        public Builder attribute(Attribute attribute) {
            this.attributes.add(Objects.requireNonNull(attribute, "attribute"));
            return this;
        }

        public Builder attributes(List<Attribute> attributes) {
            attributes.forEach(this::attribute);
            return this;
        }

        public Builder child(Block child) {
            this.children.add(Objects.requireNonNull(child, "child"));
            return this;
        }

        public Builder children(List<? extends Block> children) {
            children.forEach(this::child);
            return this;
        }

        public ConfigBlock build() {
            return new ConfigBlock(this);
        }
    }
}
