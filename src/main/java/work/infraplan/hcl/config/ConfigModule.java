package work.infraplan.hcl.config;

import java.util.List;

public record ConfigModule(String name, String source, List<Block> blocks, List<Module> modules) implements Module {
    public ConfigModule {
        name = name == null ? "" : name;
        source = source == null ? "" : source;
        blocks = blocks == null ? List.of() : List.copyOf(blocks);
        modules = modules == null ? List.of() : List.copyOf(modules);
    }

    public static ConfigModule root(List<Block> blocks, List<Module> modules) {
        return new ConfigModule("", "", blocks, modules);
    }
}
