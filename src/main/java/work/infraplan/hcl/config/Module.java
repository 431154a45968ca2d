package work.infraplan.hcl.config;

import java.util.List;

/**
 * A parsed module. The root module has an empty name; child modules are named by their full
 * call path, e.g. {@code module.vpc.module.subnets}.
 */
public interface Module {
    String name();

    String source();

    List<Block> blocks();

    List<Module> modules();

    default boolean isRoot() {
        return name().isEmpty();
    }

    /**
     * Key under which a parent configuration lists this module: the last dotted segment of
     * its name.
     */
    default String callKey() {
        String name = name();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? name : name.substring(dot + 1);
    }
}
