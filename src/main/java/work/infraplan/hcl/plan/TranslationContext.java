package work.infraplan.hcl.plan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import work.infraplan.hcl.config.Module;
import work.infraplan.hcl.plan.model.ResourceChange;

/**
 * Mutable state of a single translation: the provider registry, the flat change list and the
 * chain of modules currently being walked. Not thread-safe; never shared between translations.
 */
final class TranslationContext {
    private final ProviderRegistry providers = new ProviderRegistry();
    private final BlockTranslator translator = new BlockTranslator(providers);
    private final List<ResourceChange> changes = new ArrayList<>();
    private final Set<Module> activePath = Collections.newSetFromMap(new IdentityHashMap<>());
    private final List<String> activeNames = new ArrayList<>();

    ProviderRegistry providers() {
        return providers;
    }

    BlockTranslator translator() {
        return translator;
    }

    void addChange(ResourceChange change) {
        changes.add(change);
    }

    List<ResourceChange> changes() {
        return changes;
    }

    void enter(Module module, int maxDepth) {
        List<String> path = new ArrayList<>(activeNames);
        path.add(displayName(module));
        if (activePath.contains(module)) {
            throw new ModuleCycleException("module cycle detected", path);
        }
        if (activeNames.size() >= maxDepth) {
            throw new ModuleCycleException("module nesting exceeds " + maxDepth + " levels", path);
        }
        activePath.add(module);
        activeNames.add(displayName(module));
    }

    void exit(Module module) {
        activePath.remove(module);
        activeNames.remove(activeNames.size() - 1);
    }

    private static String displayName(Module module) {
        return module.isRoot() ? "<root>" : module.name();
    }
}
