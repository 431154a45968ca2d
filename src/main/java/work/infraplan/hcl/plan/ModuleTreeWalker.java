package work.infraplan.hcl.plan;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.infraplan.hcl.config.Block;
import work.infraplan.hcl.config.BlockKind;
import work.infraplan.hcl.config.Module;
import work.infraplan.hcl.plan.model.Configuration;
import work.infraplan.hcl.plan.model.ModuleConfig;
import work.infraplan.hcl.plan.model.PlanDocument;
import work.infraplan.hcl.plan.model.PlanModule;
import work.infraplan.hcl.plan.model.ResourceData;
import work.infraplan.hcl.plan.model.ResourceJson;
import work.infraplan.hcl.plan.model.ResourceOutput;

/**
 * Walks a parsed module tree depth-first and assembles the plan document.
 *
 * <p>Within each module, provider blocks are registered before any resource is translated.
 * Resource changes are collected in pre-order across the whole tree. Repeated instances of a
 * resource share the configuration entry of the first instance.
 */
public final class ModuleTreeWalker {
    private static final Logger LOG = LoggerFactory.getLogger(ModuleTreeWalker.class);

    public static final int DEFAULT_MAX_DEPTH = 64;

    private final int maxDepth;

    public ModuleTreeWalker() {
        this(DEFAULT_MAX_DEPTH);
    }

    public ModuleTreeWalker(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive");
        }
        this.maxDepth = maxDepth;
    }

    public PlanDocument walk(Module root) {
        var ctx = new TranslationContext();
        ModuleOutput out = walkModule(root, ctx);
        var configuration = new Configuration(ctx.providers().configs(), out.config());
        LOG.debug("Synthesized plan with {} resource changes", ctx.changes().size());
        return PlanDocument.of(out.planned(), ctx.changes(), configuration);
    }

    private ModuleOutput walkModule(Module module, TranslationContext ctx) {
        ctx.enter(module, maxDepth);
        try {
            LOG.debug("Walking module {}", module.isRoot() ? "<root>" : module.name());
            for (Block block : module.blocks()) {
                if (block.blockKind() == BlockKind.PROVIDER) {
                    ctx.providers().register(block);
                }
            }

            List<ResourceJson> planned = new ArrayList<>();
            List<ResourceData> configured = new ArrayList<>();
            Set<String> configuredAddresses = new HashSet<>();
            for (Block block : module.blocks()) {
                if (block.blockKind() != BlockKind.RESOURCE) {
                    continue;
                }
                ResourceOutput out = ctx.translator().translate(block);
                LOG.trace("Translated {}", out.planned().address());
                if (configuredAddresses.add(out.configuration().address())) {
                    configured.add(out.configuration());
                }
                planned.add(out.planned());
                ctx.addChange(out.change());
            }

            Map<String, ModuleConfig.ModuleCall> calls = new LinkedHashMap<>();
            List<PlanModule> children = new ArrayList<>();
            for (Module child : module.modules()) {
                ModuleOutput childOut = walkModule(child, ctx);
                calls.put(child.callKey(), new ModuleConfig.ModuleCall(child.source(), childOut.config()));
                children.add(childOut.planned());
            }

            String address = module.isRoot() ? null : module.name();
            return new ModuleOutput(
                new PlanModule(planned, address, children),
                new ModuleConfig(configured, calls)
            );
        } finally {
            ctx.exit(module);
        }
    }

    private record ModuleOutput(PlanModule planned, ModuleConfig config) {}
}
