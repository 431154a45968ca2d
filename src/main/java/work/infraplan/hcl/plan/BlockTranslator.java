package work.infraplan.hcl.plan;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;
import java.util.regex.Pattern;
import work.infraplan.hcl.config.Block;
import work.infraplan.hcl.plan.model.ResourceChange;
import work.infraplan.hcl.plan.model.ResourceData;
import work.infraplan.hcl.plan.model.ResourceJson;
import work.infraplan.hcl.plan.model.ResourceOutput;

/**
 * Lowers one resource block into its planned-value, change and configuration records.
 */
public final class BlockTranslator {
    static final String MANAGED = "managed";
    static final int SCHEMA_VERSION = 0;

    private static final Pattern INDEX_SUFFIX = Pattern.compile("\\[\\d+]$");

    private final ProviderRegistry providers;

    public BlockTranslator(ProviderRegistry providers) {
        this.providers = Objects.requireNonNull(providers, "providers");
    }

    public ResourceOutput translate(Block block) {
        String address = block.fullAddress();
        String name = stripIndex(block.nameLabel());
        Long index = block.repetitionIndex().orElse(null);
        ObjectNode values = ValueMarshaller.marshalBlock(block);

        var planned = new ResourceJson(address, MANAGED, block.typeLabel(), name, index, SCHEMA_VERSION, values);
        var change = new ResourceChange(
            address,
            block.moduleAddress().orElse(null),
            MANAGED,
            block.typeLabel(),
            name,
            index,
            ResourceChange.Change.create(values)
        );

        String configAddress;
        String providerKey;
        if (block.isInsideNonRootModule()) {
            configAddress = stripIndex(block.localAddress());
            providerKey = block.moduleName() + ":" + block.providerLabel();
        } else {
            configAddress = stripIndex(address);
            providerKey = providers.resolve(block);
        }
        var configuration = new ResourceData(
            configAddress,
            MANAGED,
            block.typeLabel(),
            name,
            providerKey,
            ReferenceResolver.expressions(block),
            SCHEMA_VERSION,
            ReferenceResolver.countExpression(block).orElse(null)
        );
        return new ResourceOutput(planned, change, configuration);
    }

    static String stripIndex(String address) {
        return INDEX_SUFFIX.matcher(address).replaceFirst("");
    }
}
