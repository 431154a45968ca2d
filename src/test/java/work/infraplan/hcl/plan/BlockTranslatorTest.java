package work.infraplan.hcl.plan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static work.infraplan.hcl.support.PlanTestSupport.literal;
import static work.infraplan.hcl.support.PlanTestSupport.provider;
import static work.infraplan.hcl.support.PlanTestSupport.ref;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.infraplan.hcl.config.ConfigBlock;

class BlockTranslatorTest {
    @Test
    void rootResourceWithoutCount() {
        var providers = new ProviderRegistry();
        providers.register(provider("aws", literal("region", "us-east-1")));
        var block = ConfigBlock.resource("aws_instance", "foo").attribute(ref("ami", "var.ami_id")).build();

        var out = new BlockTranslator(providers).translate(block);

        assertEquals("aws_instance.foo", out.planned().address());
        assertEquals("managed", out.planned().mode());
        assertEquals("foo", out.planned().name());
        assertNull(out.planned().index());
        assertEquals(0, out.planned().schemaVersion());

        assertEquals("aws_instance.foo", out.change().address());
        assertNull(out.change().moduleAddress());
        assertEquals(List.of("create"), out.change().change().actions());
        assertNull(out.change().change().before());
        assertSame(out.planned().values(), out.change().change().after());

        assertEquals("aws_instance.foo", out.configuration().address());
        assertEquals("aws", out.configuration().providerConfigKey());
        assertEquals(Map.of("ami", Map.of("references", List.of("var.ami_id"))), out.configuration().expressions());
        assertNull(out.configuration().countExpression());
    }

    @Test
    void indexedInstanceKeepsIndexOutsideConfiguration() {
        var block = ConfigBlock.resource("aws_instance", "web")
            .index(0L)
            .attribute(literal("count", 2))
            .build();

        var out = new BlockTranslator(new ProviderRegistry()).translate(block);

        assertEquals("aws_instance.web[0]", out.planned().address());
        assertEquals("aws_instance.web[0]", out.change().address());
        assertEquals(0L, out.planned().index());
        assertEquals(0L, out.change().index());
        assertEquals("web", out.planned().name());
        assertEquals("aws_instance.web", out.configuration().address());
        assertEquals(2L, out.configuration().countExpression().constantValue());
    }

    @Test
    void moduleResourceUsesLocalAddressAndModuleProviderKey() {
        var providers = new ProviderRegistry();
        providers.register(provider("google"));
        var block = ConfigBlock.resource("aws_subnet", "private")
            .index(1L)
            .modulePath("module.network")
            .attribute(ref("provider", "aws.west"))
            .build();

        var out = new BlockTranslator(providers).translate(block);

        assertEquals("module.network.aws_subnet.private[1]", out.planned().address());
        assertEquals("module.network", out.change().moduleAddress());
        assertEquals("aws_subnet.private", out.configuration().address());
        assertEquals("network:aws.west", out.configuration().providerConfigKey());
    }

    @Test
    void stripIndexOnlyRemovesTrailingIndex() {
        assertEquals("module.a[0].aws_instance.web", BlockTranslator.stripIndex("module.a[0].aws_instance.web[3]"));
        assertEquals("aws_instance.web", BlockTranslator.stripIndex("aws_instance.web"));
    }
}
