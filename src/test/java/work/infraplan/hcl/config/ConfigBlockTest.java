package work.infraplan.hcl.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.node.TextNode;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigBlockTest {
    @Test
    void rootResourceAddresses() {
        var block = ConfigBlock.resource("aws_instance", "web").index(2L).build();
        assertEquals("web[2]", block.nameLabel());
        assertEquals("aws_instance.web[2]", block.fullAddress());
        assertEquals("aws_instance.web[2]", block.localAddress());
        assertEquals(Optional.empty(), block.moduleAddress());
        assertEquals("", block.moduleName());
        assertEquals(Optional.of(2L), block.repetitionIndex());
        assertFalse(block.isInsideNonRootModule());
    }

    @Test
    void nestedModuleResourceAddresses() {
        var block = ConfigBlock.resource("aws_subnet", "private")
            .modulePath("module.vpc.module.subnets")
            .build();
        assertEquals("module.vpc.module.subnets.aws_subnet.private", block.fullAddress());
        assertEquals("aws_subnet.private", block.localAddress());
        assertEquals(Optional.of("module.vpc.module.subnets"), block.moduleAddress());
        assertEquals("vpc:subnets", block.moduleName());
        assertTrue(block.isInsideNonRootModule());
    }

    @Test
    void providerLabelFallsBackToTypePrefix() {
        assertEquals("google", ConfigBlock.resource("google_compute_instance", "vm").build().providerLabel());
        var explicit = ConfigBlock.resource("aws_instance", "web")
            .attribute(new Attribute("provider", null, List.of(Reference.parse("aws.west"))))
            .build();
        assertEquals("aws.west", explicit.providerLabel());
        var literal = ConfigBlock.resource("aws_instance", "web")
            .attribute(Attribute.literal("provider", TextNode.valueOf("aws.east")))
            .build();
        assertEquals("aws.east", literal.providerLabel());
    }

    @Test
    void kindsAreClassified() {
        assertEquals(BlockKind.RESOURCE, ConfigBlock.builder("resource").build().blockKind());
        assertEquals(BlockKind.DYNAMIC, ConfigBlock.builder("dynamic").build().blockKind());
        assertEquals(BlockKind.NESTED, ConfigBlock.builder("ebs_block_device").build().blockKind());
        assertTrue(BlockKind.DEPENDS_ON.isMeta());
        assertFalse(BlockKind.NESTED.isMeta());
    }
}
