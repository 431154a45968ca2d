package work.infraplan.hcl.plan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.infraplan.hcl.support.PlanTestSupport.literal;
import static work.infraplan.hcl.support.PlanTestSupport.nested;
import static work.infraplan.hcl.support.PlanTestSupport.readTree;
import static work.infraplan.hcl.support.PlanTestSupport.ref;
import static work.infraplan.hcl.support.PlanTestSupport.resource;
import static work.infraplan.hcl.support.PlanTestSupport.toTree;

import com.fasterxml.jackson.databind.node.DoubleNode;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.infraplan.hcl.config.ConfigBlock;

class ReferenceResolverTest {
    @Test
    void collectsReferencesPerAttribute() {
        var block = resource("aws_instance", "web",
            ref("ami", "var.ami_id"),
            literal("instance_type", "t3.micro"),
            ref("subnet_id", "aws_subnet.main.id", "aws_subnet.main"));

        var expressions = ReferenceResolver.expressions(block);
        assertEquals(readTree("""
            {
              "ami": {"references": ["var.ami_id"]},
              "subnet_id": {"references": ["aws_subnet.main.id", "aws_subnet.main"]}
            }
            """), toTree(expressions));
    }

    @Test
    void countIsNotAnExpression() {
        var block = resource("aws_instance", "web", ref("count", "var.instances"));
        assertTrue(ReferenceResolver.expressions(block).isEmpty());
    }

    @Test
    void childReferencesAreGroupedByKind() {
        var block = ConfigBlock.resource("aws_instance", "web")
            .child(nested("ebs_block_device").attribute(ref("kms_key_id", "aws_kms_key.disk.arn")).build())
            .child(nested("ebs_block_device").attribute(literal("volume_size", 10)).build())
            .child(nested("network_interface").attribute(ref("network_interface_id", "aws_network_interface.a.id")).build())
            .child(nested("dynamic").attribute(ref("for_each", "var.disks")).build())
            .build();

        var expressions = ReferenceResolver.expressions(block);
        assertEquals(readTree("""
            {
              "ebs_block_device": [{"kms_key_id": {"references": ["aws_kms_key.disk.arn"]}}],
              "network_interface": [{"network_interface_id": {"references": ["aws_network_interface.a.id"]}}]
            }
            """), toTree(expressions));
        assertFalse(expressions.containsKey("dynamic"));
    }

    @Test
    void childReferencesSurviveWhenParentHasNoAttributes() {
        var block = ConfigBlock.resource("aws_instance", "web")
            .child(nested("root_block_device").attribute(ref("kms_key_id", "var.key")).build())
            .build();

        assertEquals(List.of(Map.of("kms_key_id", Map.of("references", List.of("var.key")))),
            ReferenceResolver.expressions(block).get("root_block_device"));
    }

    @Test
    void noCountAttributeMeansNoCountExpression() {
        assertTrue(ReferenceResolver.countExpression(resource("aws_instance", "web")).isEmpty());
    }

    @Test
    void literalCountBecomesConstant() {
        var count = ReferenceResolver.countExpression(resource("aws_instance", "web", literal("count", 3))).orElseThrow();
        assertEquals(3L, count.constantValue());
        assertTrue(count.references().isEmpty());
    }

    @Test
    void fractionalCountIsTruncated() {
        var block = resource("aws_instance", "web", literal("count", DoubleNode.valueOf(2.9)));
        assertEquals(2L, ReferenceResolver.countExpression(block).orElseThrow().constantValue());
    }

    @Test
    void zeroCountIsStillPresent() {
        var count = ReferenceResolver.countExpression(resource("aws_instance", "web", literal("count", 0)));
        assertEquals(0L, count.orElseThrow().constantValue());
    }

    @Test
    void referencedCountListsDistinctShortFormReferences() {
        var block = resource("aws_instance", "web", ref("count", "variable.enabled", "var.enabled", "local.replicas"));

        var count = ReferenceResolver.countExpression(block).orElseThrow();
        assertEquals(List.of("var.enabled", "local.replicas"), count.references());
        assertNull(count.constantValue());
    }
}
