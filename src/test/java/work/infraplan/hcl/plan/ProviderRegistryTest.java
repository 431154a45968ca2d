package work.infraplan.hcl.plan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static work.infraplan.hcl.support.PlanTestSupport.literal;
import static work.infraplan.hcl.support.PlanTestSupport.provider;
import static work.infraplan.hcl.support.PlanTestSupport.readTree;
import static work.infraplan.hcl.support.PlanTestSupport.ref;
import static work.infraplan.hcl.support.PlanTestSupport.resource;
import static work.infraplan.hcl.support.PlanTestSupport.toTree;

import org.junit.jupiter.api.Test;

class ProviderRegistryTest {
    @Test
    void aliasIsAppendedToTheKey() {
        var registry = new ProviderRegistry();
        assertEquals("aws.west", registry.register(provider("aws", literal("alias", "west"), literal("region", "us-west-2"))));
        assertEquals(readTree("""
            {"name": "aws.west", "expressions": {"region": {"constant_value": "us-west-2"}}}
            """), toTree(registry.configs().get("aws.west")));
    }

    @Test
    void missingRegionIsEmptyConstant() {
        var registry = new ProviderRegistry();
        registry.register(provider("google"));
        assertEquals("", toTree(registry.configs().get("google")).at("/expressions/region/constant_value").asText("missing"));
    }

    @Test
    void firstProviderOfAnyTypeIsTheDefault() {
        var registry = new ProviderRegistry();
        registry.register(provider("google", literal("region", "europe-west1")));
        registry.register(provider("aws", literal("region", "us-east-1")));

        assertEquals("google", registry.defaultKey());
        // An aws resource without an explicit provider still gets the first-declared key.
        assertEquals("google", registry.resolve(resource("aws_instance", "web")));
    }

    @Test
    void explicitReferenceWins() {
        var registry = new ProviderRegistry();
        registry.register(provider("aws"));
        assertEquals("aws.west", registry.resolve(resource("aws_instance", "web", ref("provider", "aws.west"))));
    }

    @Test
    void explicitLiteralWins() {
        var registry = new ProviderRegistry();
        registry.register(provider("aws"));
        assertEquals("aws.east", registry.resolve(resource("aws_instance", "web", literal("provider", "aws.east"))));
    }

    @Test
    void noProvidersMeansEmptyKey() {
        assertEquals("", new ProviderRegistry().resolve(resource("aws_instance", "web")));
    }
}
