package work.infraplan.hcl.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.tomlj.Toml;

class ProjectConfigLoaderTest {
    private static final Path CONFIG = Path.of("src", "test", "resources", "infraplan.toml").toAbsolutePath();

    @Test
    void loadsProjectsRelativeToConfigFile() {
        var projects = ProjectConfigLoader.load(CONFIG, LogLevel.INFO);

        assertEquals(2, projects.size());
        var web = projects.get(0);
        assertEquals(CONFIG.getParent().resolve("trees/web.yaml").normalize(), web.path());
        assertEquals("-var-file=prod.tfvars -var=ami_id=ami-0flag", web.planFlags());
        assertEquals(List.of(), web.vars());
        assertEquals(LogLevel.INFO, web.logLevel());

        var dir = projects.get(1);
        assertEquals("", dir.planFlags());
        assertEquals(List.of("replicas=2"), dir.vars());
        assertEquals(List.of(), dir.varFiles());
    }

    @Test
    void loadedProjectsPlanEndToEnd() {
        var projects = ProjectConfigLoader.load(CONFIG, LogLevel.WARN);

        var web = HclPlanProvider.create(projects.get(0)).loadPlan();
        assertEquals("aws_instance.web[2]", web.resourceChanges().get(2).address());
        assertEquals("ami-0flag", web.resourceChanges().get(0).change().after().get("ami").asText());

        var dir = HclPlanProvider.create(projects.get(1)).loadPlan();
        assertEquals(2, dir.resourceChanges().size());
        assertEquals("e2-small", dir.resourceChanges().get(1).change().after().get("machine_type").asText());
    }

    @Test
    void missingFileIsRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> ProjectConfigLoader.load(CONFIG.resolveSibling("absent.toml"), LogLevel.WARN));
    }

    @Test
    void projectWithoutPathIsRejected() {
        var toml = Toml.parse("""
            [[projects]]
            terraform_vars = ["a=b"]
            """);

        var ex = assertThrows(IllegalArgumentException.class,
            () -> ProjectConfigLoader.fromToml(toml, Path.of("."), LogLevel.WARN));
        assertTrue(ex.getMessage().contains("projects[0]"));
    }

    @Test
    void configWithoutProjectsIsRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> ProjectConfigLoader.fromToml(Toml.parse("title = \"x\""), Path.of("."), LogLevel.WARN));
        assertThrows(IllegalArgumentException.class,
            () -> ProjectConfigLoader.fromToml(Toml.parse("projects = \"x\""), Path.of("."), LogLevel.WARN));
    }
}
