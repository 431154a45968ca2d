package work.infraplan.hcl.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlInvalidTypeException;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

/**
 * Reads project definitions from an {@code infraplan.toml} file:
 *
 * <pre>
 * [[projects]]
 * path = "env/prod"
 * terraform_plan_flags = "-var=env=prod -var-file=prod.tfvars"
 * terraform_var_files = ["common.tfvars"]
 * terraform_vars = ["region=eu-west-1"]
 * </pre>
 *
 * Relative project paths are resolved against the directory holding the config file.
 */
public final class ProjectConfigLoader {
    static final String PROJECTS = "projects";

    private ProjectConfigLoader() {}

    public static List<PlanRunConfiguration> load(Path configFile, LogLevel logLevel) {
        if (configFile == null || !Files.isRegularFile(configFile)) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }
        TomlParseResult result;
        try {
            result = Toml.parse(Files.readString(configFile));
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read config file: " + configFile, ex);
        }
        if (result.hasErrors()) {
            throw new IllegalArgumentException("Invalid config file " + configFile + ": " + result.errors().get(0).getMessage());
        }
        Path baseDir = configFile.toAbsolutePath().normalize().getParent();
        return fromToml(result, baseDir, logLevel);
    }

    public static List<PlanRunConfiguration> fromToml(TomlTable root, Path baseDir, LogLevel logLevel) {
        TomlArray projects;
        try {
            projects = root.getArray(PROJECTS);
        } catch (TomlInvalidTypeException ex) {
            throw new IllegalArgumentException("'projects' must be an array of tables", ex);
        }
        if (projects == null || projects.isEmpty()) {
            throw new IllegalArgumentException("Config file declares no [[projects]]");
        }
        var configurations = new ArrayList<PlanRunConfiguration>();
        for (int i = 0; i < projects.size(); i++) {
            TomlTable project;
            try {
                project = projects.getTable(i);
            } catch (TomlInvalidTypeException ex) {
                throw new IllegalArgumentException("projects[" + i + "] must be a table", ex);
            }
            String path = project.getString("path");
            if (path == null || path.isBlank()) {
                throw new IllegalArgumentException("projects[" + i + "] is missing 'path'");
            }
            configurations.add(PlanRunConfiguration.builder()
                .path(baseDir.resolve(path).normalize())
                .planFlags(project.getString("terraform_plan_flags", () -> ""))
                .varFiles(readStrings(project, "terraform_var_files"))
                .vars(readStrings(project, "terraform_vars"))
                .logLevel(logLevel)
                .build());
        }
        return configurations;
    }

    private static List<String> readStrings(TomlTable table, String key) {
        TomlArray array = table.getArray(key);
        if (array == null || array.isEmpty()) {
            return List.of();
        }
        var values = new ArrayList<String>();
        for (int i = 0; i < array.size(); i++) {
            values.add(array.get(i).toString());
        }
        return values;
    }
}
