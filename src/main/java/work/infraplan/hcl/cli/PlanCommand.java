package work.infraplan.hcl.cli;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.infraplan.hcl.api.HclPlanProvider;
import work.infraplan.hcl.api.LogLevel;
import work.infraplan.hcl.api.PlanRunConfiguration;
import work.infraplan.hcl.api.ProjectConfigLoader;

@CommandLine.Command(
    name = "infraplan",
    description = "Build Terraform plan JSON from parsed HCL configuration without running Terraform.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class PlanCommand implements Callable<Integer> {
    static final String SIMPLE_LOGGER_LEVEL = "org.slf4j.simpleLogger.defaultLogLevel";

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-p", "--path"},
        description = "Configuration directory or tree file; repeat for several projects."
    )
    private List<String> paths = new ArrayList<>();

    @CommandLine.Option(
        names = "--config-file",
        description = "infraplan.toml listing the projects to plan.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String configFile;

    @CommandLine.Option(
        names = "--terraform-plan-flags",
        description = "Plan flags to scan for -var and -var-file (e.g. \"-var-file=prod.tfvars -var=env=prod\").",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String planFlags;

    @CommandLine.Option(
        names = "--terraform-var-file",
        description = "Variable file applied after those in --terraform-plan-flags."
    )
    private List<String> varFiles = new ArrayList<>();

    @CommandLine.Option(
        names = "--terraform-var",
        description = "name=value assignment applied after those in --terraform-plan-flags."
    )
    private List<String> vars = new ArrayList<>();

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|fatal).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @CommandLine.Option(
        names = {"-o", "--out"},
        description = "Write the plan JSON to this file instead of stdout (single project only).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String out;

    @Override
    public Integer call() throws Exception {
        LogLevel logLevel = resolveLogLevel();
        System.setProperty(SIMPLE_LOGGER_LEVEL, logLevel.simpleLoggerLevel());

        List<PlanRunConfiguration> projects = collectProjects(logLevel);
        if (out != null && projects.size() > 1) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--out cannot be used with more than one project.");
        }

        PrintWriter stdout = spec.commandLine().getOut();
        for (PlanRunConfiguration project : projects) {
            String json = HclPlanProvider.create(project).loadPlanJson();
            if (out != null) {
                writeOutput(Paths.get(out).toAbsolutePath().normalize(), json);
            } else {
                stdout.println(json);
            }
        }
        stdout.flush();
        return 0;
    }

    private LogLevel resolveLogLevel() {
        try {
            return LogLevel.from(logLevelRaw);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
        }
    }

    private List<PlanRunConfiguration> collectProjects(LogLevel logLevel) {
        List<PlanRunConfiguration> projects = new ArrayList<>();
        if (configFile != null) {
            Path config = Paths.get(configFile).toAbsolutePath().normalize();
            for (PlanRunConfiguration project : ProjectConfigLoader.load(config, logLevel)) {
                projects.add(applyOverrides(project));
            }
        }
        for (String path : paths) {
            Path resolved = Paths.get(path).toAbsolutePath().normalize();
            if (!Files.exists(resolved)) {
                throw new CommandLine.ParameterException(spec.commandLine(), "Path not found: " + resolved);
            }
            projects.add(applyOverrides(PlanRunConfiguration.builder().path(resolved).logLevel(logLevel).build()));
        }
        if (projects.isEmpty()) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Either --path or --config-file is required.");
        }
        return projects;
    }

    /**
     * Command-line plan flags replace a project's own; command-line vars and var files are
     * appended after the project's.
     */
    private PlanRunConfiguration applyOverrides(PlanRunConfiguration project) {
        String flags = planFlags != null && !planFlags.isBlank() ? planFlags : project.planFlags();
        return PlanRunConfiguration.builder()
            .path(project.path())
            .planFlags(flags)
            .varFiles(project.varFiles())
            .varFiles(varFiles)
            .vars(project.vars())
            .vars(vars)
            .logLevel(project.logLevel())
            .build();
    }

    private void writeOutput(Path target, String json) {
        try {
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, json + System.lineSeparator(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new CommandLine.ExecutionException(spec.commandLine(), "Unable to write plan to " + target + ": " + ex.getMessage(), ex);
        }
    }
}
