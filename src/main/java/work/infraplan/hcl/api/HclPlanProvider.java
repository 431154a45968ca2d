package work.infraplan.hcl.api;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.infraplan.hcl.config.ConfigParser;
import work.infraplan.hcl.config.ConfigParserFactory;
import work.infraplan.hcl.config.Module;
import work.infraplan.hcl.config.ParserOptions;
import work.infraplan.hcl.config.tree.TreeFileParser;
import work.infraplan.hcl.plan.ModuleTreeWalker;
import work.infraplan.hcl.plan.PlanJsonWriter;
import work.infraplan.hcl.plan.PlanSynthesisException;
import work.infraplan.hcl.plan.model.PlanDocument;
import work.infraplan.hcl.shared.PlanVars;
import work.infraplan.hcl.shared.VarFlagParser;
import work.infraplan.hcl.shared.VarFlagSyntaxException;

/**
 * Public entry point: parses a project's configuration and renders it as a plan document
 * without running Terraform.
 *
 * <p>Variables named in the plan flags come first; the explicit var and var-file lists of the
 * configuration are appended after them and so win on conflicts.
 */
public final class HclPlanProvider {
    private static final Logger LOG = LoggerFactory.getLogger(HclPlanProvider.class);

    private final PlanRunConfiguration configuration;
    private final ConfigParser parser;
    private final ModuleTreeWalker walker;

    private HclPlanProvider(PlanRunConfiguration configuration, ConfigParser parser, ModuleTreeWalker walker) {
        this.configuration = configuration;
        this.parser = parser;
        this.walker = walker;
    }

    public static HclPlanProvider create(PlanRunConfiguration configuration) {
        return create(configuration, TreeFileParser::new);
    }

    public static HclPlanProvider create(PlanRunConfiguration configuration, ConfigParserFactory parsers) {
        Objects.requireNonNull(configuration, "configuration");
        Objects.requireNonNull(parsers, "parsers");
        PlanVars vars;
        try {
            vars = VarFlagParser.parse(configuration.planFlags());
        } catch (VarFlagSyntaxException ex) {
            throw new PlanSynthesisException("could not parse vars from plan flags: " + ex.getMessage(), ex);
        }
        vars = vars.withOverrides(configuration.vars(), configuration.varFiles());
        LOG.debug("Using {} var assignments and {} var files for {}", vars.vars().size(), vars.files().size(), configuration.path());

        var options = new ParserOptions(vars.files(), vars.vars());
        return new HclPlanProvider(configuration, parsers.create(configuration.path(), options), new ModuleTreeWalker());
    }

    public String type() {
        return "terraform_hcl";
    }

    public String displayType() {
        return "Terraform directory (HCL)";
    }

    /**
     * Parses the configuration and synthesizes the plan. Parser failures propagate unchanged.
     */
    public PlanDocument loadPlan() {
        Module root = parser.parseDirectory();
        PlanDocument plan = walker.walk(root);
        LOG.info("Built plan for {} with {} resource changes", configuration.path(), plan.resourceChanges().size());
        return plan;
    }

    public String loadPlanJson() {
        return PlanJsonWriter.toJson(loadPlan());
    }
}
