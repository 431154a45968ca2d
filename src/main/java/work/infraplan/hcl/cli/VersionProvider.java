package work.infraplan.hcl.cli;

import picocli.CommandLine;
import work.infraplan.hcl.plan.model.PlanDocument;

final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        String implementationVersion = Main.class.getPackage().getImplementationVersion();
        return new String[] {
            "infraplan " + (implementationVersion != null ? implementationVersion : "development"),
            "plan format " + PlanDocument.FORMAT_VERSION + ", terraform " + PlanDocument.TERRAFORM_VERSION
        };
    }
}
