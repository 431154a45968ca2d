package work.infraplan.hcl.config;

@FunctionalInterface
public interface ConfigParser {
    Module parseDirectory();
}
