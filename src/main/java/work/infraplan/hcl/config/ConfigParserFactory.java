package work.infraplan.hcl.config;

import java.nio.file.Path;

@FunctionalInterface
public interface ConfigParserFactory {
    ConfigParser create(Path path, ParserOptions options);
}
