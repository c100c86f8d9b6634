package work.lcod.minsub.config;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Locates the resource config file: explicit path, {@code MINSUB_CONFIG},
 * the {@code minsub.config} system property, then {@code ~/.minsub/config.toml}.
 * Only the last candidate is optional; the others must exist when given.
 */
public final class ConfigPaths {
    static final String ENV_VAR = "MINSUB_CONFIG";
    static final String PROPERTY = "minsub.config";

    private ConfigPaths() {}

    public static Optional<Path> locate(String explicit) {
        return locate(explicit, System.getenv(ENV_VAR), System.getProperty(PROPERTY), System.getProperty("user.home"));
    }

    static Optional<Path> locate(String explicit, String env, String property, String home) {
        for (String candidate : new String[] { explicit, env, property }) {
            if (candidate != null && !candidate.isBlank()) {
                return Optional.of(Path.of(candidate));
            }
        }
        if (home == null || home.isBlank()) {
            return Optional.empty();
        }
        Path fallback = Path.of(home, ".minsub", "config.toml");
        return Files.isRegularFile(fallback) ? Optional.of(fallback) : Optional.empty();
    }
}
