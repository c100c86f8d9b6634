package work.lcod.minsub.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.lcod.minsub.errors.ConfigurationException;

/**
 * Reads the {@code [resources]} table of a TOML config file:
 *
 * <pre>
 * [resources]
 * project = "my-project"
 * region = "us-west1"
 * machine-type = "n1-standard-4"
 * disk-size = 500
 * service-account = "runner@my-project.iam.gserviceaccount.com"
 * scopes = ["https://www.googleapis.com/auth/cloud-platform"]
 * </pre>
 */
public final class ResourceConfigLoader {
    static final String TABLE = "resources";

    private static final Logger log = LoggerFactory.getLogger(ResourceConfigLoader.class);

    private ResourceConfigLoader() {}

    public static ResourceDefaults load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new ConfigurationException("Config file not found: " + path);
        }
        String text;
        try {
            text = Files.readString(path);
        } catch (IOException ex) {
            throw new ConfigurationException("Unable to read config file " + path + ": " + ex.getMessage(), ex);
        }
        log.debug("Loading resource settings from {}", path);
        return parse(text, path.toString());
    }

    static ResourceDefaults parse(String text, String source) {
        TomlParseResult result = Toml.parse(text);
        if (result.hasErrors()) {
            throw new ConfigurationException("Invalid config file " + source + ": " + result.errors().get(0).toString());
        }
        TomlTable table = result.getTable(TABLE);
        if (table == null || table.isEmpty()) {
            return ResourceDefaults.none();
        }
        return new ResourceDefaults(
            readString(table, "project", source),
            readString(table, "region", source),
            readString(table, "machine-type", source),
            readDiskSize(table, source),
            readString(table, "service-account", source),
            readScopes(table, source)
        );
    }

    private static Optional<String> readString(TomlTable table, String key, String source) {
        Object value = table.get(key);
        if (value == null) {
            return Optional.empty();
        }
        if (!(value instanceof String str)) {
            throw invalid(key, "a string", source);
        }
        return str.isBlank() ? Optional.empty() : Optional.of(str);
    }

    private static Optional<Integer> readDiskSize(TomlTable table, String source) {
        Object value = table.get("disk-size");
        if (value == null) {
            return Optional.empty();
        }
        if (!(value instanceof Long size) || size <= 0 || size > Integer.MAX_VALUE) {
            throw invalid("disk-size", "a positive integer", source);
        }
        return Optional.of(size.intValue());
    }

    private static Optional<List<String>> readScopes(TomlTable table, String source) {
        Object value = table.get("scopes");
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof String scope) {
            return Optional.of(List.of(scope));
        }
        if (!(value instanceof TomlArray array)) {
            throw invalid("scopes", "a string or an array of strings", source);
        }
        List<String> scopes = new ArrayList<>();
        for (int i = 0; i < array.size(); i++) {
            if (!(array.get(i) instanceof String scope)) {
                throw invalid("scopes", "a string or an array of strings", source);
            }
            scopes.add(scope);
        }
        return scopes.isEmpty() ? Optional.empty() : Optional.of(scopes);
    }

    private static ConfigurationException invalid(String key, String expected, String source) {
        return new ConfigurationException(TABLE + "." + key + " must be " + expected + " in " + source);
    }
}
