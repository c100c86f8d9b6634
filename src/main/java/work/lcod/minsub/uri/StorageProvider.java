package work.lcod.minsub.uri;

import java.util.regex.Pattern;

/**
 * Where a file parameter lives, derived from the shape of its raw value.
 */
public enum StorageProvider {
    GCS("gs://"),
    LOCAL("file:"),
    UNKNOWN("");

    private static final Pattern SCHEME = Pattern.compile("^[A-Za-z][A-Za-z0-9+.-]*://");

    private final String prefix;

    StorageProvider(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }

    public static StorageProvider detect(String raw) {
        if (raw.startsWith(GCS.prefix)) {
            return GCS;
        }
        if (raw.startsWith(LOCAL.prefix) || !SCHEME.matcher(raw).find()) {
            return LOCAL;
        }
        return UNKNOWN;
    }
}
