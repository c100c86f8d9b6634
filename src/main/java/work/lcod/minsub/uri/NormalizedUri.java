package work.lcod.minsub.uri;

import java.util.Objects;
import work.lcod.minsub.model.UriReference;

/**
 * Result of normalizing a raw file parameter value.
 *
 * @param uri       canonical external reference
 * @param mountPath location relative to the data disk mount, never absolute and free of {@code ..}
 * @param provider  storage provider the value was resolved against
 */
public record NormalizedUri(UriReference uri, String mountPath, StorageProvider provider) {
    public NormalizedUri {
        Objects.requireNonNull(uri, "uri");
        Objects.requireNonNull(mountPath, "mountPath");
        Objects.requireNonNull(provider, "provider");
        if (!UriNormalizer.isContained(mountPath)) {
            throw new IllegalStateException("Mount path escapes the mount root: " + mountPath);
        }
    }
}
