package work.lcod.minsub.params;

import java.util.Objects;
import work.lcod.minsub.model.FileParam;
import work.lcod.minsub.uri.NormalizedUri;
import work.lcod.minsub.uri.UriNormalizer;

/**
 * Produces {@link FileParam}s of one role, naming unnamed values
 * {@code INPUT_<n>} / {@code OUTPUT_<n>} in encounter order.
 */
final class FileParamFactory {
    private final FileParam.Role role;
    private final UriNormalizer normalizer;
    private int autoIndex;

    FileParamFactory(FileParam.Role role, UriNormalizer normalizer) {
        this.role = Objects.requireNonNull(role, "role");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
    }

    String variableName(String name) {
        if (name == null || name.isEmpty()) {
            return role.autoPrefix() + autoIndex++;
        }
        return name;
    }

    FileParam make(String name, String rawUri, boolean recursive) {
        if (rawUri == null || rawUri.isEmpty()) {
            return FileParam.unset(role, name, recursive);
        }
        NormalizedUri normalized = normalizer.normalize(rawUri, recursive);
        return new FileParam(role, name, rawUri, normalized.mountPath(), normalized.uri(), recursive);
    }
}
