package work.lcod.minsub.model;

import java.util.Objects;

/**
 * A URI split into its hierarchical location and its last token.
 *
 * <pre>
 * uri                          path                   basename
 * gs://bucket/folder/file.txt  gs://bucket/folder/    file.txt
 * gs://bucket/folder/          gs://bucket/folder/    ""
 * /tmp/ab.txt                  /tmp/                  ab.txt
 * </pre>
 */
public record UriReference(String path, String basename, boolean recursive) {
    public UriReference {
        Objects.requireNonNull(path, "path");
        if (!path.endsWith("/")) {
            throw new IllegalArgumentException("URI path must end with '/': " + path);
        }
        basename = basename == null ? "" : basename;
    }

    public String uri() {
        return path + basename;
    }

    public boolean isDirectory() {
        return basename.isEmpty();
    }

    public boolean hasWildcard() {
        return basename.contains("*");
    }

    @Override
    public String toString() {
        return uri();
    }
}
