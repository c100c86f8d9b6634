package work.lcod.minsub.uri;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import work.lcod.minsub.model.UriReference;

/**
 * Rewrites local file paths for use inside the action containers.
 *
 * <p>The external form is expanded and simplified against the caller's home and
 * working directories. The mount path roots home-relative and working-directory
 * relative locations under their own synthetic segment and replaces the
 * indirections that cannot be collapsed with {@code _dotdot_}, so nothing about
 * the invoking machine leaks into the request and distinct origins never share
 * a mount path:</p>
 *
 * <pre>
 * /tmp/a_path/../B_PATH/file.txt  -> file/tmp/B_PATH/file.txt
 * ./../upper_dir/                 -> file/_cwd_/_dotdot_/upper_dir/
 * ~/localdata/*.bam               -> file/_home_/localdata/*.bam
 * ~/../other/z.txt                -> file/_home_/_dotdot_/other/z.txt
 * </pre>
 *
 * <p>Local paths are not accepted by {@link UriNormalizer} unless the provider is
 * explicitly enabled.</p>
 */
public final class LocalUriRewriter {
    static final String MOUNT_PREFIX = "file/";
    static final String DOTDOT_TOKEN = "_dotdot_";
    static final String HOME_TOKEN = "_home_";
    static final String CWD_TOKEN = "_cwd_";

    // Literal names that look like a token get one more leading underscore.
    private static final Pattern RESERVED_SEGMENT = Pattern.compile("_+(dotdot|home|cwd)_");

    private static final String[][] PREFIX_REPLACEMENTS = {
        { "file:///", "/" },
        { "file:/", "/" },
        { "~/", null },
        { "./", "" }
    };

    private final String homeDirectory;
    private final String workingDirectory;

    public LocalUriRewriter(String homeDirectory, String workingDirectory) {
        this.homeDirectory = requireAbsolute(homeDirectory, "homeDirectory");
        this.workingDirectory = requireAbsolute(workingDirectory, "workingDirectory");
    }

    public static LocalUriRewriter forCurrentUser() {
        return new LocalUriRewriter(System.getProperty("user.home"), System.getProperty("user.dir"));
    }

    public NormalizedUri rewrite(String rawUri) {
        return rewrite(rawUri, rawUri.endsWith("/"));
    }

    public NormalizedUri rewrite(String rawUri, boolean recursive) {
        String[] parts = PathSegments.split(rawUri);
        String directory = parts[0];
        String filename = parts[1];
        String externalDirectory = PathSegments.directoryFormat(absolutize(directory));
        UriReference uri = new UriReference(externalDirectory, filename, recursive);
        return new NormalizedUri(uri, mountPath(directory) + filename, StorageProvider.LOCAL);
    }

    private String absolutize(String directory) {
        String expanded = directory;
        for (String[] replacement : PREFIX_REPLACEMENTS) {
            if (expanded.startsWith(replacement[0])) {
                String target = replacement[1] == null ? homeDirectory : replacement[1];
                expanded = PathSegments.join(target, expanded.substring(replacement[0].length()));
                break;
            }
        }
        if ("~".equals(expanded)) {
            expanded = homeDirectory;
        }
        return PathSegments.normalize(PathSegments.join(workingDirectory, expanded));
    }

    private static String mountPath(String directory) {
        String path = directory;
        if (path.startsWith(StorageProvider.LOCAL.prefix())) {
            path = path.substring(StorageProvider.LOCAL.prefix().length());
        }
        List<String> segments = new ArrayList<>();
        if ("~".equals(path) || path.startsWith("~/")) {
            segments.add(HOME_TOKEN);
            path = path.substring(1).replaceFirst("^/+", "");
        } else if (!path.startsWith("/")) {
            segments.add(CWD_TOKEN);
        }
        for (String segment : PathSegments.normalize(path).split("/")) {
            if (segment.isEmpty() || ".".equals(segment)) {
                continue;
            }
            if ("..".equals(segment)) {
                segments.add(DOTDOT_TOKEN);
            } else if (RESERVED_SEGMENT.matcher(segment).matches()) {
                segments.add("_" + segment);
            } else {
                segments.add(segment);
            }
        }
        return PathSegments.directoryFormat(MOUNT_PREFIX + String.join("/", segments));
    }

    private static String requireAbsolute(String path, String field) {
        Objects.requireNonNull(path, field);
        if (!path.startsWith("/")) {
            throw new IllegalArgumentException(field + " must be absolute: " + path);
        }
        return path;
    }
}
