package work.lcod.minsub.uri;

import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.minsub.errors.UriValidationException;
import work.lcod.minsub.model.UriReference;

/**
 * Validates raw file parameter values and rewrites them into a canonical
 * external URI plus a path relative to the data disk mount.
 *
 * <p>Only basename wildcards ({@code *}) are supported. Character ranges,
 * {@code ?}, directory wildcards and {@code **} are rejected rather than
 * approximated.</p>
 */
public final class UriNormalizer {
    private static final Logger log = LoggerFactory.getLogger(UriNormalizer.class);

    private static final String GCS_MOUNT_PREFIX = "gs/";

    private final Optional<LocalUriRewriter> localRewriter;

    public UriNormalizer() {
        this(Optional.empty());
    }

    private UriNormalizer(Optional<LocalUriRewriter> localRewriter) {
        this.localRewriter = localRewriter;
    }

    /**
     * Normalizer that also accepts local paths. The pipelines service cannot
     * read them, so nothing in the request path enables this.
     */
    public static UriNormalizer withLocalFiles(LocalUriRewriter rewriter) {
        return new UriNormalizer(Optional.of(Objects.requireNonNull(rewriter, "rewriter")));
    }

    public NormalizedUri normalize(String rawUri, boolean recursive) {
        Objects.requireNonNull(rawUri, "rawUri");
        String uri = recursive ? PathSegments.directoryFormat(rawUri) : rawUri;
        validatePathsOrFail(uri, recursive);

        StorageProvider provider = StorageProvider.detect(uri);
        NormalizedUri normalized;
        switch (provider) {
            case GCS:
                normalized = rewriteGcs(uri, recursive);
                break;
            case LOCAL:
                normalized = localRewriter
                    .map(rewriter -> rewriter.rewrite(uri, recursive))
                    .orElseThrow(() -> unsupportedProvider(uri));
                break;
            default:
                throw unsupportedProvider(uri);
        }
        log.debug("Normalized {} to {} (mount {})", rawUri, normalized.uri(), normalized.mountPath());
        return normalized;
    }

    /**
     * True when joining the mount root with {@code mountPath} stays inside the mount root.
     */
    public static boolean isContained(String mountPath) {
        return mountPath != null
            && !mountPath.isEmpty()
            && !mountPath.startsWith("/")
            && !PathSegments.hasSegment(mountPath, "..");
    }

    private static void validatePathsOrFail(String uri, boolean recursive) {
        if (uri.contains("[") || uri.contains("]")) {
            throw new UriValidationException("Square bracket (character ranges) are not supported", uri);
        }
        if (uri.contains("?")) {
            throw new UriValidationException("Question mark wildcards are not supported", uri);
        }

        String[] parts = PathSegments.split(uri);
        String directory = parts[0];
        String filename = parts[1];
        if (directory.contains("*")) {
            throw new UriValidationException("Path wildcard (*) are only supported for files", uri);
        }
        if (filename.contains("**")) {
            throw new UriValidationException("Recursive wildcards (\"**\") not supported", uri);
        }
        if (".".equals(filename) || "..".equals(filename)) {
            throw new UriValidationException("Path characters \"..\" and \".\" not supported for file names", uri);
        }
        if (!recursive && filename.isEmpty()) {
            throw new UriValidationException(
                "Input or output values that are not recursive must reference a filename or wildcard",
                uri
            );
        }
    }

    private static NormalizedUri rewriteGcs(String uri, boolean recursive) {
        String location = uri.substring(StorageProvider.GCS.prefix().length());
        int slash = location.indexOf('/');
        String bucket = slash < 0 ? location : location.substring(0, slash);
        if (bucket.isEmpty()) {
            throw new UriValidationException("GCS location is missing a bucket name", uri);
        }
        if (!recursive && slash < 0) {
            throw new UriValidationException("GCS file values must reference an object within a bucket", uri);
        }
        if (PathSegments.hasSegment(location, "..") || PathSegments.hasSegment(location, ".")) {
            throw new UriValidationException("Path segments \"..\" and \".\" are not supported in GCS locations", uri);
        }

        String[] parts = PathSegments.split(uri);
        UriReference reference = new UriReference(PathSegments.directoryFormat(parts[0]), parts[1], recursive);
        String mountPath = GCS_MOUNT_PREFIX + location;
        return new NormalizedUri(reference, mountPath, StorageProvider.GCS);
    }

    private static UriValidationException unsupportedProvider(String uri) {
        return new UriValidationException("Unsupported file provider, expected a GCS location", uri);
    }
}
