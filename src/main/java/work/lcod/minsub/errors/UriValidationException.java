package work.lcod.minsub.errors;

/**
 * A file parameter value was rejected by the URI normalizer.
 */
public final class UriValidationException extends MinsubException {
    private final String uri;

    public UriValidationException(String message, String uri) {
        super("invalid_uri", message + ": " + uri);
        this.uri = uri;
    }

    public String uri() {
        return uri;
    }
}
