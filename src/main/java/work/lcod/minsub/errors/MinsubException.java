package work.lcod.minsub.errors;

/**
 * Base failure raised while building a pipelines request. Carries a stable
 * machine-readable code next to the human-readable message.
 */
public class MinsubException extends RuntimeException {
    private final String code;

    protected MinsubException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected MinsubException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
