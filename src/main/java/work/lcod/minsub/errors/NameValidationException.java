package work.lcod.minsub.errors;

/**
 * A parameter name is not a valid POSIX shell variable name.
 */
public final class NameValidationException extends MinsubException {
    private final String name;

    public NameValidationException(String kind, String name) {
        super("invalid_name", "Invalid " + kind + ": " + name);
        this.name = name;
    }

    public String name() {
        return name;
    }
}
