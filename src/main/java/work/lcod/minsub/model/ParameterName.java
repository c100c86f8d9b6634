package work.lcod.minsub.model;

import java.util.regex.Pattern;
import work.lcod.minsub.errors.NameValidationException;

/**
 * Names follow the POSIX definition of a shell variable name (portable
 * underscores, digits and alphabetics, not starting with a digit).
 */
public final class ParameterName {
    private static final Pattern POSIX_NAME = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

    private ParameterName() {}

    public static boolean isValid(String name) {
        return name != null && POSIX_NAME.matcher(name).matches();
    }

    public static String validate(String name, String kind) {
        if (!isValid(name)) {
            throw new NameValidationException(kind, name);
        }
        return name;
    }
}
