package work.lcod.minsub.model;

/**
 * Name/value parameter exported to every action as an environment variable.
 * The value is {@code null} when the flag carried a bare name.
 */
public record EnvParam(String name, String value) implements JobParameter {
    public static final String KIND = "Environment variable";

    public EnvParam {
        ParameterName.validate(name, KIND);
    }

    @Override
    public String environmentValue() {
        return value == null ? "" : value;
    }
}
