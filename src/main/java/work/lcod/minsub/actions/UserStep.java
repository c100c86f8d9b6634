package work.lcod.minsub.actions;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.lcod.minsub.model.PipelineDefaults;

/**
 * A caller-supplied action run between localization and delocalization.
 * The commands are passed through untouched.
 */
public record UserStep(
    String name,
    String image,
    Optional<String> entrypoint,
    List<String> commands,
    Map<String, String> environment,
    List<String> flags,
    Duration timeout
) {
    public UserStep {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(image, "image");
        entrypoint = entrypoint == null ? Optional.empty() : entrypoint;
        commands = commands == null ? List.of() : List.copyOf(commands);
        environment = environment == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(environment));
        flags = flags == null ? List.of() : List.copyOf(flags);
        timeout = timeout == null ? PipelineDefaults.ONE_DAY : timeout;
    }

    public static UserStep of(String name, String image, List<String> commands) {
        return new UserStep(
            name,
            image,
            Optional.of(PipelineDefaults.BASH_ENTRYPOINT),
            commands,
            Map.of(),
            List.of(),
            PipelineDefaults.ONE_DAY
        );
    }

    /**
     * Runs {@code script} with bash in strict mode.
     */
    public static UserStep script(String name, String image, String script, Duration timeout) {
        return new UserStep(
            name,
            image,
            Optional.of(PipelineDefaults.BASH_ENTRYPOINT),
            BashScript.bashCommands(BashScript.strict(script)),
            Map.of(),
            List.of(),
            timeout
        );
    }

    public UserStep withEnvironment(Map<String, String> environment) {
        return new UserStep(name, image, entrypoint, commands, environment, flags, timeout);
    }
}
