package work.lcod.minsub.config;

import java.util.List;
import java.util.Optional;
import work.lcod.minsub.model.ResourceSpec;

/**
 * Resource settings read from a config file. Every field is optional; command
 * line values take precedence.
 */
public record ResourceDefaults(
    Optional<String> project,
    Optional<String> region,
    Optional<String> machineType,
    Optional<Integer> diskSizeGb,
    Optional<String> serviceAccount,
    Optional<List<String>> scopes
) {
    public static ResourceDefaults none() {
        return new ResourceDefaults(
            Optional.empty(),
            Optional.empty(),
            Optional.empty(),
            Optional.empty(),
            Optional.empty(),
            Optional.empty()
        );
    }

    /**
     * Seeds a builder with these settings; fields that are absent keep the builder defaults.
     */
    public ResourceSpec.Builder toBuilder() {
        var builder = ResourceSpec.builder();
        project.ifPresent(builder::project);
        region.ifPresent(builder::region);
        machineType.ifPresent(builder::machineType);
        diskSizeGb.ifPresent(builder::diskSizeGb);
        serviceAccount.ifPresent(builder::serviceAccount);
        scopes.ifPresent(builder::scopes);
        return builder;
    }
}
