package work.lcod.minsub.model;

import java.util.List;
import java.util.Optional;
import work.lcod.minsub.errors.ConfigurationException;

/**
 * Immutable description of the VM a pipeline runs on.
 */
public record ResourceSpec(
    String project,
    String region,
    String machineType,
    int diskSizeGb,
    Optional<String> serviceAccount,
    List<String> scopes
) {
    public ResourceSpec {
        requireText(project, "project");
        requireText(region, "region");
        requireText(machineType, "machineType");
        if (diskSizeGb <= 0) {
            throw new ConfigurationException("diskSizeGb must be positive, got " + diskSizeGb);
        }
        serviceAccount = serviceAccount == null ? Optional.empty() : serviceAccount.filter(s -> !s.isBlank());
        if (scopes == null || scopes.isEmpty()) {
            throw new ConfigurationException("At least one scope is required.");
        }
        for (String scope : scopes) {
            requireText(scope, "scope");
        }
        scopes = List.copyOf(scopes);
    }

    public static Builder builder() {
        return new Builder();
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("Missing required resource setting: " + field);
        }
    }

    public static final class Builder {
        private String project;
        private String region;
        private String machineType = PipelineDefaults.DEFAULT_MACHINE_TYPE;
        private int diskSizeGb = PipelineDefaults.DEFAULT_DISK_SIZE_GB;
        private String serviceAccount;
        private List<String> scopes = List.of(PipelineDefaults.DEFAULT_SCOPE);

        public Builder project(String project) {
            this.project = project;
            return this;
        }

        public Builder region(String region) {
            this.region = region;
            return this;
        }

        public Builder machineType(String machineType) {
            this.machineType = machineType;
            return this;
        }

        public Builder diskSizeGb(int diskSizeGb) {
            this.diskSizeGb = diskSizeGb;
            return this;
        }

        public Builder serviceAccount(String serviceAccount) {
            this.serviceAccount = serviceAccount;
            return this;
        }

        public Builder scopes(List<String> scopes) {
            this.scopes = scopes;
            return this;
        }

        public Builder scope(String scope) {
            this.scopes = List.of(scope);
            return this;
        }

        public ResourceSpec build() {
            return new ResourceSpec(
                project,
                region,
                machineType,
                diskSizeGb,
                Optional.ofNullable(serviceAccount),
                scopes
            );
        }
    }
}
