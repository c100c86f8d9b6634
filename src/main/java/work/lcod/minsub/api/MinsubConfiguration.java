package work.lcod.minsub.api;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import work.lcod.minsub.actions.UserStep;
import work.lcod.minsub.model.PipelineDefaults;
import work.lcod.minsub.model.ResourceSpec;

/**
 * Immutable description of one job as given by the caller: raw parameter flag
 * values, the VM resources and the user steps.
 */
public record MinsubConfiguration(
    ResourceSpec resources,
    List<String> envs,
    List<String> inputs,
    List<String> recursiveInputs,
    List<String> outputs,
    List<String> recursiveOutputs,
    List<UserStep> userSteps,
    Duration timeout
) {
    public MinsubConfiguration {
        Objects.requireNonNull(resources, "resources");
        Objects.requireNonNull(timeout, "timeout");
        envs = copy(envs);
        inputs = copy(inputs);
        recursiveInputs = copy(recursiveInputs);
        outputs = copy(outputs);
        recursiveOutputs = copy(recursiveOutputs);
        userSteps = userSteps == null ? List.of() : List.copyOf(userSteps);
    }

    public static Builder builder() {
        return new Builder();
    }

    private static List<String> copy(List<String> values) {
        return values == null ? List.of() : List.copyOf(values);
    }

    public static final class Builder {
        private ResourceSpec resources;
        private List<String> envs = List.of();
        private List<String> inputs = List.of();
        private List<String> recursiveInputs = List.of();
        private List<String> outputs = List.of();
        private List<String> recursiveOutputs = List.of();
        private final List<UserStep> userSteps = new ArrayList<>();
        private Duration timeout = PipelineDefaults.SEVEN_DAYS;

        public Builder resources(ResourceSpec resources) {
            this.resources = resources;
            return this;
        }

        public Builder envs(List<String> envs) {
            this.envs = envs;
            return this;
        }

        public Builder inputs(List<String> inputs) {
            this.inputs = inputs;
            return this;
        }

        public Builder recursiveInputs(List<String> recursiveInputs) {
            this.recursiveInputs = recursiveInputs;
            return this;
        }

        public Builder outputs(List<String> outputs) {
            this.outputs = outputs;
            return this;
        }

        public Builder recursiveOutputs(List<String> recursiveOutputs) {
            this.recursiveOutputs = recursiveOutputs;
            return this;
        }

        public Builder userStep(UserStep step) {
            this.userSteps.add(step);
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public MinsubConfiguration build() {
            return new MinsubConfiguration(
                resources,
                envs,
                inputs,
                recursiveInputs,
                outputs,
                recursiveOutputs,
                userSteps,
                timeout
            );
        }
    }
}
