package work.lcod.minsub.api;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import work.lcod.minsub.errors.CollisionException;
import work.lcod.minsub.model.ActionSpec;
import work.lcod.minsub.model.JobParameter;
import work.lcod.minsub.model.JobParameterSet;
import work.lcod.minsub.model.PipelineDefaults;
import work.lcod.minsub.model.RequestDocument;
import work.lcod.minsub.model.ResourceSpec;

/**
 * Combines resources, actions and job parameters into a {@link RequestDocument}.
 */
public final class RequestAssembler {
    public RequestDocument assemble(ResourceSpec resources, JobParameterSet job, List<ActionSpec> actions) {
        return assemble(resources, job, actions, PipelineDefaults.SEVEN_DAYS);
    }

    public RequestDocument assemble(
        ResourceSpec resources,
        JobParameterSet job,
        List<ActionSpec> actions,
        Duration timeout
    ) {
        Objects.requireNonNull(resources, "resources");
        Objects.requireNonNull(job, "job");
        Objects.requireNonNull(actions, "actions");
        Objects.requireNonNull(timeout, "timeout");
        return new RequestDocument(
            resources,
            actions,
            environment(job),
            timeout,
            Map.of(PipelineDefaults.LABEL_KEY, PipelineDefaults.LABEL_VALUE)
        );
    }

    /**
     * Env parameters map to their value, file parameters to their path inside the containers.
     */
    static Map<String, String> environment(JobParameterSet job) {
        Map<String, String> environment = new LinkedHashMap<>();
        Set<String> duplicates = new TreeSet<>();
        for (JobParameter parameter : job.all()) {
            if (environment.containsKey(parameter.name())) {
                duplicates.add(parameter.name());
                continue;
            }
            environment.put(parameter.name(), parameter.environmentValue());
        }
        if (!duplicates.isEmpty()) {
            throw new CollisionException(new ArrayList<>(duplicates));
        }
        return environment;
    }
}
