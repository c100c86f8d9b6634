package work.lcod.minsub.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import work.lcod.minsub.errors.CollisionException;

/**
 * Validated parameters of a single job. Names are unique across all five
 * collections; construction fails otherwise.
 */
public final class JobParameterSet {
    private final Set<EnvParam> envs;
    private final Set<FileParam> inputs;
    private final Set<FileParam> recursiveInputs;
    private final Set<FileParam> outputs;
    private final Set<FileParam> recursiveOutputs;

    public JobParameterSet(
        Set<EnvParam> envs,
        Set<FileParam> inputs,
        Set<FileParam> recursiveInputs,
        Set<FileParam> outputs,
        Set<FileParam> recursiveOutputs
    ) {
        this.envs = freeze(envs);
        this.inputs = freeze(inputs);
        this.recursiveInputs = freeze(recursiveInputs);
        this.outputs = freeze(outputs);
        this.recursiveOutputs = freeze(recursiveOutputs);
        checkMembership(this.inputs, FileParam.Role.INPUT, false);
        checkMembership(this.recursiveInputs, FileParam.Role.INPUT, true);
        checkMembership(this.outputs, FileParam.Role.OUTPUT, false);
        checkMembership(this.recursiveOutputs, FileParam.Role.OUTPUT, true);
        checkForCollisions(all());
    }

    public static JobParameterSet empty() {
        return new JobParameterSet(Set.of(), Set.of(), Set.of(), Set.of(), Set.of());
    }

    public Set<EnvParam> envs() {
        return envs;
    }

    public Set<FileParam> inputs() {
        return inputs;
    }

    public Set<FileParam> recursiveInputs() {
        return recursiveInputs;
    }

    public Set<FileParam> outputs() {
        return outputs;
    }

    public Set<FileParam> recursiveOutputs() {
        return recursiveOutputs;
    }

    /**
     * Every parameter, in collection order: envs, inputs, recursive inputs, outputs, recursive outputs.
     */
    public List<JobParameter> all() {
        List<JobParameter> all = new ArrayList<>();
        all.addAll(envs);
        all.addAll(inputs);
        all.addAll(recursiveInputs);
        all.addAll(outputs);
        all.addAll(recursiveOutputs);
        return all;
    }

    public Set<String> names() {
        Set<String> names = new LinkedHashSet<>();
        for (JobParameter parameter : all()) {
            names.add(parameter.name());
        }
        return names;
    }

    static void checkForCollisions(List<? extends JobParameter> parameters) {
        Set<String> known = new HashSet<>();
        Set<String> duplicates = new TreeSet<>();
        for (JobParameter parameter : parameters) {
            if (!known.add(parameter.name())) {
                duplicates.add(parameter.name());
            }
        }
        if (!duplicates.isEmpty()) {
            throw new CollisionException(new ArrayList<>(duplicates));
        }
    }

    private static void checkMembership(Set<FileParam> params, FileParam.Role role, boolean recursive) {
        for (FileParam param : params) {
            if (param.role() != role || param.recursive() != recursive) {
                throw new IllegalArgumentException(
                    "Parameter " + param.name() + " does not belong with "
                        + (recursive ? "recursive " : "") + role.name().toLowerCase() + "s"
                );
            }
        }
    }

    private static <T> Set<T> freeze(Set<T> values) {
        if (values == null || values.isEmpty()) {
            return Set.of();
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }
}
