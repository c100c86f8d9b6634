package work.lcod.minsub.model;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.lcod.minsub.shared.TimeoutFormat;

/**
 * Final pipelines request: resources, ordered actions, merged environment,
 * overall timeout and labels. Never mutated after assembly.
 */
public record RequestDocument(
    ResourceSpec resources,
    List<ActionSpec> actions,
    Map<String, String> environment,
    Duration timeout,
    Map<String, String> labels
) {
    public RequestDocument {
        Objects.requireNonNull(resources, "resources");
        Objects.requireNonNull(timeout, "timeout");
        actions = List.copyOf(actions);
        environment = Collections.unmodifiableMap(new LinkedHashMap<>(environment));
        labels = Collections.unmodifiableMap(new LinkedHashMap<>(labels));
    }

    /**
     * Renders the request in the shape the pipelines service expects.
     */
    public Map<String, Object> toMap() {
        var actionMaps = new ArrayList<Map<String, Object>>();
        for (ActionSpec action : actions) {
            actionMaps.add(action.toMap());
        }
        var pipeline = new LinkedHashMap<String, Object>();
        pipeline.put("actions", actionMaps);
        pipeline.put("resources", resourcesMap());
        pipeline.put("environment", new LinkedHashMap<>(environment));
        pipeline.put("timeout", TimeoutFormat.format(timeout));

        var request = new LinkedHashMap<String, Object>();
        request.put("pipeline", pipeline);
        request.put("labels", new LinkedHashMap<>(labels));
        return request;
    }

    private Map<String, Object> resourcesMap() {
        var disk = new LinkedHashMap<String, Object>();
        disk.put("name", PipelineDefaults.DATA_DISK_NAME);
        disk.put("sizeGb", resources.diskSizeGb());

        var serviceAccount = new LinkedHashMap<String, Object>();
        serviceAccount.put("scopes", new ArrayList<>(resources.scopes()));
        resources.serviceAccount().ifPresent(email -> serviceAccount.put("email", email));

        var vm = new LinkedHashMap<String, Object>();
        vm.put("machineType", resources.machineType());
        vm.put("preemptible", false);
        vm.put("disks", List.of(disk));
        vm.put("serviceAccount", serviceAccount);

        var map = new LinkedHashMap<String, Object>();
        map.put("projectId", resources.project());
        map.put("regions", List.of(resources.region()));
        map.put("virtualMachine", vm);
        return map;
    }
}
