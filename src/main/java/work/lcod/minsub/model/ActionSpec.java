package work.lcod.minsub.model;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.lcod.minsub.shared.TimeoutFormat;

/**
 * One containerised step of the pipeline.
 */
public record ActionSpec(
    String name,
    String imageUri,
    Optional<String> entrypoint,
    List<String> commands,
    Map<String, String> environment,
    List<String> flags,
    List<Mount> mounts,
    Duration timeout
) {
    public ActionSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(imageUri, "imageUri");
        Objects.requireNonNull(timeout, "timeout");
        if (imageUri.isBlank()) {
            throw new IllegalArgumentException("Action " + name + " requires an image");
        }
        entrypoint = entrypoint == null ? Optional.empty() : entrypoint;
        commands = commands == null ? List.of() : List.copyOf(commands);
        environment = environment == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(environment));
        flags = flags == null ? List.of() : List.copyOf(flags);
        mounts = mounts == null ? List.of() : List.copyOf(mounts);
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("name", name);
        map.put("imageUri", imageUri);
        map.put("commands", new ArrayList<>(commands));
        map.put("environment", new LinkedHashMap<>(environment));
        map.put("flags", new ArrayList<>(flags));
        var mountMaps = new ArrayList<Map<String, Object>>();
        for (Mount mount : mounts) {
            mountMaps.add(mount.toMap());
        }
        map.put("mounts", mountMaps);
        map.put("timeout", TimeoutFormat.format(timeout));
        entrypoint.ifPresent(value -> map.put("entrypoint", value));
        return map;
    }
}
