package work.lcod.minsub.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record Mount(String disk, String path, boolean readOnly) {
    public Mount {
        Objects.requireNonNull(disk, "disk");
        Objects.requireNonNull(path, "path");
    }

    /**
     * The shared working disk, mounted read-write at the mount root.
     */
    public static Mount dataDisk() {
        return new Mount(PipelineDefaults.DATA_DISK_NAME, PipelineDefaults.DATA_DISK_MOUNT, false);
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("disk", disk);
        map.put("path", path);
        map.put("readOnly", readOnly);
        return map;
    }
}
