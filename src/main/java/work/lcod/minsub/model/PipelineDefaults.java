package work.lcod.minsub.model;

import java.time.Duration;

/**
 * Constants shared with the pipelines service; they are part of the request wire contract.
 */
public final class PipelineDefaults {
    public static final String DATA_DISK_NAME = "minsubdisk";
    public static final String DATA_DISK_MOUNT = "/mnt/data";

    public static final Duration ONE_HOUR = Duration.ofHours(1);
    public static final Duration TWO_HOURS = Duration.ofHours(2);
    public static final Duration ONE_DAY = Duration.ofDays(1);
    public static final Duration SEVEN_DAYS = Duration.ofDays(7);

    public static final int DEFAULT_DISK_SIZE_GB = 200;
    public static final String DEFAULT_SCOPE = "https://www.googleapis.com/auth/cloud-platform";
    public static final String DEFAULT_MACHINE_TYPE = "n1-standard-2";

    // Generic tags are usually cached on the workers, pinned versions are not.
    public static final String DEBIAN_IMAGE = "debian:stable-slim";
    public static final String CLOUD_SDK_IMAGE = "google/cloud-sdk:slim";
    public static final String BASH_ENTRYPOINT = "/bin/bash";

    public static final String LABEL_KEY = "minsub";
    public static final String LABEL_VALUE = "v1";

    private PipelineDefaults() {}

    /**
     * Joins a container-relative mount path onto the data disk mount point.
     */
    public static String underMountRoot(String mountPath) {
        return DATA_DISK_MOUNT + "/" + mountPath;
    }
}
