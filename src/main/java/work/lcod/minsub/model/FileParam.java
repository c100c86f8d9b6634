package work.lcod.minsub.model;

import java.util.Objects;

/**
 * File parameter that is localized before (inputs) or delocalized after
 * (outputs) the user actions run.
 *
 * <p>{@code mountPath} is relative to {@link PipelineDefaults#DATA_DISK_MOUNT}. It and
 * {@code uri} are {@code null} only for a declared parameter without a value.</p>
 */
public record FileParam(
    Role role,
    String name,
    String rawValue,
    String mountPath,
    UriReference uri,
    boolean recursive
) implements JobParameter {
    public FileParam {
        Objects.requireNonNull(role, "role");
        ParameterName.validate(name, role.label());
        if ((mountPath == null) != (uri == null)) {
            throw new IllegalArgumentException("mountPath and uri must be set together for " + name);
        }
        if (mountPath != null && (rawValue == null || rawValue.isEmpty())) {
            throw new IllegalArgumentException("mountPath requires a raw value for " + name);
        }
    }

    public static FileParam unset(Role role, String name, boolean recursive) {
        return new FileParam(role, name, null, null, null, recursive);
    }

    public boolean hasValue() {
        return mountPath != null;
    }

    /**
     * Absolute path of this parameter inside the action containers.
     */
    public String containerPath() {
        return hasValue() ? PipelineDefaults.underMountRoot(mountPath) : null;
    }

    @Override
    public String environmentValue() {
        return hasValue() ? containerPath() : "";
    }

    public enum Role {
        INPUT("Input parameter", "INPUT_"),
        OUTPUT("Output parameter", "OUTPUT_");

        private final String label;
        private final String autoPrefix;

        Role(String label, String autoPrefix) {
            this.label = label;
            this.autoPrefix = autoPrefix;
        }

        public String label() {
            return label;
        }

        public String autoPrefix() {
            return autoPrefix;
        }
    }
}
