package work.lcod.minsub.cli;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.minsub.actions.UserStep;
import work.lcod.minsub.api.MinsubConfiguration;
import work.lcod.minsub.api.MinsubRequestFactory;
import work.lcod.minsub.api.OutputFormat;
import work.lcod.minsub.api.RequestWriter;
import work.lcod.minsub.config.ConfigPaths;
import work.lcod.minsub.config.ResourceConfigLoader;
import work.lcod.minsub.config.ResourceDefaults;
import work.lcod.minsub.model.PipelineDefaults;
import work.lcod.minsub.model.RequestDocument;
import work.lcod.minsub.model.ResourceSpec;
import work.lcod.minsub.shared.TimeoutFormat;

@CommandLine.Command(
    name = "minsub",
    description = "Build a pipelines API request for a single batch job and print it.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class MinsubCommand implements Callable<Integer> {
    @CommandLine.Option(names = "--project", description = "Cloud project ID.", defaultValue = CommandLine.Option.NULL_VALUE)
    private String project;

    @CommandLine.Option(names = "--region", description = "Region the VM runs in.", defaultValue = CommandLine.Option.NULL_VALUE)
    private String region;

    @CommandLine.Option(
        names = "--machine-type",
        description = "VM machine type (default: " + PipelineDefaults.DEFAULT_MACHINE_TYPE + ").",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String machineType;

    @CommandLine.Option(
        names = "--disk-size",
        description = "Working disk size in GB (default: " + PipelineDefaults.DEFAULT_DISK_SIZE_GB + ").",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Integer diskSize;

    @CommandLine.Option(names = "--service-account", description = "Service account email.", defaultValue = CommandLine.Option.NULL_VALUE)
    private String serviceAccount;

    @CommandLine.Option(names = "--scopes", split = ",", description = "OAuth scopes for the VM.")
    private List<String> scopes = new ArrayList<>();

    @CommandLine.Option(names = "--env", paramLabel = "NAME[=VALUE]", description = "Environment variable.")
    private List<String> envs = new ArrayList<>();

    @CommandLine.Option(names = "--input", paramLabel = "[NAME=]URI", description = "Input file or wildcard.")
    private List<String> inputs = new ArrayList<>();

    @CommandLine.Option(names = "--input-recursive", paramLabel = "[NAME=]URI", description = "Input directory, copied recursively.")
    private List<String> recursiveInputs = new ArrayList<>();

    @CommandLine.Option(names = "--output", paramLabel = "[NAME=]URI", description = "Output file or wildcard.")
    private List<String> outputs = new ArrayList<>();

    @CommandLine.Option(names = "--output-recursive", paramLabel = "[NAME=]URI", description = "Output directory, copied recursively.")
    private List<String> recursiveOutputs = new ArrayList<>();

    @CommandLine.Option(names = "--image", description = "Image the command runs in.", defaultValue = PipelineDefaults.DEBIAN_IMAGE)
    private String image;

    @CommandLine.Option(names = "--command", description = "Bash script to run.", defaultValue = CommandLine.Option.NULL_VALUE)
    private String command;

    @CommandLine.Option(names = "--name", description = "Name of the user action.", defaultValue = "user-command")
    private String name;

    @CommandLine.Option(names = "--step-timeout", description = "Timeout of the user action (e.g. 30m, 6h, 1d).", defaultValue = "1d")
    private String stepTimeoutRaw;

    @CommandLine.Option(names = "--timeout", description = "Timeout of the whole pipeline.", defaultValue = "7d")
    private String timeoutRaw;

    @CommandLine.Option(names = "--config", description = "TOML file with a [resources] table.", defaultValue = CommandLine.Option.NULL_VALUE)
    private String configPath;

    @CommandLine.Option(names = "--format", description = "Output format (json|yaml).", defaultValue = "json")
    private String formatRaw;

    @CommandLine.Option(names = "--compact", description = "Print JSON on a single line.")
    private boolean compact;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        OutputFormat format = parseFormat();
        Duration timeout = parseDuration(timeoutRaw, "--timeout");
        Duration stepTimeout = parseDuration(stepTimeoutRaw, "--step-timeout");

        var builder = MinsubConfiguration.builder()
            .resources(resolveResources())
            .envs(envs)
            .inputs(inputs)
            .recursiveInputs(recursiveInputs)
            .outputs(outputs)
            .recursiveOutputs(recursiveOutputs)
            .timeout(timeout);
        if (command != null && !command.isBlank()) {
            builder.userStep(UserStep.script(name, image, command, stepTimeout));
        }

        RequestDocument request = new MinsubRequestFactory().create(builder.build());
        spec.commandLine().getOut().println(RequestWriter.write(request, format, !compact));
        return 0;
    }

    private ResourceSpec resolveResources() {
        ResourceDefaults defaults = ConfigPaths.locate(configPath)
            .map(ResourceConfigLoader::load)
            .orElseGet(ResourceDefaults::none);
        var builder = defaults.toBuilder();
        if (project != null) {
            builder.project(project);
        }
        if (region != null) {
            builder.region(region);
        }
        if (machineType != null) {
            builder.machineType(machineType);
        }
        if (diskSize != null) {
            builder.diskSizeGb(diskSize);
        }
        if (serviceAccount != null) {
            builder.serviceAccount(serviceAccount);
        }
        if (scopes != null && !scopes.isEmpty()) {
            builder.scopes(scopes);
        }
        return builder.build();
    }

    private OutputFormat parseFormat() {
        try {
            return OutputFormat.from(formatRaw);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
        }
    }

    private Duration parseDuration(String raw, String option) {
        try {
            return TimeoutFormat.parse(raw)
                .orElseThrow(() -> new IllegalArgumentException(option + " must not be empty"));
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
        }
    }
}
