package work.lcod.minsub.cli;

import java.util.Optional;
import picocli.CommandLine;
import work.lcod.minsub.model.PipelineDefaults;

/**
 * Reports the build version together with the request label stamped on every
 * generated pipeline, so a printed request can be traced back to the tool.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    static final String UNRELEASED = "development";

    @Override
    public String[] getVersion() {
        return new String[] {
            "minsub " + buildVersion(),
            "request label: " + PipelineDefaults.LABEL_KEY + "=" + PipelineDefaults.LABEL_VALUE
        };
    }

    static String buildVersion() {
        return Optional.ofNullable(MinsubCommand.class.getPackage())
            .map(Package::getImplementationVersion)
            .orElse(UNRELEASED);
    }
}
