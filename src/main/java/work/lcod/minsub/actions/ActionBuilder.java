package work.lcod.minsub.actions;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.minsub.model.ActionSpec;
import work.lcod.minsub.model.FileParam;
import work.lcod.minsub.model.JobParameterSet;
import work.lcod.minsub.model.Mount;
import work.lcod.minsub.model.PipelineDefaults;

/**
 * Lays out the pipeline actions: localize, the user steps, delocalize.
 *
 * <p>Single files are copied with {@code gsutil cp}, recursive parameters are
 * synchronised with {@code gsutil rsync -r}. A wildcard value copies into or out
 * of its containing directory. Parameters without a value are skipped.</p>
 */
public final class ActionBuilder {
    public static final String LOCALIZE = "localize";
    public static final String DELOCALIZE = "delocalize";

    private static final Logger log = LoggerFactory.getLogger(ActionBuilder.class);

    private static final String COPY = "gsutil -mq cp %s %s";
    private static final String SYNC = "gsutil -mq rsync -r %s %s";
    private static final String MKDIR = "mkdir -p %s";

    public List<ActionSpec> build(JobParameterSet job, List<UserStep> userSteps) {
        List<ActionSpec> actions = new ArrayList<>();
        actions.add(localize(job));
        if (userSteps != null) {
            for (UserStep step : userSteps) {
                actions.add(userAction(step));
            }
        }
        actions.add(delocalize(job));
        log.debug("Built {} actions", actions.size());
        return actions;
    }

    ActionSpec localize(JobParameterSet job) {
        List<String> lines = new ArrayList<>();
        appendInputs(lines, job.inputs());
        appendInputs(lines, job.recursiveInputs());
        return transferAction(LOCALIZE, lines);
    }

    ActionSpec delocalize(JobParameterSet job) {
        List<String> lines = new ArrayList<>();
        appendOutputs(lines, job.outputs());
        appendOutputs(lines, job.recursiveOutputs());
        return transferAction(DELOCALIZE, lines);
    }

    private static void appendInputs(List<String> lines, Collection<FileParam> inputs) {
        for (FileParam input : inputs) {
            if (!input.hasValue()) {
                log.debug("Input {} has no value, nothing to localize", input.name());
                continue;
            }
            String source = input.uri().uri();
            String containerPath = input.containerPath();
            if (input.recursive()) {
                lines.add(String.format(MKDIR, BashScript.quote(containerPath)));
                lines.add(String.format(SYNC, BashScript.quote(source), BashScript.quote(containerPath)));
                continue;
            }
            String directory = containerDirectory(input);
            lines.add(String.format(MKDIR, BashScript.quote(directory)));
            String target = input.uri().hasWildcard() ? directory : containerPath;
            lines.add(String.format(COPY, BashScript.quote(source), BashScript.quote(target)));
        }
    }

    private static void appendOutputs(List<String> lines, Collection<FileParam> outputs) {
        for (FileParam output : outputs) {
            if (!output.hasValue()) {
                log.debug("Output {} has no value, nothing to delocalize", output.name());
                continue;
            }
            String containerPath = output.containerPath();
            if (output.recursive()) {
                lines.add(String.format(SYNC, BashScript.quote(containerPath), BashScript.quote(output.uri().uri())));
                continue;
            }
            String target = output.uri().hasWildcard() ? output.uri().path() : output.uri().uri();
            lines.add(String.format(COPY, BashScript.quote(containerPath), BashScript.quote(target)));
        }
    }

    private static String containerDirectory(FileParam param) {
        String containerPath = param.containerPath();
        return containerPath.substring(0, containerPath.lastIndexOf('/') + 1);
    }

    private static ActionSpec transferAction(String name, List<String> lines) {
        return new ActionSpec(
            name,
            PipelineDefaults.CLOUD_SDK_IMAGE,
            Optional.of(PipelineDefaults.BASH_ENTRYPOINT),
            BashScript.bashCommands(BashScript.strict(lines)),
            Map.of(),
            List.of(),
            List.of(Mount.dataDisk()),
            PipelineDefaults.ONE_DAY
        );
    }

    private static ActionSpec userAction(UserStep step) {
        return new ActionSpec(
            step.name(),
            step.image(),
            step.entrypoint(),
            step.commands(),
            step.environment(),
            step.flags(),
            List.of(Mount.dataDisk()),
            step.timeout()
        );
    }
}
