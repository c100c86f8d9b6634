package work.lcod.minsub.params;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.minsub.model.EnvParam;
import work.lcod.minsub.model.FileParam;
import work.lcod.minsub.model.JobParameterSet;
import work.lcod.minsub.uri.UriNormalizer;

/**
 * Turns raw flag values into a {@link JobParameterSet}.
 *
 * <p>Env values are {@code NAME=value} or a bare {@code NAME}. File values are
 * {@code NAME=uri} or a bare {@code uri}; unnamed inputs and outputs are numbered
 * per builder, recursive and non-recursive values sharing one counter per role.
 * A builder is meant for a single job; reusing it continues the numbering.</p>
 */
public final class ParameterSetBuilder {
    private static final Logger log = LoggerFactory.getLogger(ParameterSetBuilder.class);

    private final FileParamFactory inputFactory;
    private final FileParamFactory outputFactory;

    public ParameterSetBuilder() {
        this(new UriNormalizer());
    }

    public ParameterSetBuilder(UriNormalizer normalizer) {
        Objects.requireNonNull(normalizer, "normalizer");
        this.inputFactory = new FileParamFactory(FileParam.Role.INPUT, normalizer);
        this.outputFactory = new FileParamFactory(FileParam.Role.OUTPUT, normalizer);
    }

    public JobParameterSet build(
        List<String> envs,
        List<String> inputs,
        List<String> recursiveInputs,
        List<String> outputs,
        List<String> recursiveOutputs
    ) {
        Set<EnvParam> envParams = parseEnvs(envs);
        Set<FileParam> inputParams = parseFiles(inputFactory, inputs, false);
        Set<FileParam> recursiveInputParams = parseFiles(inputFactory, recursiveInputs, true);
        Set<FileParam> outputParams = parseFiles(outputFactory, outputs, false);
        Set<FileParam> recursiveOutputParams = parseFiles(outputFactory, recursiveOutputs, true);

        var job = new JobParameterSet(
            envParams,
            inputParams,
            recursiveInputParams,
            outputParams,
            recursiveOutputParams
        );
        log.debug(
            "Built job parameters: {} env, {} input, {} recursive input, {} output, {} recursive output",
            envParams.size(),
            inputParams.size(),
            recursiveInputParams.size(),
            outputParams.size(),
            recursiveOutputParams.size()
        );
        return job;
    }

    static Set<EnvParam> parseEnvs(List<String> values) {
        Set<EnvParam> params = new LinkedHashSet<>();
        for (String raw : nullToEmpty(values)) {
            var pair = PairSplitter.nameRequired(raw, '=');
            params.add(new EnvParam(pair.name(), pair.value()));
        }
        return params;
    }

    private static Set<FileParam> parseFiles(FileParamFactory factory, List<String> values, boolean recursive) {
        Set<FileParam> params = new LinkedHashSet<>();
        for (String raw : nullToEmpty(values)) {
            var pair = PairSplitter.nameOptional(raw, '=');
            String name = factory.variableName(pair.name());
            params.add(factory.make(name, pair.value(), recursive));
        }
        return params;
    }

    private static List<String> nullToEmpty(List<String> values) {
        return values == null ? List.of() : values;
    }
}
