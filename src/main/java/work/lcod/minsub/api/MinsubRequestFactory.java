package work.lcod.minsub.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.minsub.actions.ActionBuilder;
import work.lcod.minsub.model.JobParameterSet;
import work.lcod.minsub.model.RequestDocument;
import work.lcod.minsub.params.ParameterSetBuilder;

/**
 * Public entry point: builds the pipelines request for one job.
 */
public final class MinsubRequestFactory {
    private static final Logger log = LoggerFactory.getLogger(MinsubRequestFactory.class);

    private final ActionBuilder actionBuilder = new ActionBuilder();
    private final RequestAssembler assembler = new RequestAssembler();

    public RequestDocument create(MinsubConfiguration configuration) {
        // Fresh builder per job so auto-generated names always start at 0.
        JobParameterSet job = new ParameterSetBuilder().build(
            configuration.envs(),
            configuration.inputs(),
            configuration.recursiveInputs(),
            configuration.outputs(),
            configuration.recursiveOutputs()
        );
        var actions = actionBuilder.build(job, configuration.userSteps());
        RequestDocument request = assembler.assemble(configuration.resources(), job, actions, configuration.timeout());
        log.debug(
            "Assembled request for project {} in {} with {} actions",
            configuration.resources().project(),
            configuration.resources().region(),
            request.actions().size()
        );
        return request;
    }
}
