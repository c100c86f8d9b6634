package work.lcod.minsub.actions;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import work.lcod.minsub.model.ActionSpec;
import work.lcod.minsub.model.JobParameterSet;
import work.lcod.minsub.model.Mount;
import work.lcod.minsub.params.ParameterSetBuilder;

class ActionBuilderTest {
    private final ActionBuilder builder = new ActionBuilder();

    @Test
    void ordersLocalizeUserStepsDelocalize() {
        var steps = List.of(
            UserStep.of("first", "debian:stable-slim", List.of("-c", "true")),
            UserStep.of("second", "ubuntu:22.04", List.of("-c", "true"))
        );
        var actions = builder.build(JobParameterSet.empty(), steps);
        assertEquals(
            List.of("localize", "first", "second", "delocalize"),
            actions.stream().map(ActionSpec::name).toList()
        );
    }

    @Test
    void alwaysEmitsTransferActions() {
        var actions = builder.build(JobParameterSet.empty(), null);
        assertEquals(2, actions.size());
        assertEquals(BashScript.strict(""), actions.get(0).commands().get(1));
    }

    @Test
    void localizeCopiesFilesAndSyncsDirectories() {
        var job = job(
            List.of("F1=gs://bucket/myfile.txt", "gs://bucket/logs/*.log"),
            List.of("F2=gs://bucket/dir/"),
            List.of(),
            List.of()
        );
        var localize = builder.build(job, List.of()).get(0);
        var script = script(localize);

        assertEquals("google/cloud-sdk:slim", localize.imageUri());
        assertEquals(Optional.of("/bin/bash"), localize.entrypoint());
        assertEquals(Duration.ofDays(1), localize.timeout());
        assertEquals(List.of(Mount.dataDisk()), localize.mounts());
        assertTrue(script.startsWith("set -o errexit\nset -o nounset\nset -o pipefail\n"));
        assertTrue(script.contains("gsutil -mq cp \"gs://bucket/myfile.txt\" \"/mnt/data/gs/bucket/myfile.txt\""));
        assertTrue(script.contains("mkdir -p \"/mnt/data/gs/bucket/logs/\""));
        assertTrue(script.contains("gsutil -mq cp \"gs://bucket/logs/*.log\" \"/mnt/data/gs/bucket/logs/\""));
        assertTrue(script.contains("gsutil -mq rsync -r \"gs://bucket/dir/\" \"/mnt/data/gs/bucket/dir/\""));
        assertTrue(
            script.indexOf("myfile.txt") < script.indexOf("rsync"),
            "single files are localized before directories"
        );
    }

    @Test
    void delocalizeMirrorsLocalize() {
        var job = job(
            List.of(),
            List.of(),
            List.of("FO1=gs://bucket/out.txt", "gs://bucket/out/*.vcf"),
            List.of("FO2=gs://bucket/results/")
        );
        var delocalize = builder.build(job, List.of()).get(1);
        var script = script(delocalize);

        assertEquals("delocalize", delocalize.name());
        assertTrue(script.contains("gsutil -mq cp \"/mnt/data/gs/bucket/out.txt\" \"gs://bucket/out.txt\""));
        assertTrue(script.contains("gsutil -mq cp \"/mnt/data/gs/bucket/out/*.vcf\" \"gs://bucket/out/\""));
        assertTrue(script.contains("gsutil -mq rsync -r \"/mnt/data/gs/bucket/results/\" \"gs://bucket/results/\""));
        assertFalse(script.contains("mkdir"));
    }

    @Test
    void skipsParametersWithoutValue() {
        var job = job(List.of("LATER="), List.of(), List.of("OUT="), List.of());
        var actions = builder.build(job, List.of());
        assertFalse(script(actions.get(0)).contains("gsutil"));
        assertFalse(script(actions.get(1)).contains("gsutil"));
    }

    @Test
    void userStepsKeepTheirSettings() {
        var step = UserStep.script("run", "debian:stable-slim", "echo \"${A}\"", Duration.ofHours(2));
        var action = builder.build(JobParameterSet.empty(), List.of(step)).get(1);
        assertEquals("run", action.name());
        assertEquals(Duration.ofHours(2), action.timeout());
        assertEquals(List.of(Mount.dataDisk()), action.mounts());
        assertEquals("-c", action.commands().get(0));
        assertTrue(action.commands().get(1).endsWith("echo \"${A}\"\n"));
    }

    @Test
    void userStepEnvironmentKeepsInsertionOrder() {
        var names = List.of("ALPHA", "BETA", "GAMMA", "DELTA", "EPSILON", "ZETA", "ETA", "THETA");
        var environment = new LinkedHashMap<String, String>();
        for (var name : names) {
            environment.put(name, name.toLowerCase());
        }
        var step = UserStep.of("env", "alpine", List.of("-c", "env")).withEnvironment(environment);
        assertEquals(names, List.copyOf(step.environment().keySet()));

        var action = builder.build(JobParameterSet.empty(), List.of(step)).get(1);
        @SuppressWarnings("unchecked")
        var rendered = (Map<String, String>) action.toMap().get("environment");
        assertEquals(names, List.copyOf(rendered.keySet()));
    }

    @Test
    void rawUserCommandsPassThrough() {
        var step = UserStep.of("raw", "alpine", List.of("-c", "ls /mnt/data"));
        var action = builder.build(JobParameterSet.empty(), List.of(step)).get(1);
        assertEquals(List.of("-c", "ls /mnt/data"), action.commands());
    }

    @Test
    void quotesShellMetacharacters() {
        assertEquals("\"plain\"", BashScript.quote("plain"));
        assertEquals("\"a\\\"b\\$c\\`d\\\\e\"", BashScript.quote("a\"b$c`d\\e"));
    }

    private static JobParameterSet job(
        List<String> inputs,
        List<String> recursiveInputs,
        List<String> outputs,
        List<String> recursiveOutputs
    ) {
        return new ParameterSetBuilder().build(List.of(), inputs, recursiveInputs, outputs, recursiveOutputs);
    }

    private static String script(ActionSpec action) {
        assertEquals("-c", action.commands().get(0));
        return action.commands().get(1);
    }
}
