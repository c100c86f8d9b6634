package work.lcod.minsub.params;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.minsub.errors.CollisionException;
import work.lcod.minsub.errors.NameValidationException;
import work.lcod.minsub.errors.UriValidationException;
import work.lcod.minsub.model.FileParam;
import work.lcod.minsub.model.JobParameter;

class ParameterSetBuilderTest {
    @Test
    void parsesEveryParameterClass() {
        var job = new ParameterSetBuilder().build(
            List.of("A=hello", "EMPTY"),
            List.of("F1=gs://bucket/myfile.txt"),
            List.of("F2=gs://bucket/dir/"),
            List.of("FO1=gs://bucket/out.txt"),
            List.of("FO2=gs://bucket/results")
        );

        var envs = new ArrayList<>(job.envs());
        assertEquals("hello", envs.get(0).value());
        assertEquals("EMPTY", envs.get(1).name());
        assertNull(envs.get(1).value());

        var input = job.inputs().iterator().next();
        assertEquals(FileParam.Role.INPUT, input.role());
        assertEquals("gs://bucket/myfile.txt", input.rawValue());
        assertEquals("gs/bucket/myfile.txt", input.mountPath());
        assertFalse(input.recursive());

        var recursiveInput = job.recursiveInputs().iterator().next();
        assertTrue(recursiveInput.recursive());
        assertEquals("gs/bucket/dir/", recursiveInput.mountPath());

        var recursiveOutput = job.recursiveOutputs().iterator().next();
        assertEquals(FileParam.Role.OUTPUT, recursiveOutput.role());
        assertEquals("gs://bucket/results/", recursiveOutput.uri().uri());
    }

    @Test
    void envValueKeepsEverythingAfterFirstEquals() {
        var job = new ParameterSetBuilder().build(List.of("EXPR=a=b=c", "QUOTED='this is my string'"), null, null, null, null);
        var envs = new ArrayList<>(job.envs());
        assertEquals("a=b=c", envs.get(0).value());
        assertEquals("'this is my string'", envs.get(1).value());
    }

    @Test
    void autoNamesUnnamedInputsInOrder() {
        var job = new ParameterSetBuilder().build(
            List.of(),
            List.of("gs://b/one.txt", "gs://b/two.txt", "gs://b/three.txt"),
            List.of(),
            List.of(),
            List.of()
        );
        assertEquals(List.of("INPUT_0", "INPUT_1", "INPUT_2"), names(job.all()));
    }

    @Test
    void counterIsSharedPerRoleAndSkipsNamedValues() {
        var job = new ParameterSetBuilder().build(
            List.of(),
            List.of("gs://b/a.txt", "NAMED=gs://b/b.txt"),
            List.of("gs://b/dir/"),
            List.of("gs://b/out.txt", "=gs://b/out2.txt"),
            List.of("gs://b/outdir/")
        );
        assertEquals(
            List.of("INPUT_0", "NAMED", "INPUT_1", "OUTPUT_0", "OUTPUT_1", "OUTPUT_2"),
            names(job.all())
        );
    }

    @Test
    void buildersDoNotShareCounters() {
        var first = new ParameterSetBuilder().build(List.of(), List.of("gs://b/a.txt"), List.of(), List.of(), List.of());
        var second = new ParameterSetBuilder().build(List.of(), List.of("gs://b/a.txt"), List.of(), List.of(), List.of());
        assertEquals(first.names(), second.names());
    }

    @Test
    void emptyValueDeclaresParameterWithoutPath() {
        var job = new ParameterSetBuilder().build(List.of(), List.of("LATER="), List.of(), List.of("OUT="), List.of());
        var input = job.inputs().iterator().next();
        assertEquals("LATER", input.name());
        assertFalse(input.hasValue());
        assertNull(input.mountPath());
        assertNull(input.uri());
        assertEquals("", input.environmentValue());
    }

    @Test
    void validNamesRoundTripUnchanged() {
        for (var name : List.of("A", "_x", "Mixed_Case_9")) {
            var job = new ParameterSetBuilder().build(
                List.of(name + "=v"), List.of(), List.of(), List.of(), List.of()
            );
            assertEquals(name, job.envs().iterator().next().name());
            var files = new ParameterSetBuilder().build(
                List.of(), List.of(name + "=gs://b/f.txt"), List.of(), List.of(), List.of()
            );
            assertEquals(name, files.inputs().iterator().next().name());
        }
    }

    @Test
    void invalidNamesFailForEveryClass() {
        var builder = new ParameterSetBuilder();
        assertThrows(NameValidationException.class, () -> builder.build(List.of("1X=v"), null, null, null, null));
        assertThrows(NameValidationException.class, () -> builder.build(List.of("=v"), null, null, null, null));
        assertThrows(NameValidationException.class, () -> builder.build(null, List.of("a-b=gs://b/f"), null, null, null));
        assertThrows(NameValidationException.class, () -> builder.build(null, null, List.of("a b=gs://b/d/"), null, null));
        assertThrows(NameValidationException.class, () -> builder.build(null, null, null, List.of("9=gs://b/f"), null));
        var ex = assertThrows(NameValidationException.class, () -> builder.build(null, null, null, null, List.of("x.y=gs://b/d/")));
        assertEquals("Invalid Output parameter: x.y", ex.getMessage());
    }

    @Test
    void uriProblemsSurfaceAsUriValidation() {
        var builder = new ParameterSetBuilder();
        var ex = assertThrows(UriValidationException.class, () -> builder.build(null, List.of("gs://bucket/a[0-9].txt"), null, null, null));
        assertTrue(ex.getMessage().contains("character ranges"));
        assertThrows(UriValidationException.class, () -> builder.build(null, List.of("s3://bucket/a.txt"), null, null, null));
    }

    @Test
    void identicalEntriesCollapse() {
        var job = new ParameterSetBuilder().build(List.of("A=1", "A=1"), null, null, null, null);
        assertEquals(1, job.envs().size());
    }

    @Test
    void collisionsAcrossClassesReportAllNames() {
        var ex = assertThrows(CollisionException.class, () -> new ParameterSetBuilder().build(
            List.of("F1=x", "OUT=y"),
            List.of("F1=gs://b/in.txt"),
            List.of(),
            List.of("OUT=gs://b/out.txt"),
            List.of("INPUT_0=gs://b/dir/")
        ));
        assertEquals(List.of("F1", "OUT"), ex.duplicates());
    }

    @Test
    void generatedNamesTakePartInCollisionChecks() {
        var ex = assertThrows(CollisionException.class, () -> new ParameterSetBuilder().build(
            List.of("INPUT_0=shadow"),
            List.of("gs://b/in.txt"),
            List.of(),
            List.of(),
            List.of()
        ));
        assertEquals(List.of("INPUT_0"), ex.duplicates());
    }

    private static List<String> names(List<JobParameter> parameters) {
        var names = new ArrayList<String>();
        for (var parameter : parameters) {
            names.add(parameter.name());
        }
        return names;
    }
}
