package work.lcod.minsub.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.minsub.model.JobParameterSet;
import work.lcod.minsub.model.RequestDocument;
import work.lcod.minsub.model.ResourceSpec;

class RequestWriterTest {
    @Test
    void writesPrettyAndCompactJson() throws Exception {
        var request = request();
        var pretty = RequestWriter.write(request, OutputFormat.JSON, true);
        var compact = RequestWriter.write(request, OutputFormat.JSON, false);
        assertTrue(pretty.contains("\n"));
        assertFalse(compact.contains("\n"));
        var mapper = new ObjectMapper();
        assertEquals(mapper.readTree(pretty), mapper.readTree(compact));
        assertTrue(compact.startsWith("{\"pipeline\":{\"actions\":"));
    }

    @Test
    void writesYaml() {
        var yaml = RequestWriter.write(request(), OutputFormat.YAML, true);
        assertTrue(yaml.startsWith("pipeline:"));
        assertTrue(yaml.contains("minsub: \"v1\""));
    }

    @Test
    void parsesFormatNames() {
        assertEquals(OutputFormat.JSON, OutputFormat.from(null));
        assertEquals(OutputFormat.YAML, OutputFormat.from(" yaml "));
        assertThrows(IllegalArgumentException.class, () -> OutputFormat.from("xml"));
    }

    private static RequestDocument request() {
        return new RequestAssembler().assemble(
            ResourceSpec.builder().project("p").region("r").build(),
            JobParameterSet.empty(),
            List.of()
        );
    }
}
