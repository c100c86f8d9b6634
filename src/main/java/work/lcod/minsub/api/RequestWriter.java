package work.lcod.minsub.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import work.lcod.minsub.model.RequestDocument;

/**
 * Serializes a {@link RequestDocument}; keys keep the order of the wire shape.
 */
public final class RequestWriter {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectMapper YAML = new ObjectMapper(
        new YAMLFactory().disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
    );

    private RequestWriter() {}

    public static String write(RequestDocument request, OutputFormat format, boolean pretty) {
        try {
            if (format == OutputFormat.YAML) {
                return YAML.writeValueAsString(request.toMap());
            }
            return pretty
                ? JSON.writerWithDefaultPrettyPrinter().writeValueAsString(request.toMap())
                : JSON.writeValueAsString(request.toMap());
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize pipelines request: " + ex.getOriginalMessage(), ex);
        }
    }

    public static String toJson(RequestDocument request) {
        return write(request, OutputFormat.JSON, true);
    }
}
