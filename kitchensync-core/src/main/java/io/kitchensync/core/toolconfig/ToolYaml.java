package io.kitchensync.core.toolconfig;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;

public final class ToolYaml {
    private static final ObjectMapper MAPPER = new ObjectMapper(
        YAMLFactory.builder()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
            .disable(YAMLGenerator.Feature.SPLIT_LINES)
            .build()
    );

    private ToolYaml() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static String write(Object document) throws JsonProcessingException {
        return MAPPER.writeValueAsString(document);
    }
}
