package com.acme.identity.capl.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;

/**
 * Shared JSON and YAML codecs for policy records and reports.
 */
public final class JsonCodec {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final ObjectMapper PRETTY = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory()
        .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
        .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES));

    private JsonCodec() {
    }

    public static JsonNode readTree(String raw) throws JsonProcessingException {
        return MAPPER.readTree(raw);
    }

    public static String writeString(Object value) throws JsonProcessingException {
        return MAPPER.writeValueAsString(value);
    }

    public static String writePretty(Object value) throws JsonProcessingException {
        return PRETTY.writeValueAsString(value);
    }

    public static String writeYaml(Object value) throws JsonProcessingException {
        return YAML.writeValueAsString(value);
    }

    public static JsonNode readYamlTree(String raw) throws JsonProcessingException {
        return YAML.readTree(raw);
    }
}
