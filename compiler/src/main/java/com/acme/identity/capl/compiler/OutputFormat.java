package com.acme.identity.capl.compiler;

import com.acme.identity.capl.util.JsonCodec;
import com.fasterxml.jackson.core.JsonProcessingException;

public enum OutputFormat {
    JSON("json"),
    YAML("yaml");

    private final String extension;

    OutputFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    public String render(Object value) throws JsonProcessingException {
        return this == YAML ? JsonCodec.writeYaml(value) : JsonCodec.writePretty(value);
    }
}
