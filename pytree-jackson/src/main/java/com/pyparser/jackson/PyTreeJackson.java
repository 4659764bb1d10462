package com.pyparser.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for ObjectMapper instances that read and write syntax trees.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = PyTreeJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(module);
 * Element element = mapper.readValue(json, Element.class);
 * </pre>
 */
public final class PyTreeJackson {

    private PyTreeJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper with the {@link TreeModule} registered.
     *
     * The returned mapper:
     * - Writes leaves as type, value, prefix and start position
     * - Writes nodes as type, start, end and children
     * - Adds the evaluated value of number literals
     * - Rebuilds typed elements on deserialization and ignores unknown properties
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());

        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        mapper.registerModule(new TreeModule());

        return mapper;
    }
}
