package com.solparser.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for ObjectMapper instances that read and write the AST.
 *
 * <pre>
 * ObjectMapper mapper = SolparserJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(sourceUnit);
 * SourceUnit copy = mapper.readValue(json, SourceUnit.class);
 * </pre>
 */
public final class SolparserJackson {

    private SolparserJackson() {
        // Utility class
    }

    /**
     * Creates a mapper that writes each node with a {@code nodeType} discriminator and
     * a {@code src} range, leaves absent children out, and reads the same form back.
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());

        // Absent optional children are left out rather than written as null
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);

        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        mapper.registerModule(new AstModule());

        return mapper;
    }
}
