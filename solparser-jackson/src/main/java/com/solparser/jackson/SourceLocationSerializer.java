package com.solparser.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.solparser.ast.SourceLocation;

import java.io.IOException;

/**
 * Writes a location as {@code start:length:sourceName}.
 */
public class SourceLocationSerializer extends JsonSerializer<SourceLocation> {
    @Override
    public void serialize(SourceLocation value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
        int length = value.start() < 0 ? 0 : value.length();
        gen.writeString(value.start() + ":" + length + ":" + (value.sourceName() == null ? "" : value.sourceName()));
    }
}
