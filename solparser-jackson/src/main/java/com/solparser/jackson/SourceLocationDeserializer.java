package com.solparser.jackson;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.solparser.ast.SourceLocation;

import java.io.IOException;

/**
 * Reads the {@code start:length:sourceName} form written by {@link SourceLocationSerializer}.
 * The source name may itself contain colons.
 */
public class SourceLocationDeserializer extends JsonDeserializer<SourceLocation> {
    @Override
    public SourceLocation deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        if (p.currentToken() != JsonToken.VALUE_STRING) {
            return (SourceLocation) ctxt.handleUnexpectedToken(SourceLocation.class, p);
        }
        String text = p.getText();
        String[] parts = text.split(":", 3);
        if (parts.length != 3) {
            return (SourceLocation) ctxt.handleWeirdStringValue(SourceLocation.class, text,
                "expected start:length:sourceName");
        }
        try {
            int start = Integer.parseInt(parts[0]);
            int length = Integer.parseInt(parts[1]);
            if (start < 0) {
                return SourceLocation.empty(parts[2]);
            }
            return new SourceLocation(start, start + length, parts[2]);
        } catch (NumberFormatException e) {
            return (SourceLocation) ctxt.handleWeirdStringValue(SourceLocation.class, text,
                "non-numeric start or length");
        }
    }
}
