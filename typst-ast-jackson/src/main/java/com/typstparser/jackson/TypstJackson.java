package com.typstparser.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for creating properly configured ObjectMapper instances for parse
 * result serialization.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = TypstJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(TypstParser.parseAst(text));
 * AstParseResult result = mapper.readValue(json, AstParseResult.class);
 * </pre>
 */
public final class TypstJackson {

    private TypstJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper configured for serialization/deserialization
     * of parse results.
     *
     * The returned mapper:
     * - Handles the polymorphic node types and sub-unions via the "kind" property
     * - Writes ranges as [start, end] arrays
     * - Writes absent optional fields as null, except the text of inner CST nodes, which is omitted
     * - Writes operators and units by their camelCase names
     * - Uses JavaScript-compatible float serialization
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());

        // Absent optional fields are part of the wire shape
        mapper.setSerializationInclusion(JsonInclude.Include.ALWAYS);

        // Marker nodes such as the wildcard import have no fields besides their kind
        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);

        // Ignore unknown properties during deserialization
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        mapper.registerModule(new AstModule());

        return mapper;
    }
}
