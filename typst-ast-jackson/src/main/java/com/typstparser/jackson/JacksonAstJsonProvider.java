package com.typstparser.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.typstparser.ast.AstNode;
import com.typstparser.ast.AstParseResult;
import com.typstparser.cst.CstNode;
import com.typstparser.cst.CstParseResult;
import com.typstparser.json.AstJsonDeserializer;
import com.typstparser.json.AstJsonException;
import com.typstparser.json.AstJsonProvider;
import com.typstparser.json.AstJsonSerializer;

/**
 * Jackson-based implementation of AstJsonProvider.
 */
public class JacksonAstJsonProvider implements AstJsonProvider {

    private final ObjectMapper mapper;
    private final AstJsonSerializer serializer;
    private final AstJsonDeserializer deserializer;

    public JacksonAstJsonProvider() {
        this.mapper = TypstJackson.createObjectMapper();
        this.serializer = new JacksonSerializer(mapper);
        this.deserializer = new JacksonDeserializer(mapper);
    }

    @Override
    public AstJsonSerializer getSerializer() {
        return serializer;
    }

    @Override
    public AstJsonDeserializer getDeserializer() {
        return deserializer;
    }

    @Override
    public String getName() {
        return "Jackson";
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getObjectMapper() {
        return mapper;
    }

    // ==================== Inner Classes ====================

    private static class JacksonSerializer implements AstJsonSerializer {
        private final ObjectMapper mapper;

        JacksonSerializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public String serialize(AstParseResult result) throws AstJsonException {
            return write(result, false, "parse result");
        }

        @Override
        public String serialize(CstParseResult result) throws AstJsonException {
            return write(result, false, "parse result");
        }

        @Override
        public String serialize(AstNode node) throws AstJsonException {
            // Written through the base type so that the kind tag is included
            try {
                return mapper.writerFor(AstNode.class).writeValueAsString(node);
            } catch (Exception e) {
                throw new AstJsonException("Failed to serialize " + node.kind() + " node", e);
            }
        }

        @Override
        public String serialize(CstNode node) throws AstJsonException {
            return write(node, false, "syntax node");
        }

        @Override
        public String serializePretty(AstParseResult result) throws AstJsonException {
            return write(result, true, "parse result");
        }

        @Override
        public String serializePretty(CstParseResult result) throws AstJsonException {
            return write(result, true, "parse result");
        }

        private String write(Object value, boolean pretty, String what) {
            try {
                if (pretty) {
                    return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
                }
                return mapper.writeValueAsString(value);
            } catch (Exception e) {
                throw new AstJsonException("Failed to serialize " + what, e);
            }
        }
    }

    private static class JacksonDeserializer implements AstJsonDeserializer {
        private final ObjectMapper mapper;

        JacksonDeserializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public AstParseResult deserializeAst(String json) throws AstJsonException {
            return deserialize(json, AstParseResult.class);
        }

        @Override
        public CstParseResult deserializeCst(String json) throws AstJsonException {
            return deserialize(json, CstParseResult.class);
        }

        @Override
        public <T> T deserialize(String json, Class<T> type) throws AstJsonException {
            try {
                return mapper.readValue(json, type);
            } catch (Exception e) {
                throw new AstJsonException("Failed to deserialize " + type.getSimpleName(), e);
            }
        }
    }
}
