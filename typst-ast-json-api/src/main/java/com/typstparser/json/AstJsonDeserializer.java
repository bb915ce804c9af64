package com.typstparser.json;

import com.typstparser.ast.AstParseResult;
import com.typstparser.cst.CstParseResult;

/**
 * Interface for reading parse results and nodes back from JSON.
 */
public interface AstJsonDeserializer {

    /**
     * Deserializes a JSON string to a typed parse result.
     *
     * @param json the JSON string to deserialize
     * @return the deserialized result
     * @throws AstJsonException if deserialization fails
     */
    AstParseResult deserializeAst(String json) throws AstJsonException;

    /**
     * Deserializes a JSON string to a concrete parse result.
     *
     * @param json the JSON string to deserialize
     * @return the deserialized result
     * @throws AstJsonException if deserialization fails
     */
    CstParseResult deserializeCst(String json) throws AstJsonException;

    /**
     * Deserializes a JSON string to a specific type, such as a single node
     * class or a sub-union like {@code Pattern}.
     *
     * @param json the JSON string to deserialize
     * @param type the expected type
     * @param <T> the type
     * @return the deserialized value
     * @throws AstJsonException if deserialization fails
     */
    <T> T deserialize(String json, Class<T> type) throws AstJsonException;
}
