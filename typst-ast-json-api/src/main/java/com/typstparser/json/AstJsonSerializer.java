package com.typstparser.json;

import com.typstparser.ast.AstNode;
import com.typstparser.ast.AstParseResult;
import com.typstparser.cst.CstNode;
import com.typstparser.cst.CstParseResult;

/**
 * Interface for serializing parse results and single nodes to JSON.
 */
public interface AstJsonSerializer {

    /**
     * Serializes a typed parse result to a JSON string of the form
     * {@code {"root": [...], "errors": [...]}}.
     *
     * @param result the parse result to serialize
     * @return the JSON representation of the result
     * @throws AstJsonException if serialization fails
     */
    String serialize(AstParseResult result) throws AstJsonException;

    /**
     * Serializes a concrete parse result to a JSON string.
     *
     * @param result the parse result to serialize
     * @return the JSON representation of the result
     * @throws AstJsonException if serialization fails
     */
    String serialize(CstParseResult result) throws AstJsonException;

    /**
     * Serializes a single typed node.
     *
     * @param node the node to serialize
     * @return the JSON representation of the node
     * @throws AstJsonException if serialization fails
     */
    String serialize(AstNode node) throws AstJsonException;

    String serialize(CstNode node) throws AstJsonException;

    /**
     * Serializes a typed parse result to a pretty-printed JSON string.
     *
     * @param result the parse result to serialize
     * @return the pretty-printed JSON representation of the result
     * @throws AstJsonException if serialization fails
     */
    String serializePretty(AstParseResult result) throws AstJsonException;

    String serializePretty(CstParseResult result) throws AstJsonException;
}
