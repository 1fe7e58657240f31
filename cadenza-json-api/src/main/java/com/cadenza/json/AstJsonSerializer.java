package com.cadenza.json;

import com.cadenza.ast.Node;
import com.cadenza.ast.NodeAnnotations;

/**
 * Interface for exporting a node graph to JSON.
 *
 * <p>The output is a flat table of nodes numbered exactly as {@code GraphPrinter} numbers them,
 * with references between nodes written as {@code {"$ref": n}}, so shared and cyclic
 * graphs export without repetition.</p>
 */
public interface AstJsonSerializer {

    /**
     * Serializes the graph reachable from a node to a JSON string.
     *
     * @param root the root of the graph
     * @return the JSON representation of the graph
     * @throws AstJsonException if serialization fails
     */
    String serialize(Node root) throws AstJsonException;

    /**
     * Serializes the graph reachable from a node, including annotations attached by later phases.
     *
     * @param root        the root of the graph
     * @param annotations annotations to export alongside the declared fields
     * @return the JSON representation of the graph
     * @throws AstJsonException if serialization fails
     */
    String serialize(Node root, NodeAnnotations annotations) throws AstJsonException;

    /**
     * Serializes the graph reachable from a node to a pretty-printed JSON string.
     *
     * @param root the root of the graph
     * @return the pretty-printed JSON representation of the graph
     * @throws AstJsonException if serialization fails
     */
    String serializePretty(Node root) throws AstJsonException;
}
