package com.hypothesis.knowledge;

/**
 * Read access to the KEGG pathway graph.
 *
 * <p>Nodes are genes, GO terms and pathways; relationships carry regulation, participation and
 * annotation. Writes are never issued.
 */
public interface PathwayGraphStore {

    /**
     * Run a read-only Cypher statement.
     *
     * @param cypher   statement generated for a sub-query
     * @param maxRows  rows kept; the rest are only counted
     * @param maxEdges source/target edges kept for graph analysis; the rest are only counted
     * @throws com.hypothesis.exception.QuerySyntaxException  invalid or write statement
     * @throws com.hypothesis.exception.QueryTimeoutException statement exceeded its timeout
     * @throws com.hypothesis.exception.GraphConnectionException database unreachable
     */
    GraphRows executeRead(String cypher, int maxRows, int maxEdges);

    /**
     * Labels, relationship types and properties, as text for query generation prompts. Cached.
     */
    String getSchema();
}
