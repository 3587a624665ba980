/**
 * Pathway knowledge graph access.
 *
 * <p>{@code PathwayGraphStore} is the read-only view the graph query tool executes generated Cypher
 * against. {@code Neo4jPathwayGraphStore} maps driver failures onto the research error kinds so the
 * generate/execute loop can tell a bad statement from an unreachable database.
 */
package com.hypothesis.knowledge;
