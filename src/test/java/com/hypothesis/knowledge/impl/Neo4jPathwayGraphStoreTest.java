package com.hypothesis.knowledge.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hypothesis.configuration.ResearchProperties;
import com.hypothesis.core.ErrorKind;
import com.hypothesis.exception.GraphConnectionException;
import com.hypothesis.exception.QuerySyntaxException;
import com.hypothesis.exception.QueryTimeoutException;
import com.hypothesis.exception.ResearchException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.neo4j.driver.exceptions.AuthenticationException;
import org.neo4j.driver.exceptions.ClientException;
import org.neo4j.driver.exceptions.ServiceUnavailableException;
import org.neo4j.driver.exceptions.TransientException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Statement guard and driver error mapping. No database is needed.
 */
@DisplayName("Neo4j Pathway Graph Store Tests")
class Neo4jPathwayGraphStoreTest {

    @Test
    @DisplayName("Should accept read-only Cypher")
    void isQuerySafe_shouldAcceptReads() {
        assertThat(Neo4jPathwayGraphStore.isQuerySafe(
            "MATCH (g:Gene)-[:REGULATES]->(t:Gene) WHERE toLower(g.name) = 'insr' RETURN g.name AS source, t.name AS target"))
            .isTrue();
        assertThat(Neo4jPathwayGraphStore.isQuerySafe(
            "MATCH (p:Pathway) RETURN p.dataset, p.offset, p.created_at LIMIT 10")).isTrue();
    }

    @Test
    @DisplayName("Should ignore clause keywords inside literals, quoted names and comments")
    void isQuerySafe_shouldIgnoreKeywordsInLiterals() {
        assertThat(Neo4jPathwayGraphStore.isQuerySafe(
            "MATCH (g:Gene)-[:REGULATES]->(t) WHERE g.name = 'SET' RETURN g.name AS source, t.name AS target"))
            .isTrue();
        assertThat(Neo4jPathwayGraphStore.isQuerySafe(
            "MATCH (g:Gene) WHERE toString(g.name) IN [\"SET\", \"MERGE\\\"D\"] RETURN g")).isTrue();
        assertThat(Neo4jPathwayGraphStore.isQuerySafe("MATCH (g:Gene) RETURN g.`set` AS flag")).isTrue();
        assertThat(Neo4jPathwayGraphStore.isQuerySafe(
            "MATCH (g:Gene) // never DELETE here\nRETURN g /* no CREATE either */")).isTrue();
        assertThat(Neo4jPathwayGraphStore.isQuerySafe(
            "MATCH (g:Gene) WHERE g.name = 'SET' DETACH DELETE g")).isFalse();
    }

    @Test
    @DisplayName("Should reject statements with write clauses")
    void isQuerySafe_shouldRejectWrites() {
        assertThat(Neo4jPathwayGraphStore.isQuerySafe("MATCH (n) DETACH DELETE n")).isFalse();
        assertThat(Neo4jPathwayGraphStore.isQuerySafe("MATCH (g:Gene) set g.flag = true")).isFalse();
        assertThat(Neo4jPathwayGraphStore.isQuerySafe("MERGE (g:Gene {name: 'X'})")).isFalse();
        assertThat(Neo4jPathwayGraphStore.isQuerySafe("LOAD  CSV FROM 'file:///x' AS row RETURN row")).isFalse();
    }

    @Test
    @DisplayName("Should refuse empty and write statements before touching the database")
    void executeRead_shouldValidateFirst() {
        Neo4jPathwayGraphStore store = new Neo4jPathwayGraphStore(new ResearchProperties(), new ObjectMapper());

        assertThatThrownBy(() -> store.executeRead(" ", 50, 5000))
            .isInstanceOf(QuerySyntaxException.class);
        assertThatThrownBy(() -> store.executeRead("CREATE (g:Gene {name: 'X'}) RETURN g", 50, 5000))
            .isInstanceOf(QuerySyntaxException.class)
            .hasMessageContaining("only read queries");
    }

    @Test
    @DisplayName("Should map driver failures onto research error kinds")
    void translate_shouldMapDriverErrors() {
        ResearchException syntax = Neo4jPathwayGraphStore.translate(
            new ClientException("Neo.ClientError.Statement.SyntaxError", "Invalid input 'RETRUN'"));
        assertThat(syntax).isInstanceOf(QuerySyntaxException.class);
        assertThat(syntax.isRetryable()).isTrue();

        ResearchException procedure = Neo4jPathwayGraphStore.translate(
            new ClientException("Neo.ClientError.Procedure.ProcedureNotFound", "no apoc"));
        assertThat(procedure.getKind()).isEqualTo(ErrorKind.QUERY_SYNTAX);

        ResearchException timeout = Neo4jPathwayGraphStore.translate(
            new ClientException("Neo.ClientError.Transaction.TransactionTimedOut", "timed out"));
        assertThat(timeout).isInstanceOf(QueryTimeoutException.class);
        assertThat(timeout.isRetryable()).isTrue();

        ResearchException transientError = Neo4jPathwayGraphStore.translate(
            new TransientException("Neo.TransientError.General.MemoryPoolOutOfMemoryError", "busy"));
        assertThat(transientError.getKind()).isEqualTo(ErrorKind.QUERY_TIMEOUT);

        ResearchException unavailable = Neo4jPathwayGraphStore.translate(
            new ServiceUnavailableException("Unable to connect to localhost:7687"));
        assertThat(unavailable).isInstanceOf(GraphConnectionException.class);
        assertThat(unavailable.isRetryable()).isFalse();
        assertThat(unavailable.getKind().isFatal()).isTrue();

        ResearchException auth = Neo4jPathwayGraphStore.translate(
            new AuthenticationException("Neo.ClientError.Security.Unauthorized", "bad credentials"));
        assertThat(auth.getKind()).isEqualTo(ErrorKind.CONNECTION);
    }
}
