package com.hypothesis.knowledge.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hypothesis.configuration.ResearchProperties;
import com.hypothesis.core.GraphFragment;
import com.hypothesis.exception.GraphConnectionException;
import com.hypothesis.exception.QuerySyntaxException;
import com.hypothesis.exception.QueryTimeoutException;
import com.hypothesis.exception.ResearchException;
import com.hypothesis.knowledge.GraphRows;
import com.hypothesis.knowledge.PathwayGraphStore;
import com.hypothesis.util.CallContext;
import com.hypothesis.util.ExternalCallLogger;
import com.hypothesis.util.ServiceType;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.neo4j.driver.Record;
import org.neo4j.driver.Result;
import org.neo4j.driver.Session;
import org.neo4j.driver.TransactionConfig;
import org.neo4j.driver.exceptions.AuthenticationException;
import org.neo4j.driver.exceptions.Neo4jException;
import org.neo4j.driver.exceptions.ServiceUnavailableException;
import org.neo4j.driver.exceptions.SessionExpiredException;
import org.neo4j.driver.exceptions.TransientException;
import org.neo4j.driver.types.Node;
import org.neo4j.driver.types.Path;
import org.neo4j.driver.types.Relationship;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Neo4j implementation of {@link PathwayGraphStore}.
 *
 * <p>Every statement runs in a read transaction with the configured timeout. Statements containing
 * write clauses are rejected before they reach the database.
 */
@Slf4j
@Service
public class Neo4jPathwayGraphStore implements PathwayGraphStore {

    private static final Pattern WRITE_CLAUSE = Pattern.compile(
        "\\b(CREATE|MERGE|DELETE|DETACH|REMOVE|SET|DROP|LOAD\\s+CSV|FOREACH)\\b",
        Pattern.CASE_INSENSITIVE);

    private static final Pattern LITERAL_OR_COMMENT = Pattern.compile(
        "'(?:[^'\\\\]|\\\\.)*'|\"(?:[^\"\\\\]|\\\\.)*\"|`[^`]*`|//[^\\n]*|/\\*.*?\\*/",
        Pattern.DOTALL);

    @Value("${neo4j.uri:bolt://localhost:7687}")
    private String neo4jUri;

    @Value("${neo4j.username:neo4j}")
    private String neo4jUsername;

    @Value("${neo4j.password:password}")
    private String neo4jPassword;

    private final ResearchProperties properties;
    private final ObjectMapper objectMapper;

    private Driver driver;
    private volatile String cachedSchema;

    public Neo4jPathwayGraphStore(ResearchProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void init() {
        log.info("Initializing Neo4j pathway graph at: {}", neo4jUri);
        driver = GraphDatabase.driver(neo4jUri, AuthTokens.basic(neo4jUsername, neo4jPassword));
    }

    @PreDestroy
    public void close() {
        if (driver != null) {
            driver.close();
            log.info("Neo4j pathway graph connection closed");
        }
    }

    @Override
    public GraphRows executeRead(String cypher, int maxRows, int maxEdges) {
        if (cypher == null || cypher.isBlank()) {
            throw new QuerySyntaxException("Empty Cypher statement");
        }
        if (!isQuerySafe(cypher)) {
            throw new QuerySyntaxException("Statement contains write clauses; only read queries are allowed");
        }

        CallContext ctx = ExternalCallLogger.startCall(ServiceType.NEO4J, "Read", log);
        ctx.logRequest(ExternalCallLogger.truncate(cypher, 200), "timeout", properties.getGraphQueryTimeout());

        TransactionConfig config = TransactionConfig.builder()
            .withTimeout(properties.getGraphQueryTimeout())
            .build();

        try (Session session = driver.session()) {
            GraphRows rows = session.executeRead(tx -> {
                Result result = tx.run(cypher);
                List<Map<String, Object>> kept = new ArrayList<>();
                List<Map<String, Object>> edges = new ArrayList<>();
                int total = 0;
                int totalEdges = 0;
                while (result.hasNext()) {
                    Record record = result.next();
                    if (total < maxRows) {
                        kept.add(toRow(record));
                    }
                    total++;
                    if (isEdge(record)) {
                        if (totalEdges < maxEdges) {
                            edges.add(toEdgeRow(record));
                        }
                        totalEdges++;
                    }
                }
                return new GraphRows(kept, total, edges, totalEdges);
            }, config);

            ctx.logResponse("rows=" + rows.totalRows() + (rows.isTruncated() ? " (truncated to " + maxRows + ")" : "")
                + ", edges=" + rows.totalEdges() + (rows.isEdgesTruncated() ? " (truncated to " + maxEdges + ")" : ""));
            return rows;

        } catch (Neo4jException e) {
            ResearchException mapped = translate(e);
            ctx.logError(mapped.getKind() + ": " + e.getMessage(), e);
            throw mapped;
        }
    }

    @Override
    public String getSchema() {
        String schema = cachedSchema;
        if (schema != null) {
            return schema;
        }

        CallContext ctx = ExternalCallLogger.startCall(ServiceType.NEO4J, "Schema", log);
        ctx.logRequest("apoc.meta.schema");

        try (Session session = driver.session()) {
            try {
                schema = session.executeRead(tx -> toJson(
                    tx.run("CALL apoc.meta.schema() YIELD value RETURN value").single().get("value").asMap()));
            } catch (Neo4jException e) {
                if (isConnectionFailure(e)) {
                    throw e;
                }
                log.warn("apoc.meta.schema unavailable ({}), falling back to db procedures", e.code());
                schema = session.executeRead(tx -> {
                    Map<String, Object> basic = new LinkedHashMap<>();
                    basic.put("labels", tx.run("CALL db.labels() YIELD label RETURN collect(label) AS labels")
                        .single().get("labels").asList());
                    basic.put("relationshipTypes", tx.run(
                        "CALL db.relationshipTypes() YIELD relationshipType RETURN collect(relationshipType) AS types")
                        .single().get("types").asList());
                    basic.put("propertyKeys", tx.run(
                        "CALL db.propertyKeys() YIELD propertyKey RETURN collect(propertyKey) AS keys")
                        .single().get("keys").asList());
                    return toJson(basic);
                });
            }

            ctx.logResponse("schema=" + schema.length() + " chars");
            cachedSchema = schema;
            return schema;

        } catch (Neo4jException e) {
            ResearchException mapped = translate(e);
            ctx.logError(e.getMessage(), e);
            throw mapped instanceof GraphConnectionException
                ? mapped
                : new GraphConnectionException("Cannot read graph schema: " + e.getMessage(), e);
        }
    }

    /**
     * Rejects statements with write clauses. Matches whole words outside string literals, quoted
     * identifiers and comments, so a gene named {@code SET} or an {@code offset} property is not
     * mistaken for a clause.
     */
    public static boolean isQuerySafe(String cypher) {
        String clauses = LITERAL_OR_COMMENT.matcher(cypher).replaceAll(" ");
        return !WRITE_CLAUSE.matcher(clauses).find();
    }

    /**
     * Maps a driver failure onto the research error kinds.
     */
    static ResearchException translate(Neo4jException e) {
        if (isConnectionFailure(e)) {
            return new GraphConnectionException("Graph database unavailable: " + e.getMessage(), e);
        }
        String code = e.code() != null ? e.code() : "";
        if (code.contains("TimedOut") || code.contains("Terminated") || e instanceof TransientException) {
            return new QueryTimeoutException("Graph query timed out: " + e.getMessage(), e);
        }
        if (code.contains(".Statement.") || code.contains(".Procedure.") || code.contains("SyntaxError")) {
            return new QuerySyntaxException("Invalid Cypher: " + e.getMessage(), e);
        }
        return new GraphConnectionException("Graph database error " + code + ": " + e.getMessage(), e);
    }

    private static boolean isConnectionFailure(Neo4jException e) {
        return e instanceof ServiceUnavailableException
            || e instanceof SessionExpiredException
            || e instanceof AuthenticationException;
    }

    private static boolean isEdge(Record record) {
        return record.containsKey(GraphFragment.SOURCE) && !record.get(GraphFragment.SOURCE).isNull()
            && record.containsKey(GraphFragment.TARGET) && !record.get(GraphFragment.TARGET).isNull();
    }

    private Map<String, Object> toEdgeRow(Record record) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (String key : List.of(GraphFragment.SOURCE, GraphFragment.TARGET, GraphFragment.RELATION)) {
            if (record.containsKey(key)) {
                row.put(key, toPlain(record.get(key).asObject()));
            }
        }
        return row;
    }

    private Map<String, Object> toRow(Record record) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (String key : record.keys()) {
            row.put(key, toPlain(record.get(key).asObject()));
        }
        return row;
    }

    /**
     * Replaces driver graph types with maps and lists so rows serialize as plain JSON.
     */
    private Object toPlain(Object value) {
        if (value instanceof Node node) {
            Map<String, Object> map = new LinkedHashMap<>(node.asMap(this::toPlainValue));
            List<String> labels = new ArrayList<>();
            node.labels().forEach(labels::add);
            map.put("labels", labels);
            return map;
        }
        if (value instanceof Relationship rel) {
            Map<String, Object> map = new LinkedHashMap<>(rel.asMap(this::toPlainValue));
            map.put("type", rel.type());
            return map;
        }
        if (value instanceof Path path) {
            List<Object> nodes = new ArrayList<>();
            path.nodes().forEach(n -> nodes.add(toPlain(n)));
            return nodes;
        }
        if (value instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            list.forEach(item -> out.add(toPlain(item)));
            return out;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> out = new LinkedHashMap<>();
            map.forEach((k, v) -> out.put(String.valueOf(k), toPlain(v)));
            return out;
        }
        return value;
    }

    private Object toPlainValue(org.neo4j.driver.Value value) {
        return toPlain(value.asObject());
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }
}
