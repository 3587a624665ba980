package com.hypothesis.annotation.impl;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.hypothesis.annotation.AnnotationDataset;
import com.hypothesis.annotation.AnnotationFilter;
import com.hypothesis.annotation.AnnotationFilter.Condition;
import com.hypothesis.annotation.EvidenceCodes;
import com.hypothesis.annotation.FilterOperator;
import com.hypothesis.configuration.GafProperties;
import com.hypothesis.core.AnnotationPayload;
import com.hypothesis.exception.DatasetUnavailableException;
import com.hypothesis.exception.FilterSyntaxException;
import com.hypothesis.util.CallContext;
import com.hypothesis.util.ExternalCallLogger;
import com.hypothesis.util.ServiceType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * GO annotation table read from a GAF 2.x file.
 *
 * <p>The file is parsed on first use and then shared read-only. A load failure is not cached,
 * so a file that appears later is picked up by the next query.
 */
@Slf4j
@Service
public class GafAnnotationDataset implements AnnotationDataset {

    public static final List<String> GAF_COLUMNS = ImmutableList.of(
        "DB", "DB_Object_ID", "DB_Object_Symbol", "Qualifier", "GO_ID", "DB:Reference", "Evidence", "With",
        "Aspect", "DB_Object_Name", "Synonym", "DB_Object_Type", "Taxon", "Date", "Assigned_By",
        "Annotation_Extension", "Gene_Product_Form_ID");

    public static final String EVIDENCE_DESCRIPTION = "Evidence_Description";
    public static final String COUNT = "count";

    private static final List<String> COLUMNS = ImmutableList.<String>builder()
        .addAll(GAF_COLUMNS)
        .add(EVIDENCE_DESCRIPTION)
        .build();

    private static final int EVIDENCE_INDEX = GAF_COLUMNS.indexOf("Evidence");
    private static final Splitter TAB = Splitter.on('\t');

    private final Path filePath;
    private volatile List<String[]> rows;

    public GafAnnotationDataset(GafProperties properties) {
        this.filePath = Paths.get(properties.getFilePath());
    }

    @Override
    public List<String> columns() {
        return COLUMNS;
    }

    @Override
    public String describeSchema() {
        List<String[]> table = table();
        StringBuilder sb = new StringBuilder();
        sb.append("Table 'gaf' with ").append(table.size()).append(" rows. Columns:\n");
        for (int i = 0; i < COLUMNS.size(); i++) {
            sb.append("- ").append(COLUMNS.get(i));
            if (!table.isEmpty()) {
                sb.append(" (e.g. '").append(table.get(0)[i]).append("')");
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    @Override
    public AnnotationPayload query(AnnotationFilter filter, int defaultLimit) {
        List<CompiledCondition> conditions = compile(filter);
        List<Integer> groupIndexes = indexesOf(filter.groupBy(), "groupBy");
        List<Integer> selectIndexes = filter.select().isEmpty()
            ? allIndexes()
            : indexesOf(filter.select(), "select");
        int limit = resolveLimit(filter, defaultLimit);

        CallContext ctx = ExternalCallLogger.startCall(ServiceType.GAF, "Filter", log);
        ctx.logRequest("conditions=" + filter.where().size(), "where", filter.where(), "limit", limit);

        List<String[]> matched = table().stream()
            .filter(row -> conditions.stream().allMatch(c -> c.matches(row)))
            .collect(Collectors.toList());

        AnnotationPayload payload = filter.isAggregate()
            ? aggregate(filter, matched, groupIndexes, limit)
            : project(filter, matched, selectIndexes, limit);

        ctx.logResponse("matched=" + matched.size() + ", returned=" + payload.rows().size());
        return payload;
    }

    private AnnotationPayload project(AnnotationFilter filter, List<String[]> matched,
                                      List<Integer> selectIndexes, int limit) {
        List<String> columns = selectIndexes.stream().map(COLUMNS::get).collect(Collectors.toList());
        Collection<Map<String, Object>> projected = filter.distinct() ? new LinkedHashSet<>() : new ArrayList<>();

        for (String[] row : matched) {
            if (!filter.distinct() && projected.size() >= limit) {
                break;
            }
            Map<String, Object> out = new LinkedHashMap<>();
            for (int index : selectIndexes) {
                out.put(COLUMNS.get(index), row[index]);
            }
            projected.add(out);
        }

        List<Map<String, Object>> result = projected.stream().limit(limit).collect(Collectors.toList());
        return new AnnotationPayload(filter, columns, result, matched.size());
    }

    private AnnotationPayload aggregate(AnnotationFilter filter, List<String[]> matched,
                                        List<Integer> groupIndexes, int limit) {
        Map<List<String>, Integer> counts = new LinkedHashMap<>();
        for (String[] row : matched) {
            List<String> key = groupIndexes.stream().map(i -> row[i]).collect(Collectors.toList());
            counts.merge(key, 1, Integer::sum);
        }

        List<String> columns = new ArrayList<>(filter.groupBy());
        columns.add(COUNT);

        List<Map<String, Object>> result = counts.entrySet().stream()
            .sorted(Map.Entry.<List<String>, Integer>comparingByValue(Comparator.reverseOrder()))
            .limit(limit)
            .map(entry -> {
                Map<String, Object> out = new LinkedHashMap<>();
                for (int i = 0; i < groupIndexes.size(); i++) {
                    out.put(COLUMNS.get(groupIndexes.get(i)), entry.getKey().get(i));
                }
                out.put(COUNT, entry.getValue());
                return out;
            })
            .collect(Collectors.toList());

        return new AnnotationPayload(filter, columns, result, matched.size());
    }

    private List<CompiledCondition> compile(AnnotationFilter filter) {
        List<CompiledCondition> compiled = new ArrayList<>();
        for (Condition condition : filter.where()) {
            if (condition == null) {
                throw new FilterSyntaxException("Null condition in 'where'");
            }
            int index = indexOf(condition.column(), "where");
            FilterOperator op = FilterOperator.fromToken(condition.op())
                .orElseThrow(() -> new FilterSyntaxException("Unknown operator '" + condition.op()
                    + "'. Valid operators: eq, ne, in, contains, startsWith"));
            compiled.add(new CompiledCondition(index, op, operand(condition, op), condition.ignoreCase()));
        }
        return compiled;
    }

    private Object operand(Condition condition, FilterOperator op) {
        Object value = condition.value();
        if (value == null) {
            throw new FilterSyntaxException("Condition on '" + condition.column() + "' has no value");
        }
        if (op == FilterOperator.IN) {
            if (!(value instanceof Collection<?> values)) {
                throw new FilterSyntaxException("Operator 'in' on '" + condition.column() + "' needs a list value");
            }
            Set<String> normalized = new LinkedHashSet<>();
            for (Object item : values) {
                normalized.add(normalize(String.valueOf(item), condition.ignoreCase()));
            }
            return normalized;
        }
        if (value instanceof Collection<?> || value instanceof Map<?, ?>) {
            throw new FilterSyntaxException("Operator '" + op.getToken() + "' on '" + condition.column()
                + "' needs a single value");
        }
        return normalize(String.valueOf(value), condition.ignoreCase());
    }

    private static String normalize(String value, boolean ignoreCase) {
        return ignoreCase ? value.toLowerCase(Locale.ROOT) : value;
    }

    private int resolveLimit(AnnotationFilter filter, int defaultLimit) {
        if (filter.limit() == null) {
            return defaultLimit;
        }
        if (filter.limit() < 1) {
            throw new FilterSyntaxException("Limit must be positive: " + filter.limit());
        }
        return filter.limit();
    }

    private List<Integer> indexesOf(List<String> names, String clause) {
        List<Integer> indexes = new ArrayList<>();
        for (String name : names) {
            indexes.add(indexOf(name, clause));
        }
        return indexes;
    }

    private int indexOf(String column, String clause) {
        int index = column == null ? -1 : COLUMNS.indexOf(column.trim());
        if (index < 0) {
            throw new FilterSyntaxException("Unknown column '" + column + "' in '" + clause
                + "'. Valid columns: " + String.join(", ", COLUMNS));
        }
        return index;
    }

    private List<Integer> allIndexes() {
        List<Integer> indexes = new ArrayList<>();
        for (int i = 0; i < COLUMNS.size(); i++) {
            indexes.add(i);
        }
        return indexes;
    }

    private List<String[]> table() {
        List<String[]> loaded = rows;
        if (loaded == null) {
            synchronized (this) {
                loaded = rows;
                if (loaded == null) {
                    loaded = load();
                    rows = loaded;
                }
            }
        }
        return loaded;
    }

    private List<String[]> load() {
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.GAF, "Load", log);
        ctx.logRequest("path=" + filePath);

        if (!Files.isReadable(filePath)) {
            ctx.logError("file not readable: " + filePath, null);
            throw new DatasetUnavailableException("GAF file not found or not readable: " + filePath);
        }

        List<String[]> loaded = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(filePath, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank() || line.startsWith("!")) {
                    continue;
                }
                loaded.add(parseLine(line));
            }
        } catch (IOException e) {
            ctx.logError(e.getMessage(), e);
            throw new DatasetUnavailableException("Failed to read GAF file " + filePath + ": " + e.getMessage(), e);
        }

        ctx.logResponse("rows=" + loaded.size());
        log.info("Loaded {} annotations from {}", loaded.size(), filePath);
        return List.copyOf(loaded);
    }

    private String[] parseLine(String line) {
        String[] row = new String[COLUMNS.size()];
        int i = 0;
        for (String cell : TAB.split(line)) {
            if (i >= GAF_COLUMNS.size()) {
                break;
            }
            row[i++] = cell;
        }
        while (i < GAF_COLUMNS.size()) {
            row[i++] = "";
        }
        row[GAF_COLUMNS.size()] = EvidenceCodes.describe(row[EVIDENCE_INDEX]);
        return row;
    }

    private record CompiledCondition(int column, FilterOperator op, Object operand, boolean ignoreCase) {

        boolean matches(String[] row) {
            return op.test(row[column], operand, ignoreCase);
        }
    }
}
