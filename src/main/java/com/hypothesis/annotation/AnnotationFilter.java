package com.hypothesis.annotation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Filter/aggregate operation over the annotation table, as generated by the language model.
 *
 * <pre>
 * {
 *   "where":   [{"column": "DB_Object_Symbol", "op": "eq", "value": "BRCA1"}],
 *   "select":  ["DB_Object_Symbol", "GO_ID", "Evidence", "Aspect"],
 *   "distinct": true,
 *   "groupBy": [],
 *   "limit":   20
 * }
 * </pre>
 *
 * <p>With {@code groupBy} set, output rows are the group keys plus a {@code count} column and
 * {@code select}/{@code distinct} are ignored.
 *
 * @param where    conjunction of conditions, may be empty
 * @param select   output columns, empty for all
 * @param distinct drop duplicate output rows
 * @param groupBy  group columns for a count aggregate
 * @param limit    maximum output rows, null for the configured default
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnnotationFilter(
    List<Condition> where,
    List<String> select,
    boolean distinct,
    List<String> groupBy,
    Integer limit
) {

    public AnnotationFilter {
        where = where == null ? List.of() : List.copyOf(where);
        select = select == null ? List.of() : List.copyOf(select);
        groupBy = groupBy == null ? List.of() : List.copyOf(groupBy);
    }

    public boolean isAggregate() {
        return !groupBy.isEmpty();
    }

    /**
     * One column predicate. {@code value} is a string, or a list of strings for {@code in}.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Condition(String column, String op, Object value, boolean ignoreCase) {

        public Condition(String column, String op, Object value) {
            this(column, op, value, false);
        }
    }
}
