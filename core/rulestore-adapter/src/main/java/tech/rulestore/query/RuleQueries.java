package tech.rulestore.query;

import tech.rulestore.model.PolicyRule;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the parameterized queries used to find rules for removal.
 */
public final class RuleQueries {

    static final String PTYPE_PARAMETER = "@pType";

    private RuleQueries() {
    }

    /**
     * Rules of the given type whose leading fields equal {@code values}, one
     * equality clause per value in order. Fields past the tuple are not constrained.
     *
     * <pre>
     * matching("p", ["alice", "data1"]) -> { pType: @pType, v0: @v0, v1: @v1 }
     * </pre>
     */
    public static RuleQuery matching(String pType, List<String> values) {
        if (values.size() > PolicyRule.MAX_FIELDS) {
            throw new IllegalArgumentException(
                "A rule holds at most " + PolicyRule.MAX_FIELDS + " fields, got " + values.size() + ": " + values);
        }
        QueryBuilder builder = new QueryBuilder(pType);
        for (int i = 0; i < values.size(); i++) {
            builder.field(i, values.get(i));
        }
        return builder.build();
    }

    /**
     * Rules of the given type whose fields starting at {@code fieldIndex}
     * equal {@code values}. Empty values match anything, and positions
     * outside {@code v0..v5} are ignored.
     *
     * <pre>
     * filtered("p", 1, ["data1"])       -> { pType: @pType, v1: @v1 }
     * filtered("p", 0, ["", "data1"])   -> { pType: @pType, v1: @v1 }
     * </pre>
     */
    public static RuleQuery filtered(String pType, int fieldIndex, List<String> values) {
        QueryBuilder builder = new QueryBuilder(pType);
        int from = Math.max(0, fieldIndex);
        int to = Math.min(PolicyRule.MAX_FIELDS, fieldIndex + values.size());
        for (int i = from; i < to; i++) {
            String value = values.get(i - fieldIndex);
            if (value != null && !value.isEmpty()) {
                builder.field(i, value);
            }
        }
        return builder.build();
    }

    private static final class QueryBuilder {

        private final StringBuilder template = new StringBuilder();
        private final List<QueryParameter> parameters = new ArrayList<>();

        QueryBuilder(String pType) {
            template.append("{\"pType\": \"").append(PTYPE_PARAMETER).append('"');
            parameters.add(QueryParameter.of(PTYPE_PARAMETER, pType));
        }

        void field(int index, String value) {
            String name = "v" + index;
            template.append(", \"").append(name).append("\": \"@").append(name).append('"');
            parameters.add(QueryParameter.of("@" + name, value));
        }

        RuleQuery build() {
            return new RuleQuery(template.append('}').toString(), parameters);
        }
    }
}
