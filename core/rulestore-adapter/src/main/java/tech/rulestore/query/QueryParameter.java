package tech.rulestore.query;

import java.util.Objects;

/**
 * Named value bound into a {@link RuleQuery} template.
 *
 * @param name  placeholder as it appears in the template, e.g. "@owner"
 * @param value value substituted for the placeholder; may be null
 */
public record QueryParameter(String name, Object value) {

    public QueryParameter {
        Objects.requireNonNull(name, "name");
    }

    public static QueryParameter of(String name, Object value) {
        return new QueryParameter(name, value);
    }
}
