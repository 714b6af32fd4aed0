package tech.rulestore.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A single authorization rule as stored in the rule collection.
 *
 * A rule is a policy type tag plus up to six ordered string fields.
 * Used fields always form a contiguous prefix starting at {@code v0};
 * unused trailing fields are {@code null} and are left out of both the
 * stored document and the JSON form.
 *
 * Example: {@code p, alice, data1, read} is stored as
 * {@code { "pType": "p", "v0": "alice", "v1": "data1", "v2": "read" }}.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"id", "pType", "v0", "v1", "v2", "v3", "v4", "v5"})
public record PolicyRule(
    /**
     * Document identity. Null until the rule has been stored.
     */
    @JsonProperty("id") String id,

    /**
     * Policy type tag (e.g. "p", "g", "g2"). Also the partition key.
     */
    @JsonProperty("pType") String pType,

    @JsonProperty("v0") String v0,
    @JsonProperty("v1") String v1,
    @JsonProperty("v2") String v2,
    @JsonProperty("v3") String v3,
    @JsonProperty("v4") String v4,
    @JsonProperty("v5") String v5
) {

    /**
     * Maximum number of fields a rule can carry.
     */
    public static final int MAX_FIELDS = 6;

    public PolicyRule {
        Objects.requireNonNull(pType, "pType");
    }

    /**
     * Builds an unsaved rule from a policy type and its tuple of values.
     *
     * @param pType  the policy type tag
     * @param values the rule tuple, at most {@link #MAX_FIELDS} long
     * @throws IllegalArgumentException if the tuple has more than six values
     */
    public static PolicyRule of(String pType, List<String> values) {
        if (values.size() > MAX_FIELDS) {
            throw new IllegalArgumentException(
                "A rule holds at most " + MAX_FIELDS + " fields, got " + values.size() + ": " + values);
        }
        String[] fields = new String[MAX_FIELDS];
        for (int i = 0; i < values.size(); i++) {
            fields[i] = values.get(i);
        }
        return new PolicyRule(null, pType, fields[0], fields[1], fields[2], fields[3], fields[4], fields[5]);
    }

    public static PolicyRule of(String pType, String... values) {
        return of(pType, Arrays.asList(values));
    }

    /**
     * Section of a policy type: its first character ("p" for enforcement
     * rules, "g" for role grouping rules).
     */
    public static String sectionOf(String pType) {
        if (pType == null || pType.isEmpty()) {
            throw new IllegalArgumentException("Policy type must not be empty");
        }
        return pType.substring(0, 1);
    }

    /**
     * Field at the given position (0-5), or null if absent.
     */
    public String field(int index) {
        return switch (index) {
            case 0 -> v0;
            case 1 -> v1;
            case 2 -> v2;
            case 3 -> v3;
            case 4 -> v4;
            case 5 -> v5;
            default -> throw new IndexOutOfBoundsException("Field index out of range: " + index);
        };
    }

    /**
     * The rule tuple: fields from {@code v0} up to, not including, the first
     * empty or absent one.
     */
    public List<String> values() {
        List<String> tokens = new ArrayList<>(MAX_FIELDS);
        for (int i = 0; i < MAX_FIELDS; i++) {
            String value = field(i);
            if (value == null || value.isEmpty()) {
                break;
            }
            tokens.add(value);
        }
        return tokens;
    }

    /**
     * Partition the rule lives in. Rules are partitioned by policy type.
     */
    public String partitionKey() {
        return pType;
    }

    public String section() {
        return sectionOf(pType);
    }

    /**
     * Creates a copy of this rule carrying the given document identity.
     */
    public PolicyRule withId(String newId) {
        return new PolicyRule(newId, pType, v0, v1, v2, v3, v4, v5);
    }
}
