package tech.rulestore.query;

import com.mongodb.MongoClientSettings;
import org.bson.BsonArray;
import org.bson.BsonDocument;
import org.bson.BsonNull;
import org.bson.BsonValue;
import org.bson.Document;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parameterized query against the rule collection.
 *
 * <p>The template is a MongoDB extended-JSON selector. Any string value in it
 * that equals the name of a parameter is a placeholder and is replaced by the
 * parameter's value as a typed BSON value, so values never become part of the
 * query text. Placeholders may sit at any depth, including inside
 * {@code $or}/{@code $in} arrays.</p>
 *
 * <pre>
 * RuleQuery.of("{\"pType\": \"p\", \"v0\": \"@owner\"}", QueryParameter.of("@owner", "alice"))
 * </pre>
 *
 * <p>Strings that match no parameter are kept as literals. The query is not
 * otherwise validated.</p>
 */
public record RuleQuery(String template, List<QueryParameter> parameters) {

    public RuleQuery {
        Objects.requireNonNull(template, "template");
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }

    public static RuleQuery of(String template, QueryParameter... parameters) {
        return new RuleQuery(template, List.of(parameters));
    }

    /**
     * Parse the template and bind the parameters.
     *
     * @return the selector to run against the collection
     * @throws org.bson.json.JsonParseException if the template is not valid extended JSON
     */
    public BsonDocument toFilter() {
        BsonDocument parsed = BsonDocument.parse(template);
        if (parameters.isEmpty()) {
            return parsed;
        }

        Map<String, BsonValue> bindings = new HashMap<>();
        for (QueryParameter parameter : parameters) {
            bindings.put(parameter.name(), toBsonValue(parameter.value()));
        }
        return bind(parsed, bindings).asDocument();
    }

    private static BsonValue bind(BsonValue value, Map<String, BsonValue> bindings) {
        if (value.isString()) {
            BsonValue bound = bindings.get(value.asString().getValue());
            return bound != null ? bound : value;
        }
        if (value.isDocument()) {
            BsonDocument bound = new BsonDocument();
            for (Map.Entry<String, BsonValue> entry : value.asDocument().entrySet()) {
                bound.put(entry.getKey(), bind(entry.getValue(), bindings));
            }
            return bound;
        }
        if (value.isArray()) {
            BsonArray bound = new BsonArray();
            for (BsonValue element : value.asArray()) {
                bound.add(bind(element, bindings));
            }
            return bound;
        }
        return value;
    }

    private static BsonValue toBsonValue(Object value) {
        if (value == null) {
            return BsonNull.VALUE;
        }
        if (value instanceof BsonValue bsonValue) {
            return bsonValue;
        }
        // Let the driver's default codecs decide the BSON type
        return new Document("value", value)
            .toBsonDocument(BsonDocument.class, MongoClientSettings.getDefaultCodecRegistry())
            .get("value");
    }
}
