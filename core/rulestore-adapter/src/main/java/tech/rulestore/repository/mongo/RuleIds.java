package tech.rulestore.repository.mongo;

import com.mongodb.client.model.Filters;
import org.bson.BsonDocument;
import org.bson.BsonObjectId;
import org.bson.BsonType;
import org.bson.BsonValue;
import org.bson.conversions.Bson;
import org.bson.json.JsonMode;
import org.bson.json.JsonWriterSettings;
import org.bson.types.ObjectId;

import java.util.ArrayList;
import java.util.List;

/**
 * Conversion between stored {@code _id} values and the string ids carried by
 * rules and continuation tokens.
 *
 * ObjectIds become their hex string. Any other id (client-assigned strings,
 * numbers, UUIDs) becomes the canonical extended JSON of {@code {"_id": value}},
 * so its BSON type survives the round trip. A 24 character hex string stored as
 * a string id is therefore never read back as an ObjectId.
 */
final class RuleIds {

    private static final JsonWriterSettings CANONICAL = JsonWriterSettings.builder()
        .outputMode(JsonMode.EXTENDED)
        .build();

    /**
     * {@code $type} aliases per comparison bracket, in the order MongoDB sorts them.
     */
    private static final List<List<String>> BRACKETS = List.of(
        List.of("minKey"),
        List.of("null", "undefined"),
        List.of("number"),
        List.of("string", "symbol"),
        List.of("object"),
        List.of("array"),
        List.of("binData"),
        List.of("objectId"),
        List.of("bool"),
        List.of("date"),
        List.of("timestamp"),
        List.of("regex"),
        List.of("maxKey")
    );

    private RuleIds() {
    }

    static String encode(BsonValue id) {
        if (id == null) {
            return null;
        }
        if (id.isObjectId()) {
            return id.asObjectId().getValue().toHexString();
        }
        return new BsonDocument(MongoRuleRepository.ID, id).toJson(CANONICAL);
    }

    /**
     * @throws IllegalArgumentException if the string was not produced by {@link #encode}
     */
    static BsonValue decode(String id) {
        if (id.startsWith("{")) {
            BsonValue value = BsonDocument.parse(id).get(MongoRuleRepository.ID);
            if (value == null) {
                throw new IllegalArgumentException("Not a rule id: " + id);
            }
            return value;
        }
        if (ObjectId.isValid(id)) {
            return new BsonObjectId(new ObjectId(id));
        }
        throw new IllegalArgumentException("Not a rule id: " + id);
    }

    /**
     * Selector for every id sorting after the given one.
     *
     * {@code $gt} only compares values of the same type bracket, so ids of the
     * brackets that sort later are matched by type.
     */
    static Bson after(BsonValue id) {
        int bracket = bracketOf(id.getBsonType());
        if (bracket < 0 || bracket == BRACKETS.size() - 1) {
            return Filters.gt(MongoRuleRepository.ID, id);
        }
        List<Bson> clauses = new ArrayList<>();
        clauses.add(Filters.gt(MongoRuleRepository.ID, id));
        for (List<String> later : BRACKETS.subList(bracket + 1, BRACKETS.size())) {
            for (String alias : later) {
                clauses.add(Filters.type(MongoRuleRepository.ID, alias));
            }
        }
        return Filters.or(clauses);
    }

    private static int bracketOf(BsonType type) {
        return switch (type) {
            case MIN_KEY -> 0;
            case NULL, UNDEFINED -> 1;
            case INT32, INT64, DOUBLE, DECIMAL128 -> 2;
            case STRING, SYMBOL -> 3;
            case DOCUMENT -> 4;
            case ARRAY -> 5;
            case BINARY -> 6;
            case OBJECT_ID -> 7;
            case BOOLEAN -> 8;
            case DATE_TIME -> 9;
            case TIMESTAMP -> 10;
            case REGULAR_EXPRESSION -> 11;
            case MAX_KEY -> 12;
            default -> -1;
        };
    }
}
