package tech.rulestore.repository.mongo;

import com.mongodb.MongoClientSettings;
import com.mongodb.MongoCommandException;
import com.mongodb.MongoTimeoutException;
import com.mongodb.ServerAddress;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.MongoIterable;
import com.mongodb.client.result.DeleteResult;
import org.bson.BsonArray;
import org.bson.BsonBinary;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonObjectId;
import org.bson.BsonString;
import org.bson.BsonValue;
import org.bson.conversions.Bson;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.rulestore.config.RuleStoreOptions;
import tech.rulestore.model.PolicyRule;
import tech.rulestore.repository.RulePage;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for MongoRuleRepository against mocked driver objects.
 */
@ExtendWith(MockitoExtension.class)
class MongoRuleRepositoryTest {

    private static final RuleStoreOptions OPTIONS = RuleStoreOptions.defaults().withPageSize(2);

    @Mock
    private MongoClient mongoClient;

    @Mock
    private MongoDatabase database;

    @Mock
    private MongoDatabase adminDatabase;

    @Mock
    private MongoCollection<BsonDocument> collection;

    @Mock
    private MongoIterable<String> databaseNames;

    @Mock
    private MongoIterable<String> collectionNames;

    @Mock
    private FindIterable<BsonDocument> findIterable;

    private MongoRuleRepository repository;

    @BeforeEach
    void setUp() {
        lenient().when(mongoClient.getDatabase("casbin")).thenReturn(database);
        lenient().when(mongoClient.getDatabase("admin")).thenReturn(adminDatabase);
        lenient().when(database.getCollection("casbin_rule", BsonDocument.class)).thenReturn(collection);
        repository = new MongoRuleRepository(mongoClient, OPTIONS);
    }

    // ========================================
    // initialize TESTS
    // ========================================

    @Test
    @DisplayName("initialize should create and index the collection when it is absent")
    void initialize_shouldCreateCollection_whenAbsent() {
        // Arrange
        stubNames(databaseNames, "admin");
        stubNames(collectionNames, "other");
        when(mongoClient.listDatabaseNames()).thenReturn(databaseNames);
        when(database.listCollectionNames()).thenReturn(collectionNames);

        // Act
        repository.initialize();

        // Assert
        InOrder inOrder = inOrder(database, collection);
        inOrder.verify(database).createCollection("casbin_rule");
        inOrder.verify(collection).createIndex(any(Bson.class));
        verifyNoInteractions(adminDatabase);
    }

    @Test
    @DisplayName("initialize should leave an existing collection alone")
    void initialize_shouldSkipCreation_whenCollectionExists() {
        // Arrange
        stubNames(databaseNames, "casbin");
        stubNames(collectionNames, "casbin_rule");
        when(mongoClient.listDatabaseNames()).thenReturn(databaseNames);
        when(database.listCollectionNames()).thenReturn(collectionNames);

        // Act
        repository.initialize();

        // Assert
        verify(database, never()).createCollection(anyString());
        verifyNoInteractions(collection);
    }

    @Test
    @DisplayName("initialize should shard on the policy type when sharding is enabled")
    void initialize_shouldShardCollection_whenSharded() {
        // Arrange
        repository = new MongoRuleRepository(mongoClient, OPTIONS.withSharded(true));
        stubNames(databaseNames);
        stubNames(collectionNames);
        when(mongoClient.listDatabaseNames()).thenReturn(databaseNames);
        when(database.listCollectionNames()).thenReturn(collectionNames);

        // Act
        repository.initialize();

        // Assert
        ArgumentCaptor<Bson> command = ArgumentCaptor.forClass(Bson.class);
        verify(adminDatabase).runCommand(command.capture());
        assertThat(render(command.getValue())).isEqualTo(new BsonDocument("shardCollection", new BsonString("casbin.casbin_rule"))
            .append("key", new BsonDocument("pType", new BsonString("hashed"))));
        verify(collection, never()).createIndex(any(Bson.class));
    }

    @Test
    @DisplayName("initialize should accept a collection created concurrently")
    void initialize_shouldTolerateNamespaceExists() {
        // Arrange
        stubNames(databaseNames, "casbin");
        stubNames(collectionNames);
        when(mongoClient.listDatabaseNames()).thenReturn(databaseNames);
        when(database.listCollectionNames()).thenReturn(collectionNames);
        doThrow(commandException(48)).when(database).createCollection("casbin_rule");

        // Act & Assert
        assertThatCode(() -> repository.initialize()).doesNotThrowAnyException();
        verify(collection, never()).createIndex(any(Bson.class));
    }

    @Test
    @DisplayName("initialize should propagate any other creation failure")
    void initialize_shouldPropagateOtherCreationFailures() {
        // Arrange
        stubNames(databaseNames, "casbin");
        stubNames(collectionNames);
        when(mongoClient.listDatabaseNames()).thenReturn(databaseNames);
        when(database.listCollectionNames()).thenReturn(collectionNames);
        doThrow(commandException(13)).when(database).createCollection("casbin_rule");

        // Act & Assert
        assertThatThrownBy(() -> repository.initialize())
            .isInstanceOf(MongoCommandException.class);
    }

    @Test
    @DisplayName("initialize should propagate a failure to list databases")
    void initialize_shouldPropagateReadFailures() {
        when(mongoClient.listDatabaseNames()).thenThrow(new MongoTimeoutException("no server"));

        assertThatThrownBy(() -> repository.initialize())
            .isInstanceOf(MongoTimeoutException.class);
        verify(database, never()).createCollection(anyString());
    }

    // ========================================
    // recreate TESTS
    // ========================================

    @Test
    @DisplayName("recreate should drop the collection and provision it again")
    void recreate_shouldDropAndCreate() {
        repository.recreate();

        InOrder inOrder = inOrder(collection, database);
        inOrder.verify(collection).drop();
        inOrder.verify(database).createCollection("casbin_rule");
        inOrder.verify(collection).createIndex(any(Bson.class));
    }

    // ========================================
    // findPage TESTS
    // ========================================

    @Test
    @DisplayName("findPage should read everything and stop on a short page")
    void findPage_shouldReturnLastPage_whenShort() {
        // Arrange
        ObjectId id = new ObjectId();
        stubFind(rule(new BsonObjectId(id), "p", "alice"));

        // Act
        RulePage page = repository.findPage(null, null, null);

        // Assert
        ArgumentCaptor<Bson> query = ArgumentCaptor.forClass(Bson.class);
        verify(collection).find(query.capture());
        assertThat(render(query.getValue())).isEmpty();
        verify(findIterable).limit(2);
        assertThat(page.hasMore()).isFalse();
        assertThat(page.rules()).containsExactly(new PolicyRule(id.toHexString(), "p", "alice", null, null, null, null, null));
    }

    @Test
    @DisplayName("findPage should hand out the last id as continuation token on a full page")
    void findPage_shouldReturnToken_whenPageFull() {
        // Arrange
        ObjectId first = new ObjectId();
        ObjectId second = new ObjectId();
        stubFind(
            rule(new BsonObjectId(first), "p", "alice"),
            rule(new BsonObjectId(second), "g", "bob"));

        // Act
        RulePage page = repository.findPage(null, null, null);

        // Assert
        assertThat(page.rules()).hasSize(2);
        assertThat(page.continuationToken()).isEqualTo(second.toHexString());
    }

    @Test
    @DisplayName("findPage should combine filter, partition and continuation token")
    void findPage_shouldCombineClauses() {
        // Arrange
        ObjectId after = new ObjectId();
        BsonDocument filter = BsonDocument.parse("{\"v0\": \"alice\"}");
        stubFind();

        // Act
        RulePage page = repository.findPage(filter, "p", after.toHexString());

        // Assert
        ArgumentCaptor<Bson> query = ArgumentCaptor.forClass(Bson.class);
        verify(collection).find(query.capture());
        BsonArray clauses = render(query.getValue()).getArray("$and");
        assertThat(clauses).hasSize(3);
        assertThat(clauses.get(0)).isEqualTo(filter);
        assertThat(clauses.get(1)).isEqualTo(new BsonDocument("pType", new BsonString("p")));
        BsonArray resume = clauses.get(2).asDocument().getArray("$or");
        assertThat(resume.get(0)).isEqualTo(new BsonDocument("_id", new BsonDocument("$gt", new BsonObjectId(after))));
        assertThat(resume).contains(typeClause("bool")).doesNotContain(typeClause("string"));
        assertThat(page.rules()).isEmpty();
        assertThat(page.hasMore()).isFalse();
    }

    @Test
    @DisplayName("findPage should resume after a string id without losing later ObjectId documents")
    void findPage_shouldResumeAcrossIdTypes() {
        // Arrange
        stubFind(
            rule(new BsonInt32(7), "p", "alice"),
            rule(new BsonString("65a1b2c3d4e5f60718293a4b"), "p", "bob"));
        RulePage first = repository.findPage(null, null, null);
        clearInvocations(collection);

        // Act
        repository.findPage(null, null, first.continuationToken());

        // Assert
        ArgumentCaptor<Bson> query = ArgumentCaptor.forClass(Bson.class);
        verify(collection).find(query.capture());
        BsonArray resume = render(query.getValue()).getArray("$or");
        assertThat(resume.get(0)).isEqualTo(
            new BsonDocument("_id", new BsonDocument("$gt", new BsonString("65a1b2c3d4e5f60718293a4b"))));
        assertThat(resume).contains(typeClause("objectId"), typeClause("object"))
            .doesNotContain(typeClause("number"), typeClause("string"));
    }

    @Test
    @DisplayName("findPage should skip documents with non-string fields and keep paging")
    void findPage_shouldSkipForeignDocuments() {
        // Arrange
        ObjectId foreign = new ObjectId();
        ObjectId valid = new ObjectId();
        stubFind(
            rule(new BsonObjectId(valid), "p", "alice"),
            rule(new BsonObjectId(foreign), "p", "bob").append("v1", new BsonInt32(3)));

        // Act
        RulePage page = repository.findPage(null, null, null);

        // Assert
        assertThat(page.rules()).extracting(PolicyRule::id).containsExactly(valid.toHexString());
        assertThat(page.continuationToken()).isEqualTo(foreign.toHexString());
    }

    // ========================================
    // insert / delete TESTS
    // ========================================

    @Test
    @DisplayName("insert should store only the used fields and return the assigned id")
    void insert_shouldStoreUsedFields() {
        // Act
        PolicyRule stored = repository.insert(PolicyRule.of("p", "alice", "data1", "read"));

        // Assert
        ArgumentCaptor<BsonDocument> document = ArgumentCaptor.forClass(BsonDocument.class);
        verify(collection).insertOne(document.capture());
        BsonDocument inserted = document.getValue();
        assertThat(inserted.getObjectId("_id").getValue().toHexString()).isEqualTo(stored.id());
        assertThat(inserted.getString("pType").getValue()).isEqualTo("p");
        assertThat(inserted.keySet()).containsExactly("_id", "pType", "v0", "v1", "v2");
        assertThat(stored.values()).containsExactly("alice", "data1", "read");
    }

    @Test
    @DisplayName("delete should remove by id within the rule's own partition")
    void delete_shouldScopeToOwnPartition() {
        // Arrange
        ObjectId id = new ObjectId();
        PolicyRule rule = new PolicyRule(id.toHexString(), "g", "alice", "admin", null, null, null, null);
        when(collection.deleteOne(any(Bson.class))).thenReturn(DeleteResult.acknowledged(1));

        // Act
        boolean deleted = repository.delete(rule);

        // Assert
        assertThat(deleted).isTrue();
        assertThat(deleteClauses()).containsExactly(
            new BsonDocument("_id", new BsonObjectId(id)),
            new BsonDocument("pType", new BsonString("g")));
    }

    @Test
    @DisplayName("delete should match client-assigned ids with their stored type")
    void delete_shouldKeepIdType_whenNotObjectId() {
        // Arrange
        when(collection.deleteOne(any(Bson.class))).thenReturn(DeleteResult.acknowledged(1));
        BsonValue hexString = new BsonString("65a1b2c3d4e5f60718293a4b");
        BsonValue number = new BsonInt32(7);
        BsonValue uuid = new BsonBinary(UUID.fromString("00000000-0000-0000-0000-000000000001"));

        for (BsonValue id : List.of(hexString, number, uuid)) {
            PolicyRule stored = MongoRuleRepository.toRule(rule(id, "p", "alice"));
            clearInvocations(collection);

            // Act
            repository.delete(stored);

            // Assert
            assertThat(deleteClauses()).containsExactly(
                new BsonDocument("_id", id),
                new BsonDocument("pType", new BsonString("p")));
        }
    }

    @Test
    @DisplayName("delete should report a rule that was already gone")
    void delete_shouldReturnFalse_whenNothingDeleted() {
        when(collection.deleteOne(any(Bson.class))).thenReturn(DeleteResult.acknowledged(0));

        boolean deleted = repository.delete(new PolicyRule(new ObjectId().toHexString(), "p", "alice", null, null, null, null, null));

        assertThat(deleted).isFalse();
    }

    @Test
    @DisplayName("delete should refuse a rule without id")
    void delete_shouldReject_whenNoId() {
        assertThatThrownBy(() -> repository.delete(PolicyRule.of("p", "alice")))
            .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(collection);
    }

    @Test
    @DisplayName("toRule should map absent fields to null")
    void toRule_shouldMapDocument() {
        BsonDocument document = rule(new BsonString("legacy-id"), "g2", "a").append("v1", new BsonString("b"));

        PolicyRule rule = MongoRuleRepository.toRule(document);

        assertThat(RuleIds.decode(rule.id())).isEqualTo(new BsonString("legacy-id"));
        assertThat(rule.pType()).isEqualTo("g2");
        assertThat(rule.values()).containsExactly("a", "b");
        assertThat(rule.v2()).isNull();
    }

    @Test
    @DisplayName("toRule should reject a document whose pType is not a string")
    void toRule_shouldReject_whenFieldNotString() {
        BsonDocument document = new BsonDocument("_id", new BsonObjectId()).append("pType", new BsonInt32(1));

        assertThatThrownBy(() -> MongoRuleRepository.toRule(document))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("pType");
    }

    @Test
    @DisplayName("close should close the client")
    void close_shouldCloseClient() {
        repository.close();

        verify(mongoClient).close();
    }

    private void stubFind(BsonDocument... documents) {
        when(collection.find(any(Bson.class))).thenReturn(findIterable);
        when(findIterable.sort(any(Bson.class))).thenReturn(findIterable);
        when(findIterable.limit(anyInt())).thenReturn(findIterable);
        when(findIterable.into(any())).thenAnswer(invocation -> {
            Collection<BsonDocument> target = invocation.getArgument(0);
            target.addAll(List.of(documents));
            return target;
        });
    }

    private static void stubNames(MongoIterable<String> iterable, String... names) {
        when(iterable.into(any())).thenAnswer(invocation -> {
            Collection<String> target = invocation.getArgument(0);
            target.addAll(List.of(names));
            return target;
        });
    }

    private static MongoCommandException commandException(int code) {
        BsonDocument response = new BsonDocument("ok", new BsonInt32(0))
            .append("code", new BsonInt32(code))
            .append("errmsg", new BsonString("command failed"));
        return new MongoCommandException(response, new ServerAddress());
    }

    private BsonArray deleteClauses() {
        ArgumentCaptor<Bson> filter = ArgumentCaptor.forClass(Bson.class);
        verify(collection).deleteOne(filter.capture());
        return render(filter.getValue()).getArray("$and");
    }

    private static BsonDocument rule(BsonValue id, String pType, String v0) {
        return new BsonDocument("_id", id)
            .append("pType", new BsonString(pType))
            .append("v0", new BsonString(v0));
    }

    private static BsonDocument typeClause(String alias) {
        return new BsonDocument("_id", new BsonDocument("$type", new BsonString(alias)));
    }

    private static BsonDocument render(Bson bson) {
        return bson.toBsonDocument(BsonDocument.class, MongoClientSettings.getDefaultCodecRegistry());
    }
}
