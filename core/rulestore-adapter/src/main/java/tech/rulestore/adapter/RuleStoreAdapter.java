package tech.rulestore.adapter;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import org.bson.conversions.Bson;
import org.jboss.logging.Logger;
import tech.rulestore.config.RuleStoreOptions;
import tech.rulestore.model.PolicyModel;
import tech.rulestore.model.PolicyRule;
import tech.rulestore.query.RuleQueries;
import tech.rulestore.query.RuleQuery;
import tech.rulestore.repository.RulePage;
import tech.rulestore.repository.RuleRepository;
import tech.rulestore.repository.mongo.MongoRuleRepository;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Stores the engine's rules in a document collection, one document per rule,
 * partitioned by policy type.
 *
 * <p>The adapter keeps no rules in memory between calls. Its only state is
 * whether the last load was filtered: a filtered rule set is a subset of the
 * store, so {@link #savePolicy} refuses to write it back.</p>
 *
 * <p>A full save drops and recreates the collection before inserting the rules
 * one by one. Readers running at the same time can see an empty or partial
 * rule set, and a failed insert leaves the rules written so far.</p>
 *
 * <pre>
 * try (RuleStoreAdapter adapter = RuleStoreAdapter.create("mongodb://localhost:27017")) {
 *     PolicyModel model = new PolicyModel();
 *     adapter.loadPolicy(model);
 * }
 * </pre>
 */
public class RuleStoreAdapter implements FilteredPolicyAdapter, BatchPolicyAdapter, AutoCloseable {

    private static final Logger LOG = Logger.getLogger(RuleStoreAdapter.class);

    private final RuleRepository repository;

    private volatile boolean filtered;

    /**
     * Wire an adapter over an existing repository and provision its collection.
     *
     * @param repository the rule collection
     * @param filtered   start in filtered state
     * @throws RuleStoreInitializationException if the database or collection cannot be provisioned
     */
    public RuleStoreAdapter(RuleRepository repository, boolean filtered) {
        this.repository = repository;
        this.filtered = filtered;
        try {
            repository.initialize();
        } catch (RuntimeException e) {
            LOG.errorf(e, "Provisioning the rule collection failed: %s", e.getMessage());
            repository.close();
            throw new RuleStoreInitializationException("Provisioning the rule collection failed", e);
        }
    }

    /**
     * Connect with the default database ("casbin") and collection ("casbin_rule").
     */
    public static RuleStoreAdapter create(String connectionString) {
        return create(connectionString, RuleStoreOptions.defaults());
    }

    public static RuleStoreAdapter create(String connectionString, RuleStoreOptions options) {
        return new RuleStoreAdapter(connect(connectionString, options), false);
    }

    /**
     * Connect in filtered state. Nothing is loaded until the engine calls
     * {@link #loadFilteredPolicy} or {@link #loadPolicy}.
     */
    public static RuleStoreAdapter createFiltered(String connectionString) {
        return createFiltered(connectionString, RuleStoreOptions.defaults());
    }

    public static RuleStoreAdapter createFiltered(String connectionString, RuleStoreOptions options) {
        return new RuleStoreAdapter(connect(connectionString, options), true);
    }

    private static RuleRepository connect(String connectionString, RuleStoreOptions options) {
        MongoClient client;
        try {
            client = MongoClients.create(connectionString);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Creating MongoDB client failed: %s", e.getMessage());
            throw new RuleStoreInitializationException("Creating MongoDB client failed", e);
        }
        LOG.infof("Using rule collection %s.%s", options.databaseName(), options.collectionName());
        return new MongoRuleRepository(client, options);
    }

    @Override
    public void loadPolicy(PolicyModel model) {
        loadFilteredPolicy(model, null);
    }

    /**
     * Load the rules matching the filter.
     *
     * @param filter a {@link RuleQuery}, a driver {@link Bson} selector, or null to load every rule
     * @throws IllegalArgumentException if the filter is of any other type
     */
    @Override
    public void loadFilteredPolicy(PolicyModel model, Object filter) {
        Bson selector = toSelector(filter);
        List<PolicyRule> rules = readAll(selector, null);
        filtered = selector != null;

        int loaded = 0;
        for (PolicyRule rule : rules) {
            if (rule.pType().isEmpty()) {
                LOG.warnf("Skipping stored rule %s without policy type", rule.id());
                continue;
            }
            model.addRule(rule);
            loaded++;
        }
        LOG.debugf("Loaded %d rules (filtered: %s)", loaded, (Object) filtered);
    }

    @Override
    public boolean isFiltered() {
        return filtered;
    }

    @Override
    public void savePolicy(PolicyModel model) {
        if (filtered) {
            throw new FilteredPolicySaveException();
        }

        List<PolicyRule> rules = new ArrayList<>();
        collect(model, PolicyModel.POLICY_SECTION, rules);
        collect(model, PolicyModel.GROUPING_SECTION, rules);

        repository.recreate();
        for (PolicyRule rule : rules) {
            repository.insert(rule);
        }
        LOG.infof("Saved %d rules", rules.size());
    }

    @Override
    public void addPolicy(String sec, String pType, List<String> rule) {
        repository.insert(PolicyRule.of(pType, rule));
    }

    @Override
    public void addPolicies(String sec, String pType, List<List<String>> rules) {
        for (List<String> rule : rules) {
            addPolicy(sec, pType, rule);
        }
    }

    @Override
    public void removePolicy(String sec, String pType, List<String> rule) {
        deleteMatching(RuleQueries.matching(pType, rule), pType);
    }

    @Override
    public void removePolicies(String sec, String pType, List<List<String>> rules) {
        for (List<String> rule : rules) {
            removePolicy(sec, pType, rule);
        }
    }

    @Override
    public void removeFilteredPolicy(String sec, String pType, int fieldIndex, String... fieldValues) {
        deleteMatching(RuleQueries.filtered(pType, fieldIndex, Arrays.asList(fieldValues)), pType);
    }

    @Override
    public void close() {
        repository.close();
    }

    private void deleteMatching(RuleQuery query, String partitionKey) {
        List<PolicyRule> matches = readAll(query.toFilter(), partitionKey);
        int removed = 0;
        for (PolicyRule match : matches) {
            if (repository.delete(match)) {
                removed++;
            }
        }
        LOG.debugf("Removed %d of %d matching %s rules", removed, matches.size(), partitionKey);
    }

    private List<PolicyRule> readAll(Bson filter, String partitionKey) {
        List<PolicyRule> rules = new ArrayList<>();
        String continuationToken = null;
        do {
            RulePage page = repository.findPage(filter, partitionKey, continuationToken);
            rules.addAll(page.rules());
            continuationToken = page.continuationToken();
        } while (continuationToken != null);
        return rules;
    }

    private static void collect(PolicyModel model, String section, List<PolicyRule> rules) {
        for (Map.Entry<String, List<List<String>>> bucket : model.section(section).entrySet()) {
            for (List<String> rule : bucket.getValue()) {
                rules.add(PolicyRule.of(bucket.getKey(), rule));
            }
        }
    }

    private static Bson toSelector(Object filter) {
        if (filter == null) {
            return null;
        }
        if (filter instanceof RuleQuery query) {
            return query.toFilter();
        }
        if (filter instanceof Bson bson) {
            return bson;
        }
        throw new IllegalArgumentException(
            "Unsupported filter type " + filter.getClass().getName() + ", expected RuleQuery or Bson");
    }
}
