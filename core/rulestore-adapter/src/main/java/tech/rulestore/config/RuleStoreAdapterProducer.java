package tech.rulestore.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;
import tech.rulestore.adapter.RuleStoreAdapter;

/**
 * Exposes a {@link RuleStoreAdapter} built from the {@code rule-store.*}
 * configuration to CDI applications.
 *
 * <pre>
 * rule-store.connection-string=mongodb://localhost:27017
 * rule-store.database=authz
 * </pre>
 */
@ApplicationScoped
public class RuleStoreAdapterProducer {

    private static final Logger LOG = Logger.getLogger(RuleStoreAdapterProducer.class);

    @Inject
    RuleStoreConfig config;

    @Produces
    @Singleton
    RuleStoreAdapter ruleStoreAdapter() {
        RuleStoreOptions options = RuleStoreOptions.from(config);
        LOG.infof("Creating rule store adapter for %s.%s (filtered: %s)",
            options.databaseName(), options.collectionName(), config.filtered());
        return config.filtered()
            ? RuleStoreAdapter.createFiltered(config.connectionString(), options)
            : RuleStoreAdapter.create(config.connectionString(), options);
    }

    void close(@Disposes RuleStoreAdapter adapter) {
        adapter.close();
    }
}
