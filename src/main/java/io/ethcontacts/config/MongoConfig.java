package io.ethcontacts.config;

import io.ethcontacts.source.ContactDataSource;
import io.ethcontacts.source.EnsPreferenceStore;
import io.ethcontacts.source.mongo.MongoContactDataSource;
import io.ethcontacts.source.mongo.MongoEnsPreferenceStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.MongoDatabaseFactory;
import org.springframework.data.mongodb.MongoTransactionManager;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * MongoDB store adapters. Skipped when the application supplies its own store beans.
 * The transaction manager is private to the contact source so it does not compete with an application's own.
 */
@Configuration(proxyBeanMethods = false)
@ConditionalOnBean(MongoTemplate.class)
public class MongoConfig {

    @Bean
    @ConditionalOnMissingBean(ContactDataSource.class)
    public MongoContactDataSource mongoContactDataSource(MongoTemplate mongoTemplate,
                                                         MongoDatabaseFactory mongoDatabaseFactory,
                                                         EthContactsProperties properties) {
        EthContactsProperties.Store store = properties.getStore();
        TransactionTemplate transactionTemplate = new TransactionTemplate(new MongoTransactionManager(mongoDatabaseFactory));
        MongoContactDataSource dataSource = new MongoContactDataSource(
                mongoTemplate,
                transactionTemplate,
                store.getContactsCollection(),
                store.getDataCollection(),
                store.getCountersCollection());
        dataSource.ensureIndexes();
        return dataSource;
    }

    @Bean
    @ConditionalOnMissingBean(EnsPreferenceStore.class)
    public MongoEnsPreferenceStore mongoEnsPreferenceStore(MongoTemplate mongoTemplate, EthContactsProperties properties) {
        EthContactsProperties.Preferences preferences = properties.getPreferences();
        return new MongoEnsPreferenceStore(
                mongoTemplate,
                preferences.getCollection(),
                preferences.getNamespace(),
                preferences.getEnsKeyPrefix());
    }
}
