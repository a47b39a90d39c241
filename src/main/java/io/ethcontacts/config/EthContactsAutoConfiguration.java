package io.ethcontacts.config;

import io.ethcontacts.classifier.AuxiliaryFieldClassifier;
import io.ethcontacts.mutation.ContactMutationService;
import io.ethcontacts.query.ContactQueryService;
import io.ethcontacts.reconcile.ContactReconciler;
import io.ethcontacts.source.ContactDataSource;
import io.ethcontacts.source.EnsPreferenceStore;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

/**
 * Wires the contacts services. Stores come from {@link MongoConfig} unless the application defines its own.
 */
@AutoConfiguration(after = MongoDataAutoConfiguration.class)
@EnableConfigurationProperties(EthContactsProperties.class)
@Import(MongoConfig.class)
public class EthContactsAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public AuxiliaryFieldClassifier auxiliaryFieldClassifier() {
        return new AuxiliaryFieldClassifier();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean({ContactDataSource.class, EnsPreferenceStore.class})
    public ContactReconciler contactReconciler(ContactDataSource contactDataSource,
                                               EnsPreferenceStore ensPreferenceStore,
                                               AuxiliaryFieldClassifier classifier) {
        return new ContactReconciler(contactDataSource, ensPreferenceStore, classifier);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean({ContactDataSource.class, EnsPreferenceStore.class})
    public ContactQueryService contactQueryService(ContactReconciler contactReconciler) {
        return new ContactQueryService(contactReconciler);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean({ContactDataSource.class, EnsPreferenceStore.class})
    public ContactMutationService contactMutationService(ContactDataSource contactDataSource,
                                                         EnsPreferenceStore ensPreferenceStore,
                                                         AuxiliaryFieldClassifier classifier) {
        return new ContactMutationService(contactDataSource, ensPreferenceStore, classifier);
    }
}
