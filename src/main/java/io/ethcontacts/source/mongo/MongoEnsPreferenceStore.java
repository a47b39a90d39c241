package io.ethcontacts.source.mongo;

import io.ethcontacts.source.EnsPreferenceStore;
import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * {@link EnsPreferenceStore} over a MongoDB preferences collection. Keys are {@code ensKeyPrefix + contactId}
 * within one namespace, e.g. {@code ENS_42} in {@code contact_prefs}.
 */
@RequiredArgsConstructor
public class MongoEnsPreferenceStore implements EnsPreferenceStore {

    private final MongoTemplate mongoTemplate;
    private final String collection;
    private final String namespace;
    private final String ensKeyPrefix;

    @Override
    public Optional<String> getEnsOverride(long contactId) {
        PreferenceDocument entry = mongoTemplate.findById(documentId(contactId), PreferenceDocument.class, collection);
        return Optional.ofNullable(entry).map(PreferenceDocument::getValue);
    }

    @Override
    public void setEnsOverride(long contactId, String ensName) {
        mongoTemplate.upsert(
                new Query(where("id").is(documentId(contactId))),
                new Update()
                        .set("namespace", namespace)
                        .set("key", ensKey(contactId))
                        .set("value", ensName)
                        .set("updatedAt", Instant.now()),
                PreferenceDocument.class,
                collection);
    }

    String ensKey(long contactId) {
        return ensKeyPrefix + contactId;
    }

    private String documentId(long contactId) {
        return namespace + ":" + ensKey(contactId);
    }
}
