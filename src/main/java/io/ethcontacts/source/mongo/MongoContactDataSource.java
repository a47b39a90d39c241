package io.ethcontacts.source.mongo;

import com.mongodb.MongoException;
import com.mongodb.client.result.UpdateResult;
import io.ethcontacts.domain.ContactField;
import io.ethcontacts.domain.ContactHeader;
import io.ethcontacts.domain.DataRow;
import io.ethcontacts.domain.MimeType;
import io.ethcontacts.source.ContactDataSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoExceptionTranslator;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * {@link ContactDataSource} over three MongoDB collections: contact records, their data rows, and an id sequence.
 * Contact creation runs in a MongoDB transaction, so the server must be a replica set.
 */
@Slf4j
@RequiredArgsConstructor
public class MongoContactDataSource implements ContactDataSource {

    static final String CONTACT_ID_SEQUENCE = "contactId";
    static final String CONTACT_MIMETYPE_INDEX = "contact_mimetype_idx";

    private static final MongoExceptionTranslator EXCEPTION_TRANSLATOR = new MongoExceptionTranslator();

    private final MongoTemplate mongoTemplate;
    private final TransactionTemplate transactionTemplate;
    private final String contactsCollection;
    private final String dataCollection;
    private final String countersCollection;

    /** Creates the (contactId, mimetype) index on the configured data collection if it is missing. */
    public void ensureIndexes() {
        String indexName = mongoTemplate.indexOps(dataCollection).ensureIndex(new Index()
                .on("contactId", Sort.Direction.ASC)
                .on("mimetype", Sort.Direction.ASC)
                .named(CONTACT_MIMETYPE_INDEX));
        log.debug("Ensured index {} on {}", indexName, dataCollection);
    }

    @Override
    public List<DataRow> listDataRows(Set<MimeType> mimeTypes) {
        if (mimeTypes == null || mimeTypes.isEmpty()) {
            return List.of();
        }
        List<String> contentItemTypes = mimeTypes.stream().map(MimeType::getContentItemType).toList();
        Query query = new Query(where("mimeType").in(contentItemTypes))
                .with(Sort.by(Sort.Order.asc("contactId"), Sort.Order.asc("id")));
        List<DataRow> rows = mongoTemplate.find(query, ContactDataDocument.class, dataCollection).stream()
                .map(MongoContactDataSource::toDataRow)
                .flatMap(Optional::stream)
                .toList();
        log.debug("Read {} data rows for {}", rows.size(), mimeTypes);
        return rows;
    }

    @Override
    public Optional<ContactHeader> getContactHeader(long contactId) {
        RawContactDocument contact = mongoTemplate.findById(contactId, RawContactDocument.class, contactsCollection);
        if (contact == null) {
            return Optional.empty();
        }
        String photoUri = findFirstRow(contactId, MimeType.PHOTO)
                .map(ContactDataDocument::getPhotoUri)
                .orElse(null);
        return Optional.of(new ContactHeader(contact.getDisplayName(), photoUri));
    }

    @Override
    public Optional<String> queryField(long contactId, ContactField field) {
        return findFirstRow(contactId, field.getMimeType()).map(ContactDataDocument::getData1);
    }

    @Override
    public Optional<String> getAuxiliaryField(long contactId) {
        return findFirstRow(contactId, MimeType.STRUCTURED_NAME).map(ContactDataDocument::getData15);
    }

    @Override
    public boolean setAuxiliaryField(long contactId, String value) {
        Optional<ContactDataDocument> nameRow = findFirstRow(contactId, MimeType.STRUCTURED_NAME);
        if (nameRow.isEmpty()) {
            return false;
        }
        UpdateResult result = mongoTemplate.updateFirst(
                new Query(where("id").is(nameRow.get().getId())),
                new Update().set("data15", value),
                ContactDataDocument.class,
                dataCollection);
        return result.getMatchedCount() > 0;
    }

    /**
     * Inserts the contact record and its rows in one transaction.
     *
     * @throws DataAccessException also when the transaction cannot be started or committed,
     *                             or the session cannot be opened
     */
    @Override
    public OptionalLong createContact(String displayName, String phoneNumber, String email) {
        Long contactId;
        try {
            contactId = insertContact(displayName, phoneNumber, email);
        } catch (TransactionException e) {
            throw new DataAccessResourceFailureException("Contact creation transaction failed: " + e.getMessage(), e);
        } catch (MongoException e) {
            DataAccessException translated = EXCEPTION_TRANSLATOR.translateExceptionIfPossible(e);
            throw translated != null ? translated : new DataAccessResourceFailureException(e.getMessage(), e);
        }
        return contactId == null ? OptionalLong.empty() : OptionalLong.of(contactId);
    }

    private Long insertContact(String displayName, String phoneNumber, String email) {
        return transactionTemplate.execute(status -> {
            long id = nextContactId();
            Instant now = Instant.now();

            RawContactDocument contact = new RawContactDocument();
            contact.setId(id);
            contact.setDisplayName(displayName);
            contact.setCreatedAt(now);
            mongoTemplate.insert(contact, contactsCollection);

            List<ContactDataDocument> rows = new ArrayList<>();
            rows.add(newRow(id, MimeType.STRUCTURED_NAME, displayName, now));
            if (phoneNumber != null && !phoneNumber.isBlank()) {
                rows.add(newRow(id, MimeType.PHONE, phoneNumber, now));
            }
            if (email != null && !email.isBlank()) {
                rows.add(newRow(id, MimeType.EMAIL, email, now));
            }
            mongoTemplate.insert(rows, dataCollection);
            return id;
        });
    }

    private long nextContactId() {
        CounterDocument counter = mongoTemplate.findAndModify(
                new Query(where("id").is(CONTACT_ID_SEQUENCE)),
                new Update().inc("seq", 1L),
                FindAndModifyOptions.options().returnNew(true).upsert(true),
                CounterDocument.class,
                countersCollection);
        if (counter == null) {
            throw new IllegalStateException("Sequence " + CONTACT_ID_SEQUENCE + " returned no value");
        }
        return counter.getSeq();
    }

    private Optional<ContactDataDocument> findFirstRow(long contactId, MimeType mimeType) {
        Query query = new Query(where("contactId").is(contactId).and("mimeType").is(mimeType.getContentItemType()))
                .with(Sort.by(Sort.Order.asc("id")))
                .limit(1);
        return Optional.ofNullable(mongoTemplate.findOne(query, ContactDataDocument.class, dataCollection));
    }

    private static ContactDataDocument newRow(long contactId, MimeType mimeType, String data1, Instant createdAt) {
        ContactDataDocument row = new ContactDataDocument();
        row.setContactId(contactId);
        row.setMimeType(mimeType.getContentItemType());
        row.setData1(data1);
        row.setCreatedAt(createdAt);
        return row;
    }

    private static Optional<DataRow> toDataRow(ContactDataDocument doc) {
        if (doc.getContactId() == null) {
            return Optional.empty();
        }
        return MimeType.fromContentItemType(doc.getMimeType())
                .map(mimeType -> new DataRow(
                        doc.getContactId(),
                        mimeType,
                        doc.getData1(),
                        mimeType == MimeType.STRUCTURED_NAME ? doc.getData15() : null,
                        mimeType == MimeType.PHOTO ? doc.getPhotoUri() : null));
    }
}
