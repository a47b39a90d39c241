package io.ethcontacts.source.mongo;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;

/**
 * One data row of a contact. Column names follow the platform contacts provider:
 * data1 is the primary value, data15 the auxiliary slot of structured-name rows.
 * The collection name is configurable, so the (contactId, mimetype) index is created by
 * {@link MongoContactDataSource#ensureIndexes()} rather than by mapping annotations.
 */
@Document(collection = "contact_data")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ContactDataDocument {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private Long contactId;
    @Field("mimetype")
    private String mimeType;
    private String data1;
    private String data15;
    private String photoUri;
    private Instant createdAt;
}
