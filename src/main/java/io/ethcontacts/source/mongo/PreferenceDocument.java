package io.ethcontacts.source.mongo;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * String preference entry. Id is namespace + ":" + key so one collection can host several namespaces.
 */
@Document(collection = "preferences")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class PreferenceDocument {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String namespace;
    private String key;
    private String value;
    private Instant updatedAt;
}
