package io.ethcontacts.source.mongo;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Underlying contact record. The numeric id comes from the counters collection.
 */
@Document(collection = "raw_contacts")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class RawContactDocument {

    @Id
    @EqualsAndHashCode.Include
    private Long id;
    private String displayName;
    private Instant createdAt;
}
