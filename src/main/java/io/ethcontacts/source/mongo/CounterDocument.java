package io.ethcontacts.source.mongo;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Monotonic sequence, one document per sequence name.
 */
@Document(collection = "counters")
@NoArgsConstructor
@Getter
@Setter
public class CounterDocument {

    @Id
    private String id;
    private long seq;
}
