package io.ethcontacts.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Collection names and preference keys for the MongoDB-backed stores.
 * Defaults match the layout existing deployments already use.
 */
@ConfigurationProperties(prefix = "ethcontacts")
@NoArgsConstructor
@Getter
@Setter
public class EthContactsProperties {

    private Store store = new Store();
    private Preferences preferences = new Preferences();

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Store {

        /** One document per contact record. */
        private String contactsCollection = "raw_contacts";

        /** One document per name, phone, email or photo row. */
        private String dataCollection = "contact_data";

        /** Holds the contact id sequence. */
        private String countersCollection = "counters";
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Preferences {

        private String collection = "preferences";

        /** Preference namespace the ENS overrides live in. */
        private String namespace = "contact_prefs";

        /** ENS override key is this prefix followed by the contact id. */
        private String ensKeyPrefix = "ENS_";
    }
}
