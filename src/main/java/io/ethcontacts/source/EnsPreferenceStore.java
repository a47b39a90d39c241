package io.ethcontacts.source;

import java.util.Optional;

/**
 * Namespaced key-value store holding ENS overrides per contact. Never holds wallet addresses.
 */
public interface EnsPreferenceStore {

    Optional<String> getEnsOverride(long contactId);

    /** Durable once this returns. */
    void setEnsOverride(long contactId, String ensName);
}
