package io.ethcontacts.mutation;

import io.ethcontacts.classifier.AuxiliaryFieldClassifier;
import io.ethcontacts.source.ContactDataSource;
import io.ethcontacts.source.EnsPreferenceStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.TransactionException;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Write side of the contacts API. Writes go straight to the stores; nothing spans both stores atomically.
 * <p>
 * {@link #setEnsName} writes only the auxiliary slot, while {@link #createContact} writes an ENS name to both
 * the slot and the preference store. Callers wanting the override must call {@link #saveEnsOverride} themselves.
 */
@Slf4j
@RequiredArgsConstructor
public class ContactMutationService {

    private final ContactDataSource contactDataSource;
    private final EnsPreferenceStore ensPreferenceStore;
    private final AuxiliaryFieldClassifier classifier;

    /**
     * Stores a wallet address in the contact's auxiliary slot.
     *
     * @return false if the contact has no name row or the store refused the write
     * @throws InvalidEthAddressException if the address is malformed; no store call is made
     */
    public boolean setWalletAddress(long contactId, String address) {
        Objects.requireNonNull(address, "address must not be null");
        if (!classifier.isWalletAddress(address)) {
            throw new InvalidEthAddressException(address);
        }
        boolean written = writeAuxiliaryField(contactId, address);
        if (written) {
            log.info("Wallet address {} set on contact {}", address, contactId);
        }
        return written;
    }

    /**
     * Stores an ENS name in the contact's auxiliary slot, replacing any wallet address. Not validated.
     *
     * @return false if the contact has no name row or the store refused the write
     */
    public boolean setEnsName(long contactId, String ensName) {
        Objects.requireNonNull(ensName, "ensName must not be null");
        boolean written = writeAuxiliaryField(contactId, ensName);
        if (written) {
            log.info("ENS name {} set on contact {}", ensName, contactId);
        }
        return written;
    }

    /** Writes the preference-store override only. Store failures are logged, not thrown. */
    public void saveEnsOverride(long contactId, String ensName) {
        Objects.requireNonNull(ensName, "ensName must not be null");
        try {
            ensPreferenceStore.setEnsOverride(contactId, ensName);
            log.info("ENS override {} saved for contact {}", ensName, contactId);
        } catch (DataAccessException e) {
            log.warn("Saving ENS override for contact {} failed: {}", contactId, e.getMessage());
        }
    }

    /**
     * Creates a contact, then attaches Ethereum fields best-effort:
     * <ol>
     *     <li>contact record with name, phone and email rows, as one batch; failure returns empty</li>
     *     <li>ethAddress, else ensName, into the auxiliary slot (address wins when both are given)</li>
     *     <li>non-blank ensName into the preference store, whatever step 2 did</li>
     * </ol>
     * Steps 2 and 3 are separate writes. Their failure is logged and does not undo step 1.
     *
     * @return the new contact id, or empty if the contact record could not be created
     */
    public Optional<String> createContact(String displayName, String phoneNumber, String email,
                                          String ethAddress, String ensName) {
        Objects.requireNonNull(displayName, "displayName must not be null");
        OptionalLong created;
        try {
            created = contactDataSource.createContact(displayName, phoneNumber, email);
        } catch (DataAccessException | TransactionException e) {
            log.warn("Creating contact failed: {}", e.getMessage());
            return Optional.empty();
        }
        if (created.isEmpty()) {
            log.warn("Contact store returned no id for new contact");
            return Optional.empty();
        }
        long contactId = created.getAsLong();

        String auxiliaryValue = ethAddress != null ? ethAddress : ensName;
        if (auxiliaryValue != null && !writeAuxiliaryField(contactId, auxiliaryValue)) {
            log.warn("Contact {} created but its auxiliary field was not written", contactId);
        }
        if (ensName != null && !ensName.isBlank()) {
            saveEnsOverride(contactId, ensName);
        }

        log.info("Created contact {}", contactId);
        return Optional.of(String.valueOf(contactId));
    }

    public Optional<String> createContact(String displayName) {
        return createContact(displayName, null, null, null, null);
    }

    private boolean writeAuxiliaryField(long contactId, String value) {
        try {
            return contactDataSource.setAuxiliaryField(contactId, value);
        } catch (DataAccessException e) {
            log.warn("Writing auxiliary field of contact {} failed: {}", contactId, e.getMessage());
            return false;
        }
    }
}
