package io.ethcontacts.reconcile;

import io.ethcontacts.classifier.AuxiliaryFieldClassifier;
import io.ethcontacts.classifier.AuxiliaryValue;
import io.ethcontacts.domain.Contact;
import io.ethcontacts.domain.ContactField;
import io.ethcontacts.domain.ContactHeader;
import io.ethcontacts.domain.DataRow;
import io.ethcontacts.domain.MimeType;
import io.ethcontacts.source.ContactDataSource;
import io.ethcontacts.source.EnsPreferenceStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.PermissionDeniedDataAccessException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Merges contact-store rows with ENS overrides from the preference store into {@link Contact} values.
 * <p>
 * ENS precedence: an ENS name found in the auxiliary slot wins; the preference override is the fallback.
 * Wallet addresses only ever come from the auxiliary slot. Store errors never escape: a listing degrades
 * to an empty list, a point lookup to empty.
 */
@Slf4j
@RequiredArgsConstructor
public class ContactReconciler {

    private static final Set<MimeType> LISTED_MIME_TYPES = EnumSet.allOf(MimeType.class);

    /** List.sort is stable, so ties keep contact-id scan order. */
    private static final Comparator<Contact> BY_DISPLAY_NAME =
            Comparator.comparing(c -> c.displayName().toLowerCase(Locale.ROOT));

    private final ContactDataSource contactDataSource;
    private final EnsPreferenceStore ensPreferenceStore;
    private final AuxiliaryFieldClassifier classifier;

    /**
     * Every contact with at least one name, phone, email or photo row, sorted case-insensitively by display name.
     * Contacts without a name row are included with an empty display name.
     */
    public List<Contact> listAll() {
        List<DataRow> rows;
        try {
            rows = contactDataSource.listDataRows(LISTED_MIME_TYPES);
        } catch (PermissionDeniedDataAccessException e) {
            log.warn("Read access to contact store denied; returning no contacts: {}", e.getMessage());
            return List.of();
        } catch (DataAccessException e) {
            log.warn("Contact store listing failed; returning no contacts: {}", e.getMessage());
            return List.of();
        }

        Map<Long, TempContactData> byContactId = new LinkedHashMap<>();
        for (DataRow row : rows) {
            byContactId.computeIfAbsent(row.contactId(), id -> new TempContactData()).accept(row, classifier);
        }

        List<Contact> contacts = new ArrayList<>(byContactId.size());
        byContactId.forEach((contactId, data) -> contacts.add(merge(
                contactId,
                data.getDisplayName(),
                data.getPhoneNumber(),
                data.getEmail(),
                data.getPhotoUri(),
                data.getAuxiliary())));
        contacts.sort(BY_DISPLAY_NAME);
        log.debug("Reconciled {} contacts from {} data rows", contacts.size(), rows.size());
        return contacts;
    }

    /**
     * Point lookup. The header is the existence check: a missing header or empty display name means not found,
     * as does an id that is not a canonical decimal number ("7", not " 7" or "007").
     */
    public Optional<Contact> getById(String contactId) {
        Long id = parseContactId(contactId);
        if (id == null) {
            return Optional.empty();
        }
        try {
            Optional<ContactHeader> header = contactDataSource.getContactHeader(id);
            if (header.isEmpty() || header.get().displayName() == null || header.get().displayName().isEmpty()) {
                return Optional.empty();
            }
            String phoneNumber = contactDataSource.queryField(id, ContactField.PHONE).orElse(null);
            String email = contactDataSource.queryField(id, ContactField.EMAIL).orElse(null);
            AuxiliaryValue auxiliary = classifier.toAuxiliaryValue(contactDataSource.getAuxiliaryField(id).orElse(null));
            return Optional.of(merge(
                    id,
                    header.get().displayName(),
                    phoneNumber,
                    email,
                    header.get().photoUri(),
                    auxiliary));
        } catch (PermissionDeniedDataAccessException e) {
            log.warn("Read access to contact store denied for contact {}: {}", id, e.getMessage());
            return Optional.empty();
        } catch (DataAccessException e) {
            log.warn("Lookup of contact {} failed: {}", id, e.getMessage());
            return Optional.empty();
        }
    }

    private Contact merge(long contactId, String displayName, String phoneNumber, String email,
                          String photoUri, AuxiliaryValue auxiliary) {
        Optional<String> override = findEnsOverride(contactId);
        String ensName = auxiliary.asEnsName().or(() -> override).orElse(null);
        return Contact.builder(String.valueOf(contactId))
                .displayName(displayName)
                .phoneNumber(phoneNumber)
                .email(email)
                .photoUri(photoUri)
                .ethAddress(auxiliary.asEthAddress().orElse(null))
                .ensName(ensName)
                .build();
    }

    /** Looked up for every contact, even when the auxiliary slot already holds an ENS name. */
    private Optional<String> findEnsOverride(long contactId) {
        try {
            return ensPreferenceStore.getEnsOverride(contactId);
        } catch (DataAccessException e) {
            log.warn("ENS override lookup failed for contact {}: {}", contactId, e.getMessage());
            return Optional.empty();
        }
    }

    /** Only canonical decimal ids are accepted, so the returned contact carries the id the caller passed. */
    private static Long parseContactId(String contactId) {
        if (contactId == null || contactId.isEmpty()) {
            return null;
        }
        try {
            long id = Long.parseLong(contactId);
            if (!Long.toString(id).equals(contactId)) {
                log.debug("Contact id {} is not in canonical form", contactId);
                return null;
            }
            return id;
        } catch (NumberFormatException e) {
            log.debug("Contact id {} is not numeric", contactId);
            return null;
        }
    }
}
