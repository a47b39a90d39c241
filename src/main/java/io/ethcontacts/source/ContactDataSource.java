package io.ethcontacts.source;

import io.ethcontacts.domain.ContactField;
import io.ethcontacts.domain.ContactHeader;
import io.ethcontacts.domain.DataRow;
import io.ethcontacts.domain.MimeType;

import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Relational contact store: contact records with name, phone, email and photo data rows.
 * <p>
 * Implementations report store failures as {@link org.springframework.dao.DataAccessException};
 * a refused read or write surfaces as {@link org.springframework.dao.PermissionDeniedDataAccessException}.
 * Callers convert them into their own result contracts.
 */
public interface ContactDataSource {

    /**
     * All data rows of the given kinds, ordered by contact id ascending and then by row insertion order.
     */
    List<DataRow> listDataRows(Set<MimeType> mimeTypes);

    /** Display name and photo of the contact record; empty if the record does not exist. */
    Optional<ContactHeader> getContactHeader(long contactId);

    /** First row of the given kind for the contact. */
    Optional<String> queryField(long contactId, ContactField field);

    /** Auxiliary slot of the contact's structured-name row. */
    Optional<String> getAuxiliaryField(long contactId);

    /**
     * Overwrites the auxiliary slot of the existing structured-name row.
     *
     * @return false if the contact has no structured-name row; no row is created
     */
    boolean setAuxiliaryField(long contactId, String value);

    /**
     * Creates a contact record with its name row and, when non-blank, phone and email rows, as one batch.
     *
     * @return the new contact id, or empty if the store did not report one
     */
    OptionalLong createContact(String displayName, String phoneNumber, String email);
}
