package io.ethcontacts.domain;

/**
 * One row of the contact store's data table.
 *
 * @param contactId      owning contact
 * @param mimeType       row kind
 * @param primaryValue   display name, phone number or email address depending on kind (data1)
 * @param auxiliaryValue auxiliary slot of a structured-name row (data15); null for other kinds
 * @param photoUri       photo location for photo rows
 */
public record DataRow(long contactId, MimeType mimeType, String primaryValue, String auxiliaryValue, String photoUri) {
}
