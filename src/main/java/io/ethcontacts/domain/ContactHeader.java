package io.ethcontacts.domain;

/**
 * Aggregate-level contact columns returned by the store's header lookup.
 */
public record ContactHeader(String displayName, String photoUri) {
}
