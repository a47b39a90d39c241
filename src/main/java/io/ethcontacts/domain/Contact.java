package io.ethcontacts.domain;

import java.util.Objects;
import java.util.Optional;

/**
 * A contact merged from the contact store and the ENS preference store.
 * <p>
 * Built fresh on every query and never mutated. {@code displayName} is empty (never null) when the
 * store has no name for the contact; every other field is strictly optional.
 */
public record Contact(
        String contactId,
        String displayName,
        Optional<String> phoneNumber,
        Optional<String> email,
        Optional<String> photoUri,
        Optional<String> ethAddress,
        Optional<String> ensName) {

    public Contact {
        Objects.requireNonNull(contactId, "contactId must not be null");
        displayName = displayName == null ? "" : displayName;
        phoneNumber = phoneNumber == null ? Optional.empty() : phoneNumber;
        email = email == null ? Optional.empty() : email;
        photoUri = photoUri == null ? Optional.empty() : photoUri;
        ethAddress = ethAddress == null ? Optional.empty() : ethAddress;
        ensName = ensName == null ? Optional.empty() : ensName;
    }

    public static Builder builder(String contactId) {
        return new Builder(contactId);
    }

    public boolean hasEthAddress() {
        return ethAddress.filter(a -> !a.isBlank()).isPresent();
    }

    public boolean hasEns() {
        return ensName.filter(n -> !n.isBlank()).isPresent();
    }

    public boolean hasEthData() {
        return hasEthAddress() || hasEns();
    }

    /**
     * Accepts nullable values so callers holding raw store columns do not wrap each one.
     */
    public static final class Builder {
        private final String contactId;
        private String displayName;
        private String phoneNumber;
        private String email;
        private String photoUri;
        private String ethAddress;
        private String ensName;

        private Builder(String contactId) {
            this.contactId = contactId;
        }

        public Builder displayName(String displayName) {
            this.displayName = displayName;
            return this;
        }

        public Builder phoneNumber(String phoneNumber) {
            this.phoneNumber = phoneNumber;
            return this;
        }

        public Builder email(String email) {
            this.email = email;
            return this;
        }

        public Builder photoUri(String photoUri) {
            this.photoUri = photoUri;
            return this;
        }

        public Builder ethAddress(String ethAddress) {
            this.ethAddress = ethAddress;
            return this;
        }

        public Builder ensName(String ensName) {
            this.ensName = ensName;
            return this;
        }

        public Contact build() {
            return new Contact(
                    contactId,
                    displayName,
                    Optional.ofNullable(phoneNumber),
                    Optional.ofNullable(email),
                    Optional.ofNullable(photoUri),
                    Optional.ofNullable(ethAddress),
                    Optional.ofNullable(ensName));
        }
    }
}
