package io.ethcontacts.classifier;

import java.util.Objects;
import java.util.Optional;

/**
 * Classified content of the auxiliary slot. Wallet address and ENS name share the slot, so at most
 * one of {@link #asEthAddress()} and {@link #asEnsName()} is present.
 */
public record AuxiliaryValue(AuxiliaryKind kind, String value) {

    private static final AuxiliaryValue ABSENT = new AuxiliaryValue(AuxiliaryKind.ABSENT, null);

    public AuxiliaryValue {
        Objects.requireNonNull(kind, "kind must not be null");
        if (kind == AuxiliaryKind.ABSENT ? value != null : value == null) {
            throw new IllegalArgumentException("value must be null exactly when kind is ABSENT");
        }
    }

    public static AuxiliaryValue walletAddress(String value) {
        return new AuxiliaryValue(AuxiliaryKind.WALLET_ADDRESS, value);
    }

    public static AuxiliaryValue ensName(String value) {
        return new AuxiliaryValue(AuxiliaryKind.ENS_NAME, value);
    }

    public static AuxiliaryValue unclassified(String value) {
        return new AuxiliaryValue(AuxiliaryKind.UNCLASSIFIED, value);
    }

    public static AuxiliaryValue absent() {
        return ABSENT;
    }

    public Optional<String> asEthAddress() {
        return kind == AuxiliaryKind.WALLET_ADDRESS ? Optional.of(value) : Optional.empty();
    }

    public Optional<String> asEnsName() {
        return kind == AuxiliaryKind.ENS_NAME ? Optional.of(value) : Optional.empty();
    }
}
