package io.ethcontacts.classifier;

/**
 * What the structured-name auxiliary slot holds. A slot resolves to exactly one kind.
 */
public enum AuxiliaryKind {
    WALLET_ADDRESS,
    ENS_NAME,
    /** Non-null value that is neither an address nor an ENS name; ignored for Ethereum fields. */
    UNCLASSIFIED,
    ABSENT
}
