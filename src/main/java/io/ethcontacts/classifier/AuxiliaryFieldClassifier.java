package io.ethcontacts.classifier;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Tells a wallet address from an ENS name in the structured-name auxiliary slot.
 * Pure and deterministic; no trimming is applied, so surrounding whitespace disqualifies an address.
 */
public class AuxiliaryFieldClassifier {

    private static final Pattern EVM_ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");
    private static final char ENS_SEPARATOR = '.';

    /**
     * @return WALLET_ADDRESS, ENS_NAME or UNCLASSIFIED; never ABSENT
     */
    public AuxiliaryKind classify(String value) {
        Objects.requireNonNull(value, "value must not be null");
        if (EVM_ADDRESS.matcher(value).matches()) return AuxiliaryKind.WALLET_ADDRESS;
        if (value.indexOf(ENS_SEPARATOR) >= 0) return AuxiliaryKind.ENS_NAME;
        return AuxiliaryKind.UNCLASSIFIED;
    }

    /** Null maps to ABSENT; anything else is classified. */
    public AuxiliaryValue toAuxiliaryValue(String rawValue) {
        if (rawValue == null) return AuxiliaryValue.absent();
        return switch (classify(rawValue)) {
            case WALLET_ADDRESS -> AuxiliaryValue.walletAddress(rawValue);
            case ENS_NAME -> AuxiliaryValue.ensName(rawValue);
            default -> AuxiliaryValue.unclassified(rawValue);
        };
    }

    public boolean isWalletAddress(String value) {
        return value != null && EVM_ADDRESS.matcher(value).matches();
    }
}
