package io.ethcontacts.mutation;

import lombok.Getter;

/**
 * Thrown before any store access when a wallet address does not match {@code 0x} + 40 hex characters.
 * Distinct from a store refusing a write, which is reported as a false result.
 */
@Getter
public class InvalidEthAddressException extends IllegalArgumentException {

    public static final String INVALID_ADDRESS = "INVALID_ADDRESS";

    private final String errorCode = INVALID_ADDRESS;
    private final String address;

    public InvalidEthAddressException(String address) {
        super("Invalid ETH address '" + address + "': must match 0x followed by 40 hex characters");
        this.address = address;
    }
}
