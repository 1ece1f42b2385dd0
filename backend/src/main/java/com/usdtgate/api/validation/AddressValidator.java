package com.usdtgate.api.validation;

import com.usdtgate.common.EvmHex;
import org.springframework.stereotype.Component;

/**
 * Validates BSC wallet addresses and transaction hashes from request input.
 */
@Component
public class AddressValidator {

    public boolean isValidAddress(String address) {
        if (address == null || address.isBlank()) return false;
        return EvmHex.isAddress(address.trim());
    }

    public boolean isValidTransactionHash(String hash) {
        if (hash == null || hash.isBlank()) return false;
        return EvmHex.isTransactionHash(hash.trim());
    }
}
