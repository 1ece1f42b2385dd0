package com.usdtgate.api.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;
import org.springframework.stereotype.Component;

/**
 * Delegates to AddressValidator for a single source of truth.
 */
@Component
public class EvmAddressValidator implements ConstraintValidator<EvmAddress, String> {

    private final AddressValidator addressValidator;

    public EvmAddressValidator(AddressValidator addressValidator) {
        this.addressValidator = addressValidator;
    }

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        return value == null || addressValidator.isValidAddress(value);
    }
}
