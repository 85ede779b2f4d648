package com.traceradar.api.validation;

import com.traceradar.common.TransactionHashes;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

/**
 * Validates transaction hash format for Jakarta Bean Validation.
 * Delegates to TransactionHashes so the service and the API share one rule.
 */
public class TransactionHashValidator implements ConstraintValidator<TransactionHash, String> {

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        return TransactionHashes.isValid(value);
    }
}
