package com.usdtgate.api.controller;

import com.usdtgate.api.dto.ErrorBody;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;

import java.util.Map;

/**
 * Turns request body validation failures into 400 responses. Constraint messages on the request
 * DTOs are error codes (INVALID_USER, INVALID_ADDRESS, ...); the first failing field decides the code.
 */
@RestControllerAdvice
public class ValidationExceptionHandler {

    static final String FALLBACK_CODE = "VALIDATION_ERROR";

    private static final Map<String, String> MESSAGES = Map.of(
            "INVALID_USER", "userId is required",
            "INVALID_ADDRESS", "Invalid BSC wallet address format",
            "INVALID_AMOUNT", "amountUsdt must be a positive number",
            "INVALID_PAYMENT_TYPE", "paymentType must be SUBSCRIPTION or POINTS",
            "INVALID_POINTS_AMOUNT", "pointsAmount must be positive",
            "INVALID_TRANSACTION_HASH", "Transaction hash is required",
            "INVALID_ADMIN", "adminId is required");

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        FieldError first = ex.getFieldError();
        String code = first != null && isCode(first.getDefaultMessage()) ? first.getDefaultMessage() : FALLBACK_CODE;
        String message = MESSAGES.get(code);
        if (message == null) {
            message = first != null ? first.getField() + ": " + first.getDefaultMessage() : "Validation failed";
        }
        return ResponseEntity.badRequest().body(ErrorBody.of(code, message));
    }

    private static boolean isCode(String message) {
        return message != null && message.startsWith("INVALID_");
    }
}
