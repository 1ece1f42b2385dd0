package com.usdtgate.api.controller;

import com.usdtgate.api.dto.ErrorBody;
import com.usdtgate.payment.PaymentServiceException;
import com.usdtgate.store.PaymentStoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps payment service and store errors to HTTP statuses: 404 not found, 400 bad input,
 * 422 insufficient balance, 409 for state and linkage conflicts.
 */
@RestControllerAdvice
@Slf4j
public class PaymentExceptionHandler {

    @ExceptionHandler(PaymentServiceException.class)
    public ResponseEntity<ErrorBody> handleService(PaymentServiceException ex) {
        return respond(ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(PaymentStoreException.class)
    public ResponseEntity<ErrorBody> handleStore(PaymentStoreException ex) {
        return respond(ex.getErrorCode(), ex.getMessage());
    }

    private static ResponseEntity<ErrorBody> respond(String errorCode, String message) {
        HttpStatus status = statusOf(errorCode);
        if (status == HttpStatus.CONFLICT) {
            log.info("Payment request rejected: {} {}", errorCode, message);
        }
        return ResponseEntity.status(status).body(ErrorBody.of(errorCode, message));
    }

    static HttpStatus statusOf(String errorCode) {
        return switch (errorCode) {
            case PaymentServiceException.PAYMENT_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case PaymentServiceException.INVALID_TRANSACTION_HASH, PaymentStoreException.INVALID_PAYMENT ->
                    HttpStatus.BAD_REQUEST;
            case PaymentServiceException.INSUFFICIENT_BALANCE -> HttpStatus.UNPROCESSABLE_ENTITY;
            default -> HttpStatus.CONFLICT;
        };
    }
}
