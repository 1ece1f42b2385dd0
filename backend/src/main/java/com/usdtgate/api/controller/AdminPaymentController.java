package com.usdtgate.api.controller;

import com.usdtgate.api.dto.ManualConfirmRequest;
import com.usdtgate.api.dto.PaymentResponse;
import com.usdtgate.domain.PaymentStatus;
import com.usdtgate.domain.PaymentType;
import com.usdtgate.payment.PaymentService;
import com.usdtgate.store.PaymentFilter;
import com.usdtgate.store.PaymentStats;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Admin listing, statistics and manual confirmation. Access control is left to the deployment.
 */
@RestController
@RequestMapping("/api/v1/admin/payments")
@RequiredArgsConstructor
public class AdminPaymentController {

    private final PaymentService paymentService;

    @GetMapping
    public ResponseEntity<List<PaymentResponse>> list(
            @RequestParam(required = false) String userId,
            @RequestParam(required = false) PaymentType type,
            @RequestParam(required = false) PaymentStatus status,
            @RequestParam(required = false, defaultValue = "50") int limit,
            @RequestParam(required = false, defaultValue = "0") int skip
    ) {
        return ResponseEntity.ok(paymentService.listPayments(new PaymentFilter(userId, type, status, limit, skip)).stream()
                .map(PaymentResponse::from)
                .toList());
    }

    @GetMapping("/stats")
    public ResponseEntity<PaymentStats> stats() {
        return ResponseEntity.ok(paymentService.getStats());
    }

    @PostMapping("/{paymentId}/confirm")
    public ResponseEntity<PaymentResponse> confirm(@PathVariable String paymentId,
                                                   @Valid @RequestBody ManualConfirmRequest request) {
        return ResponseEntity.ok(PaymentResponse.from(
                paymentService.manualConfirm(paymentId, request.adminId(), request.notes())));
    }
}
