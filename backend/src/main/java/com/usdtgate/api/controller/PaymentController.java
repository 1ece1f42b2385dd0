package com.usdtgate.api.controller;

import com.usdtgate.api.dto.CreatePaymentRequest;
import com.usdtgate.api.dto.PaymentResponse;
import com.usdtgate.api.dto.SubmitTransactionRequest;
import com.usdtgate.api.dto.WalletResponse;
import com.usdtgate.domain.Payment;
import com.usdtgate.domain.PaymentStatus;
import com.usdtgate.domain.PaymentType;
import com.usdtgate.payment.PaymentService;
import com.usdtgate.payment.PaymentView;
import com.usdtgate.store.CreatePaymentCommand;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.*;

import java.net.InetSocketAddress;
import java.util.List;

/**
 * User-facing payment endpoints: create, status, submit hash, confirm sent, cancel, history, wallets.
 */
@RestController
@RequestMapping("/api/v1/payments")
@RequiredArgsConstructor
public class PaymentController {

    private final PaymentService paymentService;

    @PostMapping
    public ResponseEntity<PaymentResponse> create(@Valid @RequestBody CreatePaymentRequest request,
                                                  ServerHttpRequest httpRequest) {
        CreatePaymentCommand command = new CreatePaymentCommand(
                request.userId(),
                request.userEmail(),
                request.userName(),
                request.paymentType(),
                request.amountUsdt(),
                request.amountVnd(),
                request.usdtRate(),
                null,
                request.fromAddress(),
                request.plan(),
                request.duration(),
                request.pointsAmount(),
                clientIp(httpRequest),
                httpRequest.getHeaders().getFirst(HttpHeaders.USER_AGENT),
                request.notes());
        Payment payment = paymentService.createPayment(command);
        return ResponseEntity.status(HttpStatus.CREATED).body(PaymentResponse.from(payment));
    }

    @GetMapping("/{paymentId}")
    public ResponseEntity<PaymentResponse> get(@PathVariable String paymentId) {
        PaymentView view = paymentService.getPayment(paymentId);
        return ResponseEntity.ok(PaymentResponse.from(view.payment(), view.message()));
    }

    @PostMapping("/{paymentId}/transaction")
    public ResponseEntity<PaymentResponse> submitTransaction(@PathVariable String paymentId,
                                                             @Valid @RequestBody SubmitTransactionRequest request) {
        return ResponseEntity.ok(PaymentResponse.from(
                paymentService.submitTransactionHash(paymentId, request.transactionHash())));
    }

    @PostMapping("/{paymentId}/confirm-sent")
    public ResponseEntity<PaymentResponse> confirmSent(@PathVariable String paymentId) {
        return ResponseEntity.ok(PaymentResponse.from(paymentService.confirmSent(paymentId)));
    }

    @PostMapping("/{paymentId}/cancel")
    public ResponseEntity<PaymentResponse> cancel(@PathVariable String paymentId) {
        return ResponseEntity.ok(PaymentResponse.from(paymentService.cancel(paymentId)));
    }

    @GetMapping("/users/{userId}")
    public ResponseEntity<List<PaymentResponse>> history(
            @PathVariable String userId,
            @RequestParam(required = false) PaymentType type,
            @RequestParam(required = false) PaymentStatus status,
            @RequestParam(required = false, defaultValue = "50") int limit,
            @RequestParam(required = false, defaultValue = "0") int skip
    ) {
        return ResponseEntity.ok(paymentService.getUserPayments(userId, type, status, limit, skip).stream()
                .map(PaymentResponse::from)
                .toList());
    }

    @GetMapping("/users/{userId}/wallets")
    public ResponseEntity<List<WalletResponse>> wallets(@PathVariable String userId) {
        return ResponseEntity.ok(paymentService.getUserWallets(userId).stream()
                .map(WalletResponse::from)
                .toList());
    }

    private static String clientIp(ServerHttpRequest request) {
        String forwarded = request.getHeaders().getFirst("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        InetSocketAddress remote = request.getRemoteAddress();
        return remote != null && remote.getAddress() != null ? remote.getAddress().getHostAddress() : null;
    }
}
