package com.usdtgate.activation;

import com.usdtgate.domain.Payment;
import com.usdtgate.domain.PaymentStatus;
import com.usdtgate.domain.PaymentType;
import com.usdtgate.store.PaymentStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ActivationDispatcherTest {

    private static final String PAYMENT_ID = "USDT-1700000000-a1b2c3d4";
    private static final String USER = "user-1";

    @Mock
    PaymentStore paymentStore;
    @Mock
    SubscriptionGateway subscriptionGateway;
    @Mock
    PointsGateway pointsGateway;

    @InjectMocks
    ActivationDispatcher dispatcher;

    private Payment payment;

    @BeforeEach
    void setUp() {
        payment = new Payment();
        payment.setPaymentId(PAYMENT_ID);
        payment.setUserId(USER);
        payment.setStatus(PaymentStatus.CONFIRMED);
        payment.setAmountUsdt(new BigDecimal("10"));
        payment.setAmountVnd(new BigDecimal("250000"));
        payment.setTransactionHash("0x" + "a".repeat(64));
    }

    @Test
    @DisplayName("Subscription payment creates the subscription and links it")
    void activate_subscription() {
        payment.setPaymentType(PaymentType.SUBSCRIPTION);
        payment.setPlan("premium");
        payment.setDuration("3_months");
        when(paymentStore.getPayment(PAYMENT_ID)).thenReturn(Optional.of(payment));
        when(subscriptionGateway.createOrUpgrade(USER, "premium", "3_months", PAYMENT_ID)).thenReturn("sub-1");

        ActivationResult result = dispatcher.activate(payment);

        assertThat(result.success()).isTrue();
        assertThat(result.alreadyActivated()).isFalse();
        assertThat(result.linkedId()).isEqualTo("sub-1");
        verify(paymentStore).linkSubscription(PAYMENT_ID, "sub-1");
        verifyNoInteractions(pointsGateway);
    }

    @Test
    @DisplayName("Points payment credits points with payment metadata")
    @SuppressWarnings("unchecked")
    void activate_points() {
        payment.setPaymentType(PaymentType.POINTS);
        payment.setPointsAmount(500);
        when(paymentStore.getPayment(PAYMENT_ID)).thenReturn(Optional.of(payment));
        when(pointsGateway.addPoints(eq(USER), eq(500), eq("purchase"), anyString(), any())).thenReturn("ptx-9");

        ActivationResult result = dispatcher.activate(payment);

        assertThat(result.success()).isTrue();
        assertThat(result.linkedId()).isEqualTo("ptx-9");
        ArgumentCaptor<Map<String, Object>> metadata = ArgumentCaptor.forClass(Map.class);
        verify(pointsGateway).addPoints(eq(USER), eq(500), eq("purchase"),
                eq("Points purchase via USDT: " + PAYMENT_ID), metadata.capture());
        assertThat(metadata.getValue())
                .containsEntry("paymentId", PAYMENT_ID)
                .containsEntry("payment_method", "USDT_BEP20")
                .containsEntry("transactionHash", payment.getTransactionHash());
        verify(paymentStore).linkPointsTransaction(PAYMENT_ID, "ptx-9");
    }

    @Test
    @DisplayName("Already linked payment never calls the gateway again")
    void activate_alreadyLinked_skipsGateway() {
        payment.setPaymentType(PaymentType.SUBSCRIPTION);
        payment.setSubscriptionId("sub-existing");
        when(paymentStore.getPayment(PAYMENT_ID)).thenReturn(Optional.of(payment));

        ActivationResult result = dispatcher.activate(payment);

        assertThat(result.success()).isTrue();
        assertThat(result.alreadyActivated()).isTrue();
        assertThat(result.linkedId()).isEqualTo("sub-existing");
        verifyNoInteractions(subscriptionGateway, pointsGateway);
        verify(paymentStore, never()).linkSubscription(anyString(), anyString());
    }

    @Test
    @DisplayName("Gateway failure is returned as a failed result")
    void activate_gatewayFails_returnsFailure() {
        payment.setPaymentType(PaymentType.SUBSCRIPTION);
        payment.setPlan("pro");
        payment.setDuration("12_months");
        when(paymentStore.getPayment(PAYMENT_ID)).thenReturn(Optional.of(payment));
        when(subscriptionGateway.createOrUpgrade(anyString(), anyString(), anyString(), anyString()))
                .thenThrow(new ActivationException("Subscription service returned 503"));

        ActivationResult result = dispatcher.activate(payment);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).contains("503");
        verify(paymentStore, never()).linkSubscription(anyString(), anyString());
    }

    @Test
    void activate_pointsWithoutAmount_fails() {
        payment.setPaymentType(PaymentType.POINTS);
        when(paymentStore.getPayment(PAYMENT_ID)).thenReturn(Optional.of(payment));

        ActivationResult result = dispatcher.activate(payment);

        assertThat(result.success()).isFalse();
        verify(pointsGateway, never()).addPoints(anyString(), anyInt(), anyString(), anyString(), any());
    }

    @Test
    void activate_missingPayment_fails() {
        when(paymentStore.getPayment(PAYMENT_ID)).thenReturn(Optional.empty());

        assertThat(dispatcher.activate(payment).success()).isFalse();
        verifyNoInteractions(subscriptionGateway, pointsGateway);
    }
}
