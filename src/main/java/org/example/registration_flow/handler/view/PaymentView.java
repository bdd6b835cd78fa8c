package org.example.registration_flow.handler.view;

import org.example.registration_flow.model.PaymentIntent;

import java.math.BigDecimal;

public record PaymentView(
        Stage stage,
        BigDecimal amountDue,
        PaymentIntent paymentIntent,
        String error
) {

    public enum Stage {
        LOADING,
        /** Остаток есть, можно запрашивать оплату */
        READY,
        /** Намерение оплаты создано, ждём ответа шлюза */
        AWAITING_GATEWAY,
        /** Остаток нулевой - платить нечего */
        NO_PAYMENT_REQUIRED,
        PAID,
        ERROR
    }
}
