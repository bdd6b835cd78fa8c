package org.example.registration_flow.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Намерение оплаты от платёжного шлюза. Для движка регистрации - непрозрачный объект.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PaymentIntent(
        @JsonProperty("id") String id,
        @JsonProperty("client_secret") String clientSecret,
        @JsonProperty("amount") BigDecimal amount,
        @JsonProperty("currency") String currency,
        @JsonProperty("status") String status
) {

    public static final String NO_PAYMENT_REQUIRED = "no-payment-required";

    /**
     * Оплата не нужна (остаток нулевой) - фиксируем это отдельным "намерением".
     */
    public static PaymentIntent noPaymentRequired() {
        return new PaymentIntent(NO_PAYMENT_REQUIRED, null, BigDecimal.ZERO, null, "no_payment_required");
    }

    public boolean isNoPaymentRequired() {
        return NO_PAYMENT_REQUIRED.equals(id);
    }
}
