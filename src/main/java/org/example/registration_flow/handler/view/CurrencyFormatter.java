package org.example.registration_flow.handler.view;

import java.math.BigDecimal;
import java.text.NumberFormat;
import java.util.Currency;
import java.util.Locale;

/**
 * Форматирование сумм для показа. Чистая презентация: никаких расчётов.
 */
public class CurrencyFormatter {

    private final Locale locale;
    private final Currency currency;

    public CurrencyFormatter(String localeTag, String currencyCode) {
        this.locale = Locale.forLanguageTag(localeTag);
        this.currency = Currency.getInstance(currencyCode);
    }

    public String format(BigDecimal amount) {
        // NumberFormat не потокобезопасен - создаём на каждый вызов
        NumberFormat format = NumberFormat.getCurrencyInstance(locale);
        format.setCurrency(currency);
        return format.format(amount == null ? BigDecimal.ZERO : amount);
    }
}
