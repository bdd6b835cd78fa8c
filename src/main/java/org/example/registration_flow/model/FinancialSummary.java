package org.example.registration_flow.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * Финансовая сводка регистрации.
 * <p>
 * Считается ТОЛЬКО на сервере. Клиент её показывает и кеширует,
 * но сам ничего не пересчитывает.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class FinancialSummary {

    @JsonProperty("base_fee")
    private BigDecimal baseFee;

    @JsonProperty("additional_fees")
    @Builder.Default
    private List<FeeLine> additionalFees = List.of();

    @JsonProperty("discounts")
    @Builder.Default
    private List<FeeLine> discounts = List.of();

    @JsonProperty("total_before_tax")
    private BigDecimal totalBeforeTax;

    @JsonProperty("tax_amount")
    private BigDecimal taxAmount;

    @JsonProperty("total_amount_due")
    private BigDecimal totalAmountDue;

    @JsonProperty("amount_paid")
    private BigDecimal amountPaid;

    @JsonProperty("balance_due")
    private BigDecimal balanceDue;

    /**
     * Сходятся ли итоги сводки между собой.
     * <p>
     * Используется только для предупреждения в логах: источник правды - сервер.
     */
    public boolean isConsistent() {
        if (baseFee == null || totalBeforeTax == null || taxAmount == null
                || totalAmountDue == null || amountPaid == null || balanceDue == null) {
            return false;
        }
        BigDecimal expectedBeforeTax = baseFee.add(sum(additionalFees)).subtract(sum(discounts));
        BigDecimal expectedDue = totalBeforeTax.add(taxAmount);
        BigDecimal expectedBalance = totalAmountDue.subtract(amountPaid).max(BigDecimal.ZERO);
        return expectedBeforeTax.compareTo(totalBeforeTax) == 0
                && expectedDue.compareTo(totalAmountDue) == 0
                && expectedBalance.compareTo(balanceDue.max(BigDecimal.ZERO)) == 0;
    }

    /**
     * Оплачено полностью: остаток (с отсечкой на нуле) равен нулю.
     */
    public boolean isPaidInFull() {
        return balanceDue != null && balanceDue.signum() <= 0;
    }

    private static BigDecimal sum(List<FeeLine> lines) {
        BigDecimal total = BigDecimal.ZERO;
        if (lines == null) {
            return total;
        }
        for (FeeLine line : lines) {
            if (line.amount() != null) {
                total = total.add(line.amount());
            }
        }
        return total;
    }
}
