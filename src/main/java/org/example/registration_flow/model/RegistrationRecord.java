package org.example.registration_flow.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Регистрация в том виде, в каком её отдаёт GET /registration-flow/{id}/status.
 * <p>
 * Клиенту не принадлежит: только читаем.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class RegistrationRecord {

    @JsonProperty("id")
    private String id;

    /**
     * Статус в словаре сервера (completed, confirmed, pending ...).
     */
    @JsonProperty("status")
    private String status;

    @JsonProperty("total_amount_due")
    private BigDecimal totalAmountDue;

    @JsonProperty("balance_due")
    private BigDecimal balanceDue;

    @JsonProperty("amount_paid")
    private BigDecimal amountPaid;

    @JsonProperty("notes")
    private String notes;

    @JsonProperty("created_at")
    private String createdAt;

    @JsonProperty("program")
    private Program program;

    @JsonProperty("form_data")
    @Builder.Default
    private List<FormDataEntry> formData = List.of();

    @JsonProperty("financial_summary")
    private FinancialSummary financialSummary;

    /**
     * Значение ответа формы по field_name (пустые значения не считаются).
     */
    public Optional<String> formValue(String fieldName) {
        if (formData == null) {
            return Optional.empty();
        }
        return formData.stream()
                .filter(entry -> fieldName.equals(entry.fieldName()))
                .map(FormDataEntry::fieldValue)
                .filter(value -> value != null && !value.isBlank())
                .findFirst();
    }
}
