package org.example.registration_flow.flow;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.example.registration_flow.model.FieldValueMap;
import org.example.registration_flow.model.FinancialSummary;
import org.example.registration_flow.model.PaymentIntent;
import org.example.registration_flow.model.Program;

/**
 * Частичное обновление {@link FlowState}.
 * <p>
 * null = "не трогать". formData сливается поверх уже сохранённых ответов,
 * остальные поля заменяются целиком.
 */
@Getter
@Builder
@ToString
public class FlowStatePatch {

    private final String registrationId;
    private final Program selectedProgram;
    private final FieldValueMap formData;
    private final FinancialSummary feeCalculation;
    private final PaymentIntent paymentIntent;

    private final Boolean formCompleted;
    private final Boolean feesConfirmed;
    private final Boolean registrationFinalized;
    private final JsonNode finalizationResult;
    private final Boolean paymentCompleted;
    private final Boolean registrationCompleted;

    public static FlowStatePatch empty() {
        return FlowStatePatch.builder().build();
    }
}
