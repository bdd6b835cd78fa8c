package org.example.registration_flow.flow;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.example.registration_flow.model.FieldValueMap;
import org.example.registration_flow.model.FinancialSummary;
import org.example.registration_flow.model.PaymentIntent;
import org.example.registration_flow.model.Program;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.TreeSet;

/**
 * Общее состояние регистрации между шагами.
 * <p>
 * Принадлежит оркестратору. Шаги получают ссылку только на чтение:
 * сеттеры видны лишь {@link FlowStateStore}, менять состояние можно
 * исключительно через advance / retreat / patch.
 */
@Getter
@Setter(AccessLevel.PACKAGE)
@ToString
public class FlowState {

    private FlowStep currentStep = FlowStep.PROGRAM_SELECT;

    /** Появляется после создания черновика регистрации на сервере */
    private String registrationId;

    private Program selectedProgram;

    @Getter(AccessLevel.NONE)
    private FieldValueMap formData = FieldValueMap.empty();

    /** Последняя полученная с сервера сводка. Это кеш, а не источник правды */
    private FinancialSummary feeCalculation;

    private PaymentIntent paymentIntent;

    @Getter(AccessLevel.NONE)
    private final Set<FlowStep> completedSteps = EnumSet.noneOf(FlowStep.class);

    // Флаги, которые шаги передают при переходе вперёд
    private boolean formCompleted;
    private boolean feesConfirmed;
    private boolean registrationFinalized;
    private JsonNode finalizationResult;
    private boolean paymentCompleted;
    private boolean registrationCompleted;

    public int getCurrentStepIndex() {
        return currentStep.index();
    }

    /**
     * Копия ответов формы: снаружи менять нельзя.
     */
    public FieldValueMap getFormData() {
        return formData.copy();
    }

    public Set<FlowStep> getCompletedSteps() {
        return Collections.unmodifiableSet(EnumSet.copyOf(completedSteps));
    }

    /**
     * Индексы завершённых шагов (0-based), по возрастанию.
     */
    public Set<Integer> getCompletedStepIndexes() {
        Set<Integer> indexes = new TreeSet<>();
        completedSteps.forEach(step -> indexes.add(step.index()));
        return Collections.unmodifiableSet(indexes);
    }

    public boolean isCompleted(FlowStep step) {
        return completedSteps.contains(step);
    }

    FieldValueMap formDataRef() {
        return formData;
    }

    Set<FlowStep> completedStepsRef() {
        return completedSteps;
    }
}
