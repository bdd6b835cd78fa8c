package org.example.registration_flow.flow;

import lombok.extern.slf4j.Slf4j;

/**
 * Хранилище состояния регистрации.
 * <p>
 * Все мутации идут через три метода и выполняются последовательно
 * (методы synchronized: ответы сети приходят из пула потоков).
 */
@Slf4j
public class FlowStateStore {

    private final FlowState state = new FlowState();

    public FlowState state() {
        return state;
    }

    /**
     * Слить stepData, отметить текущий шаг завершённым и перейти к следующему.
     * На последнем шаге остаёмся на месте.
     */
    public synchronized void advance(FlowStatePatch stepData) {
        FlowStep from = state.getCurrentStep();
        merge(stepData);
        state.completedStepsRef().add(from);
        if (!from.isLast()) {
            state.setCurrentStep(FlowStep.at(from.index() + 1));
        }
        log.info("Шаг завершён: {} → {}, registrationId={}, completed={}",
                from, state.getCurrentStep(), state.getRegistrationId(), state.getCompletedStepIndexes());
    }

    public synchronized boolean advanceFrom(FlowStep expected, FlowStatePatch stepData) {
        if (state.getCurrentStep() != expected) {
            log.warn("Переход с шага {} пропущен: текущий шаг уже {}", expected, state.getCurrentStep());
            return false;
        }
        advance(stepData);
        return true;
    }

    /**
     * Шаг назад. completedSteps и введённые данные НЕ трогаем.
     */
    public synchronized void retreat() {
        FlowStep from = state.getCurrentStep();
        if (from.isFirst()) {
            log.debug("retreat() на первом шаге - остаёмся на {}", from);
            return;
        }
        state.setCurrentStep(FlowStep.at(from.index() - 1));
        log.info("Шаг назад: {} → {}", from, state.getCurrentStep());
    }

    /**
     * Поверхностное слияние без смены шага.
     */
    public synchronized void patch(FlowStatePatch partial) {
        merge(partial);
        log.debug("patch на шаге {}: {}", state.getCurrentStep(), partial);
    }

    private void merge(FlowStatePatch patch) {
        if (patch == null) {
            return;
        }
        if (patch.getRegistrationId() != null) {
            state.setRegistrationId(patch.getRegistrationId());
        }
        if (patch.getSelectedProgram() != null) {
            state.setSelectedProgram(patch.getSelectedProgram());
        }
        if (patch.getFormData() != null) {
            state.formDataRef().putAll(patch.getFormData());
        }
        if (patch.getFeeCalculation() != null) {
            state.setFeeCalculation(patch.getFeeCalculation());
        }
        if (patch.getPaymentIntent() != null) {
            state.setPaymentIntent(patch.getPaymentIntent());
        }
        if (patch.getFormCompleted() != null) {
            state.setFormCompleted(patch.getFormCompleted());
        }
        if (patch.getFeesConfirmed() != null) {
            state.setFeesConfirmed(patch.getFeesConfirmed());
        }
        if (patch.getRegistrationFinalized() != null) {
            state.setRegistrationFinalized(patch.getRegistrationFinalized());
        }
        if (patch.getFinalizationResult() != null) {
            state.setFinalizationResult(patch.getFinalizationResult());
        }
        if (patch.getPaymentCompleted() != null) {
            state.setPaymentCompleted(patch.getPaymentCompleted());
        }
        if (patch.getRegistrationCompleted() != null) {
            state.setRegistrationCompleted(patch.getRegistrationCompleted());
        }
    }
}
