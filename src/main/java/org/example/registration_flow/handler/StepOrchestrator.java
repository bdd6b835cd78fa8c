package org.example.registration_flow.handler;

import lombok.extern.slf4j.Slf4j;
import org.example.registration_flow.config.RegistrationApiConfig;
import org.example.registration_flow.flow.FlowState;
import org.example.registration_flow.flow.FlowStateHandle;
import org.example.registration_flow.flow.FlowStatePatch;
import org.example.registration_flow.flow.FlowStateStore;
import org.example.registration_flow.flow.FlowStep;
import org.example.registration_flow.handler.view.CurrencyFormatter;
import org.example.registration_flow.service.RegistrationApiClient;
import org.example.registration_flow.service.ValidationEngine;

import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Оркестратор регистрации одного пользователя.
 * <p>
 * Держит FlowState и ровно один активный шаг. После каждого перехода
 * (advance / retreat) снимает старый шаг (его запросы гасятся) и монтирует новый.
 * Шаги меняют состояние только через этот объект ({@link FlowStateHandle}).
 * <p>
 * Переходы synchronized: ответы сети приходят из пула потоков.
 */
@Slf4j
public class StepOrchestrator implements FlowStateHandle {

    private final String sessionId;
    private final FlowStateStore store = new FlowStateStore();
    private final Map<FlowStep, StepHandler> handlers = new EnumMap<>(FlowStep.class);

    private final ProgramSelectionHandler programSelection;
    private final CustomFormHandler customForm;
    private final FeeSummaryPresenter feeSummary;
    private final PaymentHandler payment;
    private final ConfirmationPresenter confirmation;

    private StepHandler mounted;
    private CompletableFuture<Void> currentLoad = CompletableFuture.completedFuture(null);

    public StepOrchestrator(String sessionId,
                            RegistrationApiClient api,
                            ValidationEngine validation,
                            RegistrationApiConfig config,
                            Clock clock,
                            Executor executor) {
        this.sessionId = sessionId;
        this.programSelection = new ProgramSelectionHandler(this, executor, api, clock);
        this.customForm = new CustomFormHandler(this, executor, api, validation, config.isAutoSkipEmptyForm());
        this.feeSummary = new FeeSummaryPresenter(this, executor, api,
                new CurrencyFormatter(config.getLocale(), config.getCurrency()));
        this.payment = new PaymentHandler(this, executor, api);
        this.confirmation = new ConfirmationPresenter(this, executor, api, config.getSupportContact());

        register(programSelection);
        register(customForm);
        register(feeSummary);
        register(payment);
        register(confirmation);
    }

    private void register(StepHandler handler) {
        handlers.put(handler.step(), handler);
    }

    /**
     * Смонтировать текущий шаг (обычно PROGRAM_SELECT).
     */
    public synchronized CompletableFuture<Void> start() {
        log.info("Сессия {}: старт регистрации", sessionId);
        mount(store.state().getCurrentStep(), true);
        return currentLoad;
    }

    @Override
    public FlowState state() {
        return store.state();
    }

    @Override
    public synchronized void advance(FlowStatePatch stepData) {
        FlowStep from = store.state().getCurrentStep();
        store.advance(stepData);
        remountIfMoved(from, true);
    }

    @Override
    public synchronized boolean advanceFrom(FlowStep expected, FlowStatePatch stepData) {
        FlowStep from = store.state().getCurrentStep();
        boolean moved = store.advanceFrom(expected, stepData);
        if (moved) {
            remountIfMoved(from, true);
        }
        return moved;
    }

    @Override
    public synchronized void retreat() {
        FlowStep from = store.state().getCurrentStep();
        store.retreat();
        remountIfMoved(from, false);
    }

    @Override
    public void patch(FlowStatePatch partial) {
        store.patch(partial);
    }

    /**
     * Под тем же монитором, что и переходы: ответ снятого шага не применится
     * после его onLeave().
     */
    @Override
    public synchronized void runExclusively(Runnable action) {
        action.run();
    }

    /**
     * Кнопка "Повторить" на текущем шаге.
     */
    public synchronized CompletableFuture<Void> reload() {
        if (mounted == null) {
            throw new IllegalStateException("Registration flow is not started");
        }
        currentLoad = mounted.reload();
        return currentLoad;
    }

    /**
     * Пользователь ушёл: гасим запросы активного шага.
     */
    public synchronized void close() {
        if (mounted != null) {
            mounted.onLeave();
            mounted = null;
        }
        log.info("Сессия {}: закрыта на шаге {}", sessionId, store.state().getCurrentStep());
    }

    private void remountIfMoved(FlowStep from, boolean movingForward) {
        FlowStep to = store.state().getCurrentStep();
        if (to != from) {
            mount(to, movingForward);
        }
    }

    private void mount(FlowStep step, boolean movingForward) {
        StepHandler next = handlers.get(step);
        if (mounted != null) {
            mounted.onLeave();
        }
        mounted = next;
        log.debug("Сессия {}: шаг {} смонтирован ({})", sessionId, step, movingForward ? "вперёд" : "назад");
        CompletableFuture<Void> load = next.onEnter(movingForward);
        // onEnter мог сам перевести дальше (форма без полей) - тогда load уже не наш
        if (mounted == next) {
            currentLoad = load;
        }
    }

    public synchronized FlowStep currentStep() {
        return store.state().getCurrentStep();
    }

    public synchronized StepHandler mountedStep() {
        return mounted;
    }

    /**
     * Завершается, когда отработает первичная загрузка активного шага.
     */
    public synchronized CompletableFuture<Void> currentLoad() {
        return currentLoad;
    }

    public String getSessionId() {
        return sessionId;
    }

    public ProgramSelectionHandler programSelection() {
        return requireMounted(programSelection);
    }

    public CustomFormHandler customForm() {
        return requireMounted(customForm);
    }

    public FeeSummaryPresenter feeSummary() {
        return requireMounted(feeSummary);
    }

    public PaymentHandler payment() {
        return requireMounted(payment);
    }

    public ConfirmationPresenter confirmation() {
        return requireMounted(confirmation);
    }

    private synchronized <T extends StepHandler> T requireMounted(T handler) {
        if (mounted != handler) {
            throw new IllegalStateException("Step " + handler.step() + " is not active, current step is "
                    + store.state().getCurrentStep());
        }
        return handler;
    }
}
