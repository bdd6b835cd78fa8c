package org.example.registration_flow.handler;

import lombok.extern.slf4j.Slf4j;
import org.example.registration_flow.flow.FlowStateHandle;
import org.example.registration_flow.flow.FlowStatePatch;
import org.example.registration_flow.flow.FlowStep;
import org.example.registration_flow.handler.view.CurrencyFormatter;
import org.example.registration_flow.handler.view.FeeSummaryView;
import org.example.registration_flow.handler.view.FeeSummaryView.Stage;
import org.example.registration_flow.model.FinancialSummary;
import org.example.registration_flow.model.RegistrationRecord;
import org.example.registration_flow.service.ApiResult;
import org.example.registration_flow.service.RegistrationApiClient;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Шаг "Сводка сборов".
 * <p>
 * Суммы считает сервер, здесь только показываем. Свежая сводка грузится при каждом
 * входе на шаг; пока она не пришла (или не пришла вовсе) показываем последнюю
 * сохранённую в FlowState.
 */
@Slf4j
public class FeeSummaryPresenter extends AbstractStepHandler {

    static final String RESOURCE_SUMMARY = "fee-summary";
    static final String RESOURCE_FINALIZE = "finalize";
    static final String NO_SUMMARY = "Fee summary is not available";

    private final RegistrationApiClient api;
    private final CurrencyFormatter formatter;

    private volatile Stage stage = Stage.LOADING;
    private volatile FinancialSummary freshSummary;
    private volatile String error;
    private volatile boolean finalizing;

    public FeeSummaryPresenter(FlowStateHandle flow, Executor executor,
                               RegistrationApiClient api, CurrencyFormatter formatter) {
        super(flow, executor);
        this.api = api;
        this.formatter = formatter;
    }

    @Override
    public FlowStep step() {
        return FlowStep.FEE_SUMMARY;
    }

    @Override
    public CompletableFuture<Void> onEnter(boolean movingForward) {
        finalizing = false;
        return load();
    }

    @Override
    public CompletableFuture<Void> reload() {
        return load();
    }

    /**
     * Загрузить актуальную сводку: GET /registration-flow/{id}/status.
     */
    public CompletableFuture<Void> load() {
        String registrationId = flow.state().getRegistrationId();
        freshSummary = null;
        error = null;
        if (registrationId == null) {
            stage = Stage.ERROR;
            error = NO_REGISTRATION_ID;
            return CompletableFuture.completedFuture(null);
        }
        stage = Stage.LOADING;
        return request(RESOURCE_SUMMARY, () -> api.fetchStatus(registrationId), this::applyStatus);
    }

    private void applyStatus(ApiResult<RegistrationRecord> result) {
        if (!result.isSuccess()) {
            log.warn("Сводка не загрузилась: {}. Показываем сохранённую", result.error());
            stage = Stage.ERROR;
            error = result.error();
            return;
        }
        FinancialSummary summary = result.value() == null ? null : result.value().getFinancialSummary();
        if (summary == null) {
            stage = Stage.ERROR;
            error = NO_SUMMARY;
            return;
        }
        if (!summary.isConsistent()) {
            log.warn("Итоги сводки не сходятся между собой, показываем как есть: {}", summary);
        }
        freshSummary = summary;
        stage = Stage.READY;
        flow.patch(FlowStatePatch.builder().feeCalculation(summary).build());
    }

    /**
     * Кнопка "Подтвердить": POST /registration-flow/{id}/finalize.
     * Пока финализация идёт, повторные нажатия игнорируются.
     */
    public CompletableFuture<Void> finalizeRegistration() {
        if (finalizing) {
            log.debug("Финализация уже идёт - нажатие пропущено");
            return CompletableFuture.completedFuture(null);
        }
        String registrationId = flow.state().getRegistrationId();
        if (registrationId == null) {
            error = NO_REGISTRATION_ID;
            return CompletableFuture.completedFuture(null);
        }
        finalizing = true;
        error = null;
        return request(RESOURCE_FINALIZE, () -> api.finalizeRegistration(registrationId), result -> {
            finalizing = false;
            if (result.isSuccess()) {
                log.info("Регистрация {} финализирована", registrationId);
                flow.advanceFrom(FlowStep.FEE_SUMMARY, FlowStatePatch.builder()
                        .feesConfirmed(true)
                        .finalizationResult(result.value())
                        .registrationFinalized(true)
                        .build());
            } else {
                log.warn("Финализация регистрации {} не удалась: {}", registrationId, result.error());
                error = result.error();
            }
        });
    }

    public FeeSummaryView view() {
        FinancialSummary fresh = freshSummary;
        FinancialSummary shown = fresh != null ? fresh : flow.state().getFeeCalculation();
        return new FeeSummaryView(
                stage,
                shown,
                fresh == null && shown != null,
                flow.state().getSelectedProgram(),
                error,
                finalizing,
                formatter);
    }

    public Stage getStage() {
        return stage;
    }

    public boolean isFinalizing() {
        return finalizing;
    }
}
