package org.example.registration_flow.handler;

import lombok.extern.slf4j.Slf4j;
import org.example.registration_flow.flow.FlowStateHandle;
import org.example.registration_flow.flow.FlowStatePatch;
import org.example.registration_flow.flow.FlowStep;
import org.example.registration_flow.handler.view.PaymentView;
import org.example.registration_flow.handler.view.PaymentView.Stage;
import org.example.registration_flow.model.FinancialSummary;
import org.example.registration_flow.model.PaymentIntent;
import org.example.registration_flow.model.RegistrationRecord;
import org.example.registration_flow.service.ApiResult;
import org.example.registration_flow.service.RegistrationApiClient;

import java.math.BigDecimal;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Шаг оплаты.
 * <p>
 * Сам шлюз сюда не входит: шаг создаёт намерение оплаты на сервере, а оболочка UI
 * проводит оплату и сообщает результат через {@link #paymentSucceeded} / {@link #paymentFailed}.
 * Если остаток нулевой, платить нечего и шаг можно пройти сразу.
 */
@Slf4j
public class PaymentHandler extends AbstractStepHandler {

    static final String RESOURCE_STATUS = "payment-status";
    static final String RESOURCE_INTENT = "payment-intent";

    private final RegistrationApiClient api;

    private volatile Stage stage = Stage.LOADING;
    private volatile BigDecimal amountDue;
    private volatile PaymentIntent intent;
    private volatile String error;

    public PaymentHandler(FlowStateHandle flow, Executor executor, RegistrationApiClient api) {
        super(flow, executor);
        this.api = api;
    }

    @Override
    public FlowStep step() {
        return FlowStep.PAYMENT;
    }

    /**
     * Остаток к оплате всегда берём свежий: оплата могла пройти в другой вкладке.
     */
    @Override
    public CompletableFuture<Void> onEnter(boolean movingForward) {
        String registrationId = flow.state().getRegistrationId();
        intent = null;
        amountDue = null;
        error = null;
        if (registrationId == null) {
            stage = Stage.ERROR;
            error = NO_REGISTRATION_ID;
            return CompletableFuture.completedFuture(null);
        }
        stage = Stage.LOADING;
        return request(RESOURCE_STATUS, () -> api.fetchStatus(registrationId), this::applyStatus);
    }

    private void applyStatus(ApiResult<RegistrationRecord> result) {
        if (!result.isSuccess()) {
            stage = Stage.ERROR;
            error = result.error();
            return;
        }
        RegistrationRecord record = result.value();
        FinancialSummary summary = record == null ? null : record.getFinancialSummary();
        BigDecimal balance = summary != null && summary.getBalanceDue() != null
                ? summary.getBalanceDue()
                : record == null ? null : record.getBalanceDue();

        FlowStatePatch.FlowStatePatchBuilder patch = FlowStatePatch.builder();
        if (summary != null) {
            patch.feeCalculation(summary);
        }
        amountDue = balance;

        if (balance != null && balance.signum() <= 0) {
            log.info("Остаток по регистрации {} нулевой - оплата не нужна", record.getId());
            intent = PaymentIntent.noPaymentRequired();
            patch.paymentIntent(intent);
            stage = Stage.NO_PAYMENT_REQUIRED;
        } else {
            stage = Stage.READY;
        }
        flow.patch(patch.build());
    }

    /**
     * Кнопка "Оплатить": POST /registration-flow/{id}/payment-intent.
     */
    public CompletableFuture<Void> startPayment() {
        // После отказа шлюза можно повторить, если остаток известен
        boolean retry = stage == Stage.ERROR && amountDue != null && amountDue.signum() > 0;
        if (stage != Stage.READY && !retry) {
            log.debug("startPayment() на стадии {} - пропущено", stage);
            return CompletableFuture.completedFuture(null);
        }
        String registrationId = flow.state().getRegistrationId();
        if (registrationId == null) {
            error = NO_REGISTRATION_ID;
            return CompletableFuture.completedFuture(null);
        }
        error = null;
        stage = Stage.LOADING;
        return request(RESOURCE_INTENT, () -> api.createPaymentIntent(registrationId), result -> {
            if (result.isSuccess() && result.value() != null) {
                intent = result.value();
                stage = Stage.AWAITING_GATEWAY;
                log.info("Намерение оплаты {} создано для регистрации {}", intent.id(), registrationId);
                flow.patch(FlowStatePatch.builder().paymentIntent(intent).build());
            } else {
                stage = Stage.ERROR;
                error = result.isSuccess() ? UNEXPECTED_ERROR : result.error();
            }
        });
    }

    /**
     * Шлюз подтвердил оплату.
     */
    public void paymentSucceeded(PaymentIntent confirmed) {
        PaymentIntent paid = confirmed != null ? confirmed : intent;
        stage = Stage.PAID;
        flow.advanceFrom(FlowStep.PAYMENT, FlowStatePatch.builder()
                .paymentIntent(paid)
                .paymentCompleted(true)
                .registrationCompleted(true)
                .build());
    }

    /**
     * Шлюз отказал. Остаёмся на шаге, можно попробовать ещё раз.
     */
    public void paymentFailed(String message) {
        log.warn("Оплата не прошла: {}", message);
        stage = Stage.ERROR;
        error = message == null || message.isBlank() ? UNEXPECTED_ERROR : message;
    }

    /**
     * Кнопка "Продолжить" при нулевом остатке.
     */
    public void proceedWithoutPayment() {
        if (stage != Stage.NO_PAYMENT_REQUIRED) {
            throw new IllegalStateException("Payment is required: " + stage);
        }
        flow.advanceFrom(FlowStep.PAYMENT, FlowStatePatch.builder()
                .paymentIntent(PaymentIntent.noPaymentRequired())
                .paymentCompleted(true)
                .registrationCompleted(true)
                .build());
    }

    public PaymentView view() {
        return new PaymentView(stage, amountDue, intent, error);
    }

    public Stage getStage() {
        return stage;
    }
}
