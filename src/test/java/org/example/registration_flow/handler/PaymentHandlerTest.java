package org.example.registration_flow.handler;

import org.example.registration_flow.Fixtures;
import org.example.registration_flow.flow.FlowStatePatch;
import org.example.registration_flow.flow.FlowStep;
import org.example.registration_flow.handler.view.PaymentView;
import org.example.registration_flow.model.PaymentIntent;
import org.example.registration_flow.model.RegistrationRecord;
import org.example.registration_flow.service.ApiResult;
import org.example.registration_flow.service.RegistrationApiClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.example.registration_flow.Fixtures.REGISTRATION_ID;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("PaymentHandler")
class PaymentHandlerTest {

    private static final PaymentIntent INTENT =
            new PaymentIntent("pi_1", "secret_1", new BigDecimal("150.00"), "usd", "requires_payment_method");

    @Mock
    private RegistrationApiClient api;

    private StoreBackedFlow flow;
    private PaymentHandler handler;

    @BeforeEach
    void setUp() {
        flow = new StoreBackedFlow().at(FlowStep.PAYMENT, FlowStatePatch.builder()
                .registrationId(REGISTRATION_ID)
                .build());
        handler = new PaymentHandler(flow, Runnable::run, api);
    }

    private void enterWithBalance(String balanceDue, String amountPaid) {
        when(api.fetchStatus(REGISTRATION_ID)).thenReturn(ApiResult.success(RegistrationRecord.builder()
                .id(REGISTRATION_ID)
                .status("pending_payment")
                .financialSummary(Fixtures.summary(balanceDue, amountPaid))
                .build()));
        handler.onEnter(true).join();
    }

    @Test
    @DisplayName("Нулевой остаток - оплата не нужна, намерение не запрашивается")
    void zeroBalanceNeedsNoPayment() {
        enterWithBalance("0", "150.00");

        assertThat(handler.getStage()).isEqualTo(PaymentView.Stage.NO_PAYMENT_REQUIRED);
        assertThat(flow.state().getPaymentIntent().isNoPaymentRequired()).isTrue();

        handler.proceedWithoutPayment();

        assertThat(flow.state().getCurrentStep()).isEqualTo(FlowStep.CONFIRMATION);
        assertThat(flow.state().isPaymentCompleted()).isTrue();
        verify(api, never()).createPaymentIntent(anyString());
    }

    @Test
    @DisplayName("Оплата: намерение в FlowState, подтверждение шлюза завершает шаг")
    void paysThroughGateway() {
        enterWithBalance("150.00", "0");
        when(api.createPaymentIntent(REGISTRATION_ID)).thenReturn(ApiResult.success(INTENT));

        assertThat(handler.view().amountDue()).isEqualByComparingTo("150");
        handler.startPayment().join();

        assertThat(handler.getStage()).isEqualTo(PaymentView.Stage.AWAITING_GATEWAY);
        assertThat(flow.state().getPaymentIntent()).isEqualTo(INTENT);
        assertThat(flow.state().getFeeCalculation().getBalanceDue()).isEqualByComparingTo("150");

        handler.paymentSucceeded(INTENT);

        assertThat(flow.state().getCurrentStep()).isEqualTo(FlowStep.CONFIRMATION);
        assertThat(flow.state().isRegistrationCompleted()).isTrue();
        assertThat(flow.advances).hasSize(1);
    }

    @Test
    @DisplayName("Отказ шлюза - ошибка и повтор")
    void gatewayFailureAllowsRetry() {
        enterWithBalance("150.00", "0");
        when(api.createPaymentIntent(REGISTRATION_ID)).thenReturn(ApiResult.success(INTENT));
        handler.startPayment().join();

        handler.paymentFailed("Your card was declined.");

        assertThat(handler.view().error()).isEqualTo("Your card was declined.");
        assertThat(flow.state().getCurrentStep()).isEqualTo(FlowStep.PAYMENT);

        handler.startPayment().join();

        verify(api, times(2)).createPaymentIntent(REGISTRATION_ID);
        assertThat(handler.getStage()).isEqualTo(PaymentView.Stage.AWAITING_GATEWAY);
    }

    @Test
    @DisplayName("Нельзя пропустить оплату при ненулевом остатке")
    void cannotSkipPayment() {
        enterWithBalance("20.00", "130.00");

        assertThatThrownBy(() -> handler.proceedWithoutPayment()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Статус не загрузился - ошибка, оплату не начинаем")
    void statusFailure() {
        when(api.fetchStatus(REGISTRATION_ID)).thenReturn(ApiResult.failure("HTTP 500: Internal Server Error", 500));

        handler.onEnter(true).join();
        handler.startPayment().join();

        assertThat(handler.view().error()).isEqualTo("HTTP 500: Internal Server Error");
        verify(api, never()).createPaymentIntent(anyString());
    }
}
