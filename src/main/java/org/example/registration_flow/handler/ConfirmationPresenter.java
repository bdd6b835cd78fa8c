package org.example.registration_flow.handler;

import lombok.extern.slf4j.Slf4j;
import org.example.registration_flow.flow.FlowStateHandle;
import org.example.registration_flow.flow.FlowStep;
import org.example.registration_flow.handler.view.ConfirmationView;
import org.example.registration_flow.handler.view.ConfirmationView.Stage;
import org.example.registration_flow.model.ConfirmationOutcome;
import org.example.registration_flow.model.FieldValueMap;
import org.example.registration_flow.model.RegistrationRecord;
import org.example.registration_flow.service.ApiResult;
import org.example.registration_flow.service.RegistrationApiClient;

import java.math.BigDecimal;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Итоговый шаг: загружаем статус регистрации и решаем, что показать.
 * <p>
 * Успех - только при явном подтверждении (статус или полная оплата).
 * Всё неоднозначное считаем "в обработке", а не ошибкой.
 */
@Slf4j
public class ConfirmationPresenter extends AbstractStepHandler {

    static final String RESOURCE_CONFIRMATION = "confirmation";
    static final String DEFAULT_PLAYER_NAME = "Player";

    private static final Set<String> SUCCESS_STATUSES = Set.of("completed", "confirmed");

    private final RegistrationApiClient api;
    private final String supportContact;

    private volatile Stage stage = Stage.LOADING;
    private volatile RegistrationRecord registration;
    private volatile String error;

    public ConfirmationPresenter(FlowStateHandle flow, Executor executor,
                                 RegistrationApiClient api, String supportContact) {
        super(flow, executor);
        this.api = api;
        this.supportContact = supportContact;
    }

    @Override
    public FlowStep step() {
        return FlowStep.CONFIRMATION;
    }

    @Override
    public CompletableFuture<Void> onEnter(boolean movingForward) {
        return load();
    }

    public CompletableFuture<Void> load() {
        String registrationId = flow.state().getRegistrationId();
        registration = null;
        error = null;
        if (registrationId == null) {
            stage = Stage.UNAVAILABLE;
            error = NO_REGISTRATION_ID;
            return CompletableFuture.completedFuture(null);
        }
        stage = Stage.LOADING;
        return request(RESOURCE_CONFIRMATION, () -> api.fetchStatus(registrationId), this::applyStatus);
    }

    private void applyStatus(ApiResult<RegistrationRecord> result) {
        if (!result.isSuccess() || result.value() == null) {
            log.warn("Статус регистрации неизвестен: {}", result.error());
            stage = Stage.UNAVAILABLE;
            error = result.isSuccess() ? UNEXPECTED_ERROR : result.error();
            return;
        }
        registration = result.value();
        stage = Stage.LOADED;
        log.info("Регистрация {}: статус={}, итог={}",
                registration.getId(), registration.getStatus(), classify(registration));
    }

    /**
     * Успешно, если сервер подтвердил статус, или остаток закрыт и что-то оплачено.
     * Нет данных об оплате = в обработке. Статус сравнивается точно, с учётом регистра.
     */
    static ConfirmationOutcome classify(RegistrationRecord record) {
        if (record.getStatus() != null && SUCCESS_STATUSES.contains(record.getStatus())) {
            return ConfirmationOutcome.SUCCESSFUL;
        }
        BigDecimal balance = record.getBalanceDue();
        BigDecimal paid = record.getAmountPaid();
        if (balance != null && paid != null && balance.signum() <= 0 && paid.signum() > 0) {
            return ConfirmationOutcome.SUCCESSFUL;
        }
        return ConfirmationOutcome.PROCESSING;
    }

    public ConfirmationView view() {
        RegistrationRecord current = registration;
        Stage currentStage = stage;
        FieldValueMap formData = flow.state().getFormData();
        String first = resolve(current, formData, "first_name");
        String last = resolve(current, formData, "last_name");
        String name = ((first == null ? "" : first) + " " + (last == null ? "" : last)).trim();

        return new ConfirmationView(
                currentStage,
                currentStage == Stage.LOADED && current != null ? classify(current) : null,
                current,
                name.isEmpty() ? DEFAULT_PLAYER_NAME : name,
                resolve(current, formData, "email"),
                resolve(current, formData, "phone"),
                supportContact,
                error);
    }

    /**
     * Ответ с сервера важнее локального: его уже сохранили.
     */
    private static String resolve(RegistrationRecord record, FieldValueMap formData, String fieldName) {
        if (record != null) {
            String fromServer = record.formValue(fieldName).orElse(null);
            if (fromServer != null) {
                return fromServer;
            }
        }
        return formData.text(fieldName);
    }

    public Stage getStage() {
        return stage;
    }
}
