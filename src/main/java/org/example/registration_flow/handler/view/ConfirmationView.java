package org.example.registration_flow.handler.view;

import org.example.registration_flow.model.ConfirmationOutcome;
import org.example.registration_flow.model.RegistrationRecord;

/**
 * Итоговый экран.
 * <p>
 * Если статус загрузить не удалось (UNAVAILABLE), outcome = null:
 * показываем "статус неизвестен", повтор и контакт поддержки, но не "ошибку".
 */
public record ConfirmationView(
        Stage stage,
        ConfirmationOutcome outcome,
        RegistrationRecord registration,
        String playerName,
        String email,
        String phone,
        String supportContact,
        String error
) {

    public enum Stage {
        LOADING,
        LOADED,
        UNAVAILABLE
    }

    public boolean isSuccessful() {
        return outcome == ConfirmationOutcome.SUCCESSFUL;
    }
}
