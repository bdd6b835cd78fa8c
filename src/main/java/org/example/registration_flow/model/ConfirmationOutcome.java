package org.example.registration_flow.model;

/**
 * Как показываем итог регистрации на последнем шаге.
 * <p>
 * "Провала" здесь нет намеренно: если статус непонятен, пользователь видит
 * PROCESSING, а не ошибку (оплата могла пройти).
 */
public enum ConfirmationOutcome {

    /** completed / confirmed, либо всё оплачено */
    SUCCESSFUL,

    /** Всё остальное: ждём подтверждения */
    PROCESSING
}
