package org.example.registration_flow.handler.view;

import java.util.List;

/**
 * Снимок шага кастомной формы для UI.
 *
 * @param stage        где сейчас шаг
 * @param formName     название формы (null, если формы нет)
 * @param fields       поля в порядке sort_order
 * @param generalError ошибка отправки формы (сеть / сервер)
 * @param loadError    ошибка загрузки схемы
 */
public record CustomFormView(
        Stage stage,
        String formName,
        String formDescription,
        List<FormFieldView> fields,
        String generalError,
        String loadError
) {

    public enum Stage {
        LOADING,
        READY,
        SUBMITTING,
        /** У программы нет кастомной формы - можно идти дальше */
        NO_FORM_REQUIRED,
        ERROR
    }

    /**
     * Можно ли нажать "Продолжить" прямо сейчас.
     */
    public boolean isCompletable() {
        return stage == Stage.NO_FORM_REQUIRED
                || (stage == Stage.READY && fields.stream().noneMatch(FormFieldView::hasError));
    }
}
