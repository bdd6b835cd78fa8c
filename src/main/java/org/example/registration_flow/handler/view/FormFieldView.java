package org.example.registration_flow.handler.view;

import org.example.registration_flow.model.FieldOption;
import org.example.registration_flow.model.FieldType;
import org.example.registration_flow.model.FieldValue;

import java.util.List;

/**
 * Одно поле формы, как его надо нарисовать: описание + текущее значение + ошибка.
 */
public record FormFieldView(
        String fieldName,
        FieldType type,
        String label,
        String placeholder,
        String helpText,
        boolean required,
        List<FieldOption> options,
        FieldValue value,
        String error
) {

    public boolean hasError() {
        return error != null;
    }
}
