package org.example.registration_flow.model;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Значение поля формы.
 * <p>
 * Три варианта: текст, флажок (checkbox) и число.
 * Какой вариант используется - решает тип поля ({@link FieldType}).
 */
public interface FieldValue {

    /**
     * Пустое ли значение с точки зрения "обязательного" поля.
     * Для флажка "пусто" = не отмечен.
     */
    boolean isEmpty();

    /**
     * Строковое представление - его проверяют регулярки и форматные правила.
     */
    String asText();

    /**
     * Значение в виде, пригодном для JSON (String / Boolean / BigDecimal).
     */
    Object toJson();

    record Text(String value) implements FieldValue {

        public Text {
            value = value == null ? "" : value;
        }

        @Override
        public boolean isEmpty() {
            return value.isBlank();
        }

        @Override
        public String asText() {
            return value;
        }

        @Override
        public Object toJson() {
            return value;
        }
    }

    record Flag(boolean value) implements FieldValue {

        @Override
        public boolean isEmpty() {
            return !value;
        }

        @Override
        public String asText() {
            return Boolean.toString(value);
        }

        @Override
        public Object toJson() {
            return value;
        }
    }

    record Numeric(BigDecimal value) implements FieldValue {

        @Override
        public boolean isEmpty() {
            return value == null;
        }

        @Override
        public String asText() {
            return value == null ? "" : value.stripTrailingZeros().toPlainString();
        }

        @Override
        public Object toJson() {
            return value;
        }
    }

    static FieldValue text(String value) {
        return new Text(value);
    }

    static FieldValue flag(boolean value) {
        return new Flag(value);
    }

    static FieldValue numeric(BigDecimal value) {
        return new Numeric(value);
    }

    /**
     * Начальное значение для поля: default_value по типу поля, без него false для checkbox и "" для остальных.
     */
    static FieldValue initialFor(FieldDescriptor descriptor) {
        return fromInput(descriptor.getFieldType(), descriptor.getDefaultValue());
    }

    /**
     * Привести "сырой" ввод из UI к варианту, который соответствует типу поля.
     * Нечисловой ввод в number-поле остаётся текстом: его отклонит валидация.
     */
    static FieldValue fromInput(FieldType type, String raw) {
        if (type == FieldType.CHECKBOX) {
            return new Flag(raw != null && isTruthy(raw));
        }
        if (type == FieldType.NUMBER && raw != null && !raw.isBlank()) {
            try {
                return new Numeric(new BigDecimal(raw.trim()));
            } catch (NumberFormatException e) {
                return new Text(raw);
            }
        }
        return new Text(raw);
    }

    /**
     * Привести уже имеющееся значение к варианту для типа поля
     * (ответ мог остаться от формы другой программы).
     */
    static FieldValue coerce(FieldType type, FieldValue value) {
        if (value == null) {
            return null;
        }
        if (type == FieldType.CHECKBOX) {
            return value instanceof Flag ? value : fromInput(type, value.asText());
        }
        if (type == FieldType.NUMBER && value instanceof Numeric) {
            return value;
        }
        // снятый флажок в текстовом поле - пустая строка, а не "false"
        String raw = value instanceof Flag && value.isEmpty() ? "" : value.asText();
        return fromInput(type, raw);
    }

    private static boolean isTruthy(String raw) {
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return normalized.equals("true") || normalized.equals("on") || normalized.equals("1") || normalized.equals("yes");
    }
}
