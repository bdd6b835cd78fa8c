package org.example.registration_flow.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Тип поля формы регистрации.
 * <p>
 * Приходит с бэкенда строкой ("text", "email", "tel" ...),
 * по нему выбирается и виджет ввода, и правило валидации.
 */
public enum FieldType {

    TEXT("text"),
    NUMBER("number"),
    DATE("date"),
    EMAIL("email"),
    TEL("tel"),
    SELECT("select"),
    RADIO("radio"),
    CHECKBOX("checkbox"),
    TEXTAREA("textarea");

    private final String wireName;

    FieldType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * Поле с выбором из списка (select / radio) - для него обязательны options.
     */
    public boolean isChoice() {
        return this == SELECT || this == RADIO;
    }

    @JsonCreator
    public static FieldType fromWire(String value) {
        if (value == null) {
            return TEXT;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (FieldType type : values()) {
            if (type.wireName.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Неизвестный тип поля: " + value);
    }
}
