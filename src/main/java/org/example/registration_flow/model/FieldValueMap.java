package org.example.registration_flow.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Текущие значения полей формы: field_name -> значение.
 * <p>
 * Порядок вставки сохраняется (совпадает с порядком полей в схеме).
 */
public class FieldValueMap {

    private final Map<String, FieldValue> values = new LinkedHashMap<>();

    public FieldValueMap() {
    }

    public FieldValueMap(Map<String, FieldValue> source) {
        if (source != null) {
            values.putAll(source);
        }
    }

    public static FieldValueMap empty() {
        return new FieldValueMap();
    }

    /**
     * Значения по умолчанию для всех полей схемы, поверх которых накладываются
     * уже введённые ранее ответы (возврат назад не должен терять данные).
     * Ответы на поля схемы приводятся к варианту по типу поля.
     */
    public static FieldValueMap initialize(RegistrationFormSchema schema, FieldValueMap previous) {
        FieldValueMap map = new FieldValueMap();
        for (FieldDescriptor descriptor : schema.orderedFields()) {
            map.put(descriptor.getFieldName(), FieldValue.initialFor(descriptor));
        }
        if (previous != null) {
            previous.values.forEach((name, value) -> map.values.put(name, schema.findField(name)
                    .map(descriptor -> FieldValue.coerce(descriptor.getFieldType(), value))
                    .orElse(value)));
        }
        return map;
    }

    public Optional<FieldValue> get(String fieldName) {
        return Optional.ofNullable(values.get(fieldName));
    }

    /**
     * Строковое значение поля или null, если поля нет / оно пустое.
     */
    public String text(String fieldName) {
        FieldValue value = values.get(fieldName);
        if (value == null || value.isEmpty()) {
            return null;
        }
        return value.asText();
    }

    public void put(String fieldName, FieldValue value) {
        values.put(fieldName, value);
    }

    public void putAll(FieldValueMap other) {
        if (other != null) {
            values.putAll(other.values);
        }
    }

    public boolean containsKey(String fieldName) {
        return values.containsKey(fieldName);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    public Map<String, FieldValue> asMap() {
        return Collections.unmodifiableMap(values);
    }

    /**
     * Тело для POST submit-form: значения в JSON-совместимом виде.
     */
    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        values.forEach((name, value) -> payload.put(name, value.toJson()));
        return payload;
    }

    public FieldValueMap copy() {
        return new FieldValueMap(values);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FieldValueMap other)) {
            return false;
        }
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "FieldValueMap" + values;
    }
}
