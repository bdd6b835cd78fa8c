package org.example.registration_flow.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Ошибки валидации: field_name -> сообщение.
 * <p>
 * Нет ключа = нет ошибки. Ключ {@link #GENERAL} зарезервирован под ошибку
 * отправки формы (сеть / сервер), а не под ошибки полей.
 */
public class ValidationErrors {

    public static final String GENERAL = "_general";

    private final Map<String, String> errors = new LinkedHashMap<>();

    public static ValidationErrors none() {
        return new ValidationErrors();
    }

    public void put(String fieldName, String message) {
        errors.put(fieldName, message);
    }

    /**
     * Обновить одну запись: сообщение есть - ставим, нет - убираем ключ.
     */
    public void set(String fieldName, Optional<String> message) {
        if (message.isPresent()) {
            errors.put(fieldName, message.get());
        } else {
            errors.remove(fieldName);
        }
    }

    public void remove(String fieldName) {
        errors.remove(fieldName);
    }

    public Optional<String> get(String fieldName) {
        return Optional.ofNullable(errors.get(fieldName));
    }

    public Optional<String> general() {
        return get(GENERAL);
    }

    public boolean isEmpty() {
        return errors.isEmpty();
    }

    public boolean hasFieldErrors() {
        return errors.keySet().stream().anyMatch(key -> !GENERAL.equals(key));
    }

    public int size() {
        return errors.size();
    }

    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(errors);
    }

    public ValidationErrors copy() {
        ValidationErrors copy = new ValidationErrors();
        copy.errors.putAll(errors);
        return copy;
    }

    @Override
    public String toString() {
        return "ValidationErrors" + errors;
    }
}
