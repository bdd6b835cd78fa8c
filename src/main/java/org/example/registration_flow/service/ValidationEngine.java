package org.example.registration_flow.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.registration_flow.model.FieldDescriptor;
import org.example.registration_flow.model.FieldType;
import org.example.registration_flow.model.FieldValue;
import org.example.registration_flow.model.FieldValueMap;
import org.example.registration_flow.model.RegistrationFormSchema;
import org.example.registration_flow.model.ValidationErrors;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.Period;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Валидация полей динамической формы.
 * <p>
 * Правила проверяются строго по порядку, первая ошибка выигрывает:
 * 1. Обязательное и пустое
 * 2. Пустое и необязательное → дальше не проверяем
 * 3. validation_regex с бэкенда
 * 4. Правило типа (email, tel, number, date)
 * <p>
 * Методы чистые: состояние есть только у кеша скомпилированных регулярок.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ValidationEngine {

    static final Pattern EMAIL_PATTERN = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

    /**
     * Единое правило для телефона: необязательный "+", потом от 1 до 16 цифр.
     * Пробелы, дефисы, скобки и точки - просто оформление, их выкидываем до проверки.
     */
    static final Pattern PHONE_PATTERN = Pattern.compile("^\\+?\\d{1,16}$");
    private static final Pattern PHONE_SEPARATORS = Pattern.compile("[\\s\\-().]");

    static final int MAX_AGE_YEARS = 120;

    private final Clock clock;

    /**
     * Кеш регулярок: исходная строка → скомпилированный Pattern (empty = регулярка битая).
     * Живёт от одной загрузки схемы до следующей.
     */
    private final Map<String, Optional<Pattern>> patternCache = new ConcurrentHashMap<>();

    /**
     * Скомпилировать все регулярки схемы заранее (вызывается при загрузке схемы),
     * чтобы битые попали в лог сразу, а не на первом нажатии клавиши.
     * Регулярки прошлых схем выбрасываются; чужие сессии при нужде скомпилируют свои заново.
     */
    public void prepare(RegistrationFormSchema schema) {
        patternCache.clear();
        for (FieldDescriptor descriptor : schema.orderedFields()) {
            if (hasText(descriptor.getValidationRegex())) {
                compiled(descriptor);
            }
        }
    }

    /**
     * Проверить одно поле.
     *
     * @return текст ошибки или empty, если значение подходит
     */
    public Optional<String> validateField(FieldDescriptor descriptor, FieldValue value) {
        String label = descriptor.displayLabel();
        boolean empty = value == null || value.isEmpty();

        if (empty) {
            if (descriptor.isRequired()) {
                return fail(descriptor, label + " is required");
            }
            return Optional.empty();
        }

        String text = value.asText();

        if (hasText(descriptor.getValidationRegex())) {
            Optional<Pattern> pattern = compiled(descriptor);
            if (pattern.isPresent() && !pattern.get().matcher(text).find()) {
                return fail(descriptor, label + " format is invalid");
            }
        }

        return validateType(descriptor, value, text.trim(), label);
    }

    /**
     * Проверить все поля схемы по возрастанию sort_order.
     * Поля без ошибок в результат не попадают.
     */
    public ValidationErrors validateAll(RegistrationFormSchema schema, FieldValueMap values) {
        ValidationErrors errors = new ValidationErrors();
        for (FieldDescriptor descriptor : schema.orderedFields()) {
            FieldValue value = values.get(descriptor.getFieldName()).orElse(null);
            validateField(descriptor, value).ifPresent(message -> errors.put(descriptor.getFieldName(), message));
        }
        return errors;
    }

    private Optional<String> validateType(FieldDescriptor descriptor, FieldValue value, String text, String label) {
        FieldType type = descriptor.getFieldType() == null ? FieldType.TEXT : descriptor.getFieldType();
        switch (type) {
            case EMAIL:
                if (!EMAIL_PATTERN.matcher(text).matches()) {
                    return fail(descriptor, label + " must be a valid email address");
                }
                return Optional.empty();
            case TEL:
                if (!isValidPhone(text)) {
                    return fail(descriptor, label + " must be a valid phone number");
                }
                return Optional.empty();
            case NUMBER:
                if (!(value instanceof FieldValue.Numeric) && !isFiniteNumber(text)) {
                    return fail(descriptor, label + " must be a number");
                }
                return Optional.empty();
            case DATE:
                return validateDate(descriptor, text, label);
            case SELECT:
            case RADIO:
                if (!descriptor.hasOption(text)) {
                    return fail(descriptor, label + " has an invalid selection");
                }
                return Optional.empty();
            default:
                return Optional.empty();
        }
    }

    private Optional<String> validateDate(FieldDescriptor descriptor, String text, String label) {
        LocalDate date;
        try {
            date = LocalDate.parse(text);
        } catch (DateTimeParseException e) {
            return fail(descriptor, label + " must be a valid date");
        }
        if (!isBirthDateField(descriptor)) {
            return Optional.empty();
        }
        LocalDate today = LocalDate.now(clock);
        if (date.isAfter(today)) {
            return fail(descriptor, label + " cannot be in the future");
        }
        if (Period.between(date, today).getYears() > MAX_AGE_YEARS) {
            return fail(descriptor, label + " implies an age over " + MAX_AGE_YEARS + " years");
        }
        return Optional.empty();
    }

    /**
     * Поле "дата рождения": date_of_birth, birth_date, dob и т.п.
     */
    static boolean isBirthDateField(FieldDescriptor descriptor) {
        String name = descriptor.getFieldName() == null ? "" : descriptor.getFieldName().toLowerCase(Locale.ROOT);
        return name.contains("birth") || name.equals("dob");
    }

    static boolean isValidPhone(String text) {
        String digits = PHONE_SEPARATORS.matcher(text).replaceAll("");
        return PHONE_PATTERN.matcher(digits).matches();
    }

    private static boolean isFiniteNumber(String text) {
        try {
            // BigDecimal не понимает NaN / Infinity - то, что нужно
            new BigDecimal(text);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    int cachedPatterns() {
        return patternCache.size();
    }

    private Optional<Pattern> compiled(FieldDescriptor descriptor) {
        String regex = descriptor.getValidationRegex();
        return patternCache.computeIfAbsent(regex, source -> {
            try {
                return Optional.of(Pattern.compile(source));
            } catch (PatternSyntaxException e) {
                log.warn("Битая validation_regex у поля '{}': {} ({}). Проверка по шаблону отключена",
                        descriptor.getFieldName(), source, e.getDescription());
                return Optional.empty();
            }
        });
    }

    /**
     * Кастомное error_message поля заменяет любое стандартное сообщение.
     */
    private static Optional<String> fail(FieldDescriptor descriptor, String defaultMessage) {
        return Optional.of(hasText(descriptor.getErrorMessage()) ? descriptor.getErrorMessage() : defaultMessage);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
