package org.example.registration_flow.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Схема кастомной формы регистрации программы.
 * <p>
 * Загружается один раз при выборе программы и дальше не меняется.
 */
@Getter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class RegistrationFormSchema {

    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("description")
    private String description;

    @JsonProperty("fields")
    @Builder.Default
    private List<FieldDescriptor> fields = List.of();

    /**
     * Поля по возрастанию sort_order. Сортировка стабильная: при равном
     * sort_order сохраняется порядок объявления.
     */
    public List<FieldDescriptor> orderedFields() {
        List<FieldDescriptor> ordered = new ArrayList<>(fields == null ? List.of() : fields);
        ordered.sort(Comparator.comparingInt(FieldDescriptor::getSortOrder));
        return ordered;
    }

    public Optional<FieldDescriptor> findField(String fieldName) {
        return orderedFields().stream()
                .filter(field -> Objects.equals(field.getFieldName(), fieldName))
                .findFirst();
    }

    /**
     * Проверить целостность схемы.
     *
     * @return описание первой найденной проблемы или empty, если схема корректна
     */
    public Optional<String> findSchemaError() {
        Set<String> seen = new HashSet<>();
        for (FieldDescriptor field : orderedFields()) {
            String fieldName = field.getFieldName();
            if (fieldName == null || fieldName.isBlank()) {
                return Optional.of("Registration form contains a field without a name");
            }
            if (!seen.add(fieldName)) {
                return Optional.of("Registration form contains duplicate field '" + fieldName + "'");
            }
            if (field.getFieldType() != null && field.getFieldType().isChoice() && field.getOptions().isEmpty()) {
                return Optional.of("Field '" + fieldName + "' must define at least one option");
            }
        }
        return Optional.empty();
    }
}
