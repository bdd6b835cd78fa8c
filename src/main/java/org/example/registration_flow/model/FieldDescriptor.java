package org.example.registration_flow.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.List;

/**
 * Описание одного поля динамической формы регистрации.
 * <p>
 * Схема принадлежит бэкенду: клиент её только читает, поэтому сеттеров нет.
 * Имена свойств JSON - как в API (snake_case).
 */
@Getter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class FieldDescriptor {

    @JsonProperty("id")
    private String id;

    /**
     * Ключ в карте значений формы. Уникален в пределах схемы.
     */
    @JsonProperty("field_name")
    private String fieldName;

    @JsonProperty("field_type")
    @Builder.Default
    private FieldType fieldType = FieldType.TEXT;

    @JsonProperty("label")
    private String label;

    @JsonProperty("placeholder")
    private String placeholder;

    @JsonProperty("help_text")
    private String helpText;

    @JsonProperty("default_value")
    private String defaultValue;

    @JsonProperty("is_required")
    private boolean required;

    /**
     * Регулярка с бэкенда. Это недоверенные данные: может и не скомпилироваться.
     */
    @JsonProperty("validation_regex")
    private String validationRegex;

    /**
     * Если задано - заменяет любое стандартное сообщение об ошибке этого поля.
     */
    @JsonProperty("error_message")
    private String errorMessage;

    @JsonProperty("options")
    @Builder.Default
    private List<FieldOption> options = List.of();

    @JsonProperty("sort_order")
    private int sortOrder;

    /**
     * Подпись для сообщений об ошибках. Если label пустой - берём имя поля.
     */
    public String displayLabel() {
        return label == null || label.isBlank() ? fieldName : label;
    }

    public List<FieldOption> getOptions() {
        return options == null ? List.of() : options;
    }

    public boolean hasOption(String value) {
        return getOptions().stream().anyMatch(option -> option.value() != null && option.value().equals(value));
    }
}
