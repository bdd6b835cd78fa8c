package org.example.registration_flow.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Сохранённый на сервере ответ формы (нормализованный вид).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FormDataEntry(
        @JsonProperty("field_name") String fieldName,
        @JsonProperty("field_label") String fieldLabel,
        @JsonProperty("field_value") String fieldValue
) {}
