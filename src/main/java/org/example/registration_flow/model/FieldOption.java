package org.example.registration_flow.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Вариант ответа для select / radio.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FieldOption(
        @JsonProperty("value") String value,
        @JsonProperty("label") String label
) {}
