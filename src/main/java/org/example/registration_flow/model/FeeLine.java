package org.example.registration_flow.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Строка доп. сбора или скидки в финансовой сводке.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FeeLine(
        @JsonProperty("name") String name,
        @JsonProperty("amount") BigDecimal amount,
        @JsonProperty("description") String description
) {}
