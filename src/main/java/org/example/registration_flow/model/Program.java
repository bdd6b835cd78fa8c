package org.example.registration_flow.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Программа (сезон / лига / лагерь), на которую идёт регистрация.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class Program {

    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("description")
    private String description;

    @JsonProperty("season")
    private String season;

    @JsonProperty("start_date")
    private String startDate;

    @JsonProperty("end_date")
    private String endDate;

    @JsonProperty("registration_open_date")
    private String registrationOpenDate;

    @JsonProperty("registration_close_date")
    private String registrationCloseDate;

    @JsonProperty("max_capacity")
    private Integer maxCapacity;

    @JsonProperty("base_fee")
    private BigDecimal baseFee;

    @JsonProperty("is_active")
    private boolean active;

    /**
     * Открыта ли регистрация на указанную дату (границы включительно).
     */
    public boolean isRegistrationOpen(LocalDate today) {
        if (!active) {
            return false;
        }
        LocalDate opens = parseDay(registrationOpenDate);
        if (opens != null && today.isBefore(opens)) {
            return false;
        }
        LocalDate closes = parseDay(registrationCloseDate);
        return closes == null || !today.isAfter(closes);
    }

    /**
     * Сервер присылает даты то как "2025-03-01", то как полный timestamp -
     * берём только дату. Неразборчивое значение = границы нет.
     */
    private static LocalDate parseDay(String value) {
        if (value == null || value.length() < 10) {
            return null;
        }
        try {
            return LocalDate.parse(value.substring(0, 10));
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
