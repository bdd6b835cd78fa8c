package org.example.registration_flow;

import org.example.registration_flow.config.RegistrationApiConfig;
import org.example.registration_flow.model.FieldDescriptor;
import org.example.registration_flow.model.FieldOption;
import org.example.registration_flow.model.FieldType;
import org.example.registration_flow.model.FinancialSummary;
import org.example.registration_flow.model.Program;
import org.example.registration_flow.model.RegistrationFormSchema;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Общие тестовые данные.
 */
public final class Fixtures {

    public static final String BASE_URL = "http://api.test/api";
    public static final String REGISTRATION_ID = "reg-1";
    public static final String PROGRAM_ID = "prog-1";

    /** "Сегодня" во всех тестах: 15 июня 2025 */
    public static final Clock CLOCK = Clock.fixed(Instant.parse("2025-06-15T10:00:00Z"), ZoneOffset.UTC);

    private Fixtures() {
    }

    public static RegistrationApiConfig apiConfig() {
        RegistrationApiConfig config = new RegistrationApiConfig();
        ReflectionTestUtils.setField(config, "baseUrl", BASE_URL);
        ReflectionTestUtils.setField(config, "connectTimeoutMs", 1000);
        ReflectionTestUtils.setField(config, "readTimeoutMs", 1000);
        ReflectionTestUtils.setField(config, "executorThreads", 1);
        ReflectionTestUtils.setField(config, "autoSkipEmptyForm", true);
        ReflectionTestUtils.setField(config, "supportContact", "help@club.test");
        ReflectionTestUtils.setField(config, "currency", "USD");
        ReflectionTestUtils.setField(config, "locale", "en-US");
        return config;
    }

    public static Program program(String id, String name) {
        return Program.builder()
                .id(id)
                .name(name)
                .season("Fall 2025")
                .registrationOpenDate("2025-06-01")
                .registrationCloseDate("2025-08-31")
                .baseFee(new BigDecimal("150.00"))
                .active(true)
                .build();
    }

    public static FieldDescriptor field(String name, FieldType type, String label, boolean required, int sortOrder) {
        return FieldDescriptor.builder()
                .id("f-" + name)
                .fieldName(name)
                .fieldType(type)
                .label(label)
                .required(required)
                .sortOrder(sortOrder)
                .build();
    }

    /**
     * Форма игрока: имя, фамилия, email, размер футболки, согласие.
     */
    public static RegistrationFormSchema playerForm() {
        FieldDescriptor shirt = FieldDescriptor.builder()
                .id("f-shirt_size")
                .fieldName("shirt_size")
                .fieldType(FieldType.SELECT)
                .label("Shirt Size")
                .options(List.of(new FieldOption("S", "Small"), new FieldOption("M", "Medium")))
                .sortOrder(4)
                .build();
        return RegistrationFormSchema.builder()
                .id("form-1")
                .name("Player Information")
                .fields(List.of(
                        field("email", FieldType.EMAIL, "Email", true, 3),
                        field("first_name", FieldType.TEXT, "First Name", true, 1),
                        field("last_name", FieldType.TEXT, "Last Name", true, 2),
                        shirt,
                        field("waiver", FieldType.CHECKBOX, "Waiver", true, 5)))
                .build();
    }

    public static FinancialSummary summary(String balanceDue, String amountPaid) {
        return FinancialSummary.builder()
                .baseFee(new BigDecimal("150.00"))
                .totalBeforeTax(new BigDecimal("150.00"))
                .taxAmount(BigDecimal.ZERO)
                .totalAmountDue(new BigDecimal("150.00"))
                .amountPaid(new BigDecimal(amountPaid))
                .balanceDue(new BigDecimal(balanceDue))
                .build();
    }
}
