package org.example.registration_flow.flow;

/**
 * Шаги регистрации. Порядок фиксированный, переходы только на соседний шаг.
 * <p>
 * PROGRAM_SELECT → CUSTOM_FORM → FEE_SUMMARY → PAYMENT → CONFIRMATION
 */
public enum FlowStep {

    /** Выбор программы, создание черновика регистрации */
    PROGRAM_SELECT("Select Program"),

    /** Кастомная форма программы (может отсутствовать) */
    CUSTOM_FORM("Registration Form"),

    /** Сводка сборов и финализация */
    FEE_SUMMARY("Fee Summary"),

    /** Оплата через внешний шлюз */
    PAYMENT("Payment"),

    /** Итог регистрации */
    CONFIRMATION("Confirmation");

    private final String title;

    FlowStep(String title) {
        this.title = title;
    }

    public String getTitle() {
        return title;
    }

    public int index() {
        return ordinal();
    }

    public static FlowStep at(int index) {
        FlowStep[] steps = values();
        if (index < 0 || index >= steps.length) {
            throw new IllegalArgumentException("Нет шага с индексом " + index);
        }
        return steps[index];
    }

    public boolean isLast() {
        return this == CONFIRMATION;
    }

    public boolean isFirst() {
        return this == PROGRAM_SELECT;
    }
}
