package org.example.registration_flow.handler.view;

import org.example.registration_flow.model.FinancialSummary;
import org.example.registration_flow.model.Program;

import java.math.BigDecimal;

/**
 * Сводка сборов для показа.
 *
 * @param summary    свежая сводка или последняя известная (см. {@code fromCache})
 * @param fromCache  true, если свежую получить не удалось / она ещё грузится
 * @param error      ошибка загрузки или финализации
 * @param finalizing идёт финализация - кнопку надо заблокировать
 */
public record FeeSummaryView(
        Stage stage,
        FinancialSummary summary,
        boolean fromCache,
        Program program,
        String error,
        boolean finalizing,
        CurrencyFormatter formatter
) {

    public enum Stage {
        LOADING,
        READY,
        ERROR
    }

    public boolean hasSummary() {
        return summary != null;
    }

    public String format(BigDecimal amount) {
        return formatter.format(amount);
    }
}
