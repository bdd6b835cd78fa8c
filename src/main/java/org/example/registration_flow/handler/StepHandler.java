package org.example.registration_flow.handler;

import org.example.registration_flow.flow.FlowStep;

import java.util.concurrent.CompletableFuture;

/**
 * Один шаг регистрации. Активен (смонтирован) всегда ровно один шаг.
 */
public interface StepHandler {

    FlowStep step();

    /**
     * Шаг стал текущим.
     *
     * @param movingForward true - пришли с предыдущего шага, false - вернулись назад или повтор
     * @return завершается, когда отработает первичная загрузка шага
     */
    CompletableFuture<Void> onEnter(boolean movingForward);

    /**
     * Шаг перестал быть текущим: ответы его незавершённых запросов больше не применяются.
     */
    void onLeave();

    /**
     * Повторить загрузку шага по запросу пользователя (кнопка "Повторить").
     */
    default CompletableFuture<Void> reload() {
        return onEnter(false);
    }
}
