package org.example.registration_flow.flow;

/**
 * То, что шаг получает от оркестратора: чтение состояния и три разрешённые мутации.
 * <p>
 * Шаг никогда не создаёт свой FlowState и не держит приватную копию.
 */
public interface FlowStateHandle {

    FlowState state();

    /**
     * Слить данные шага, отметить текущий шаг завершённым и перейти на следующий.
     */
    void advance(FlowStatePatch stepData);

    /**
     * То же, что {@link #advance(FlowStatePatch)}, но только если текущий шаг
     * всё ещё {@code expected}. Нужен для ответов сети: повторный ответ не должен
     * сдвинуть шаг второй раз.
     *
     * @return true, если переход выполнен
     */
    boolean advanceFrom(FlowStep expected, FlowStatePatch stepData);

    void retreat();

    /**
     * Точечная правка без смены шага и без отметки о завершении.
     */
    void patch(FlowStatePatch partial);

    /**
     * Выполнить действие так, чтобы смена шага не вклинилась посередине.
     * Шаги применяют через это ответы сети: проверка "запрос ещё актуален"
     * и применение ответа идут одним куском.
     */
    default void runExclusively(Runnable action) {
        action.run();
    }
}
