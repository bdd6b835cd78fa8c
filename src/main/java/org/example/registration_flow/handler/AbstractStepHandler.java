package org.example.registration_flow.handler;

import lombok.extern.slf4j.Slf4j;
import org.example.registration_flow.flow.FlowStateHandle;
import org.example.registration_flow.service.ApiResult;
import org.example.registration_flow.service.RequestTracker;
import org.example.registration_flow.service.RequestTracker.RequestTicket;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Общая часть шагов: сетевые вызовы в пуле потоков и правило
 * "побеждает последний запрос".
 */
@Slf4j
public abstract class AbstractStepHandler implements StepHandler {

    static final String NO_REGISTRATION_ID = "No registration ID available";
    static final String UNEXPECTED_ERROR = "An unexpected error occurred";

    protected final FlowStateHandle flow;
    protected final Executor executor;
    protected final RequestTracker requests = new RequestTracker();

    protected AbstractStepHandler(FlowStateHandle flow, Executor executor) {
        this.flow = flow;
        this.executor = executor;
    }

    @Override
    public void onLeave() {
        requests.cancelAll();
        log.debug("Шаг {} ушёл со сцены, незавершённые запросы отменены", step());
    }

    /**
     * Выполнить вызов API асинхронно и применить результат, если запрос
     * к этому ресурсу всё ещё последний.
     * <p>
     * Исключения дальше шага не уходят: всё, что вылетело, превращается в ошибку шага.
     * Проверка актуальности и применение ответа идут через {@link FlowStateHandle#runExclusively}.
     */
    protected <T> CompletableFuture<Void> request(String resource,
                                                  Supplier<ApiResult<T>> call,
                                                  Consumer<ApiResult<T>> apply) {
        RequestTicket ticket = requests.begin(resource);
        return CompletableFuture
                .supplyAsync(() -> ticket.isCurrent() ? call.get() : null, executor)
                .handle((result, error) -> {
                    if (error != null) {
                        log.error("Запрос {} упал с исключением", ticket, error);
                    }
                    ApiResult<T> outcome = error != null ? ApiResult.failure(UNEXPECTED_ERROR) : result;
                    flow.runExclusively(() -> applyIfCurrent(ticket, outcome, apply));
                    return null;
                });
    }

    private <T> void applyIfCurrent(RequestTicket ticket, ApiResult<T> outcome, Consumer<ApiResult<T>> apply) {
        if (!ticket.isCurrent()) {
            log.debug("Ответ {} устарел - выбрасываем", ticket);
            return;
        }
        try {
            apply.accept(outcome);
        } catch (RuntimeException e) {
            log.error("Не удалось применить ответ {}", ticket, e);
        }
    }
}
