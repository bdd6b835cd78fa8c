package org.example.registration_flow.service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * "Побеждает последний запрос".
 * <p>
 * На каждый ресурс (схема формы, сводка, статус ...) ведётся счётчик.
 * Новый запрос получает билет с новым номером; ответ применяется, только если
 * его билет всё ещё последний. Уход со шага гасит все билеты разом.
 */
public class RequestTracker {

    private final Map<String, AtomicLong> sequences = new ConcurrentHashMap<>();

    public RequestTicket begin(String resource) {
        long number = sequence(resource).incrementAndGet();
        return new RequestTicket(resource, number);
    }

    /**
     * Отменить все запросы по всем ресурсам: их ответы будут выброшены.
     */
    public void cancelAll() {
        sequences.values().forEach(AtomicLong::incrementAndGet);
    }

    public void cancel(String resource) {
        sequence(resource).incrementAndGet();
    }

    private AtomicLong sequence(String resource) {
        return sequences.computeIfAbsent(resource, key -> new AtomicLong());
    }

    /**
     * Кооперативный токен отмены: задача и тот, кто применяет результат,
     * сами спрашивают {@link #isCurrent()}.
     */
    public final class RequestTicket {

        private final String resource;
        private final long number;

        private RequestTicket(String resource, long number) {
            this.resource = resource;
            this.number = number;
        }

        public String getResource() {
            return resource;
        }

        public boolean isCurrent() {
            return sequence(resource).get() == number;
        }

        @Override
        public String toString() {
            return resource + "#" + number;
        }
    }
}
