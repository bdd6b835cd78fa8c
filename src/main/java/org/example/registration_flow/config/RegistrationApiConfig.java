package org.example.registration_flow.config;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

/**
 * Настройки движка регистрации.
 * <p>
 * Всё берётся из application.properties, поэтому один и тот же код
 * можно направить на любой бэкенд (dev / stage / prod).
 */
@Slf4j
@Getter
@Configuration
public class RegistrationApiConfig {

    /**
     * Базовый адрес REST API, например: "https://club.example.org/api"
     */
    @Value("${registration.api.base-url}")
    private String baseUrl;

    @Value("${registration.api.connect-timeout-ms:5000}")
    private int connectTimeoutMs;

    @Value("${registration.api.read-timeout-ms:15000}")
    private int readTimeoutMs;

    /**
     * Потоки для сетевых вызовов шагов.
     */
    @Value("${registration.flow.executor-threads:4}")
    private int executorThreads;

    /**
     * Если у программы нет кастомной формы - шаг формы сам отмечается завершённым.
     */
    @Value("${registration.flow.auto-skip-empty-form:true}")
    private boolean autoSkipEmptyForm;

    /**
     * Куда отправлять пользователя, если статус регистрации не удалось подтвердить.
     */
    @Value("${registration.support.contact:support@example.org}")
    private String supportContact;

    @Value("${registration.display.currency:USD}")
    private String currency;

    @Value("${registration.display.locale:en-US}")
    private String locale;

    @PostConstruct
    public void init() {
        log.info("===========================================");
        log.info("API РЕГИСТРАЦИИ: {} (connect={}ms, read={}ms)", baseUrl, connectTimeoutMs, readTimeoutMs);
        log.info("===========================================");
    }

    /**
     * Склеить базовый адрес и путь без двойных слешей.
     * <p>
     * "https://host/api/" + "/programs" → "https://host/api/programs"
     */
    public String url(String path) {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return path.startsWith("/") ? base + path : base + "/" + path;
    }
}
