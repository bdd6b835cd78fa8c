package org.example.registration_flow;

import lombok.extern.slf4j.Slf4j;
import org.example.registration_flow.config.RegistrationApiConfig;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

@Slf4j
@Configuration
public class Config {

    /**
     * HTTP-клиент к бэкенду регистрации.
     *
     * @param builder - билдер от Spring Boot (уже знает про Jackson)
     * @return RestTemplate с таймаутами из конфига
     */
    @Bean
    RestTemplate registrationRestTemplate(RestTemplateBuilder builder, RegistrationApiConfig apiConfig) {
        RestTemplate restTemplate = builder
                .setConnectTimeout(Duration.ofMillis(apiConfig.getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(apiConfig.getReadTimeoutMs()))
                .build();
        log.info("[Config] registrationRestTemplate() - клиент API готов");
        return restTemplate;
    }

    /**
     * Пул для сетевых вызовов шагов. Валидация и слияние состояния сюда не попадают,
     * они синхронные.
     */
    @Bean(name = "flowExecutor")
    ThreadPoolTaskExecutor flowExecutor(RegistrationApiConfig apiConfig) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(apiConfig.getExecutorThreads());
        executor.setMaxPoolSize(apiConfig.getExecutorThreads());
        executor.setThreadNamePrefix("registration-flow-");
        executor.initialize();
        return executor;
    }

    /**
     * Часы - отдельным бином, чтобы в тестах подставлять фиксированную дату.
     */
    @Bean
    Clock clock() {
        return Clock.systemDefaultZone();
    }
}
