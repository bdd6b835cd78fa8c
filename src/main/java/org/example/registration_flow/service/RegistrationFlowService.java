package org.example.registration_flow.service;

import lombok.extern.slf4j.Slf4j;
import org.example.registration_flow.config.RegistrationApiConfig;
import org.example.registration_flow.handler.StepOrchestrator;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Регистрации, которые сейчас проходят пользователи.
 * <p>
 * Ключ: id сессии оболочки UI.
 * Значение: оркестратор со своим FlowState.
 * <p>
 * Состояние живёт в памяти: после перезапуска пользователь начинает заново,
 * черновик на сервере при этом не теряется.
 */
@Slf4j
@Service
public class RegistrationFlowService {

    private final RegistrationApiClient api;
    private final ValidationEngine validation;
    private final RegistrationApiConfig config;
    private final Clock clock;
    private final Executor flowExecutor;

    private final Map<String, StepOrchestrator> sessions = new ConcurrentHashMap<>();

    public RegistrationFlowService(RegistrationApiClient api,
                                   ValidationEngine validation,
                                   RegistrationApiConfig config,
                                   Clock clock,
                                   @Qualifier("flowExecutor") Executor flowExecutor) {
        this.api = api;
        this.validation = validation;
        this.config = config;
        this.clock = clock;
        this.flowExecutor = flowExecutor;
    }

    /**
     * Начать регистрацию с первого шага. Незаконченная регистрация этой сессии
     * закрывается.
     */
    public StepOrchestrator start(String sessionId) {
        StepOrchestrator orchestrator = new StepOrchestrator(sessionId, api, validation, config, clock, flowExecutor);
        StepOrchestrator previous = sessions.put(sessionId, orchestrator);
        if (previous != null) {
            log.info("Сессия {}: предыдущая регистрация брошена на шаге {}", sessionId, previous.currentStep());
            previous.close();
        }
        orchestrator.start();
        return orchestrator;
    }

    public Optional<StepOrchestrator> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    /**
     * Продолжить регистрацию сессии или начать новую.
     */
    public StepOrchestrator resumeOrStart(String sessionId) {
        return find(sessionId).orElseGet(() -> start(sessionId));
    }

    public void finish(String sessionId) {
        StepOrchestrator orchestrator = sessions.remove(sessionId);
        if (orchestrator != null) {
            orchestrator.close();
        }
    }

    public int activeSessions() {
        return sessions.size();
    }
}
