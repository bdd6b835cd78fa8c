package org.example.registration_flow.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.registration_flow.config.RegistrationApiConfig;
import org.example.registration_flow.model.FieldValueMap;
import org.example.registration_flow.model.PaymentIntent;
import org.example.registration_flow.model.Program;
import org.example.registration_flow.model.RegistrationFormSchema;
import org.example.registration_flow.model.RegistrationRecord;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Клиент REST API регистрации.
 * <p>
 * Что делает:
 * 1. Ходит в бэкенд через RestTemplate
 * 2. Разбирает JSON через Jackson
 * 3. Любую ошибку (HTTP, сеть, кривой JSON) превращает в {@link ApiResult#failure}
 * <p>
 * Методы синхронные: асинхронность и отмена - забота шагов.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RegistrationApiClient {

    static final String UNEXPECTED_ERROR = "An unexpected error occurred";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final RegistrationApiConfig apiConfig;

    /**
     * Список программ. Сервер отдаёт {"programs": [...]}, старые версии - просто массив.
     */
    public ApiResult<List<Program>> listPrograms() {
        return request(HttpMethod.GET, "/programs", null, root -> {
            JsonNode programs = root != null && root.has("programs") ? root.get("programs") : root;
            List<Program> result = new ArrayList<>();
            if (programs != null && programs.isArray()) {
                for (JsonNode node : programs) {
                    result.add(convert(node, Program.class));
                }
            }
            return result;
        });
    }

    /**
     * Создать черновик регистрации на программу.
     *
     * @return id регистрации
     */
    public ApiResult<String> startRegistration(String programId) {
        ApiResult<JsonNode> result = call(HttpMethod.POST, "/registration-flow/start", Map.of("program_id", programId));
        if (!result.isSuccess()) {
            return result.map(root -> null);
        }
        String registrationId = textOf(result.value(), "registration_id");
        if (registrationId == null) {
            registrationId = textOf(result.value(), "id");
        }
        if (registrationId == null) {
            log.error("Сервер не вернул id регистрации для программы {}: {}", programId, result.value());
            return ApiResult.failure("Failed to start registration", result.status());
        }
        return ApiResult.success(registrationId);
    }

    /**
     * Схема кастомной формы программы. 404 = у программы формы нет
     * (это не ошибка, а отдельная ветка: см. {@link ApiResult#isNotFound()}).
     */
    public ApiResult<RegistrationFormSchema> fetchRegistrationForm(String programId) {
        return request(HttpMethod.GET, "/programs/" + programId + "/registration-form", null, root -> {
            JsonNode form = root != null && root.has("form") ? root.get("form") : root;
            return convert(form, RegistrationFormSchema.class);
        });
    }

    public ApiResult<Void> submitForm(String registrationId, FieldValueMap formData) {
        Map<String, Object> body = Map.of("form_data", formData.toPayload());
        return request(HttpMethod.POST, "/registration-flow/" + registrationId + "/submit-form", body, root -> null);
    }

    /**
     * Статус регистрации вместе с финансовой сводкой и ответами формы.
     */
    public ApiResult<RegistrationRecord> fetchStatus(String registrationId) {
        return request(HttpMethod.GET, "/registration-flow/" + registrationId + "/status", null,
                root -> convert(root, RegistrationRecord.class));
    }

    /**
     * Финализация: черновик → готов к оплате. Ответ для движка непрозрачен.
     */
    public ApiResult<JsonNode> finalizeRegistration(String registrationId) {
        return call(HttpMethod.POST, "/registration-flow/" + registrationId + "/finalize", null);
    }

    public ApiResult<PaymentIntent> createPaymentIntent(String registrationId) {
        return request(HttpMethod.POST, "/registration-flow/" + registrationId + "/payment-intent", null, root -> {
            JsonNode intent = root != null && root.has("paymentIntent") ? root.get("paymentIntent") : root;
            return convert(intent, PaymentIntent.class);
        });
    }

    // ======= HTTP =======

    /**
     * Вызов + разбор ответа. Ошибки разбора (JSON есть, но не той формы)
     * тоже становятся ApiResult.failure.
     */
    private <T> ApiResult<T> request(HttpMethod method, String path, Object body, Function<JsonNode, T> reader) {
        ApiResult<JsonNode> result = call(method, path, body);
        try {
            return result.map(reader);
        } catch (IllegalArgumentException e) {
            log.error("API {} {}: ответ не соответствует ожидаемой структуре", method, path, e);
            return ApiResult.failure("Unexpected response from server", result.status());
        }
    }

    private ApiResult<JsonNode> call(HttpMethod method, String path, Object body) {
        String url = apiConfig.url(path);
        log.debug("API запрос: {} {}", method, url);
        try {
            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);
            headers.setAccept(List.of(MediaType.APPLICATION_JSON));
            HttpEntity<String> entity = new HttpEntity<>(body == null ? null : objectMapper.writeValueAsString(body), headers);

            ResponseEntity<String> response = restTemplate.exchange(url, method, entity, String.class);
            String responseBody = response.getBody();
            JsonNode root = responseBody == null || responseBody.isBlank() ? null : objectMapper.readTree(responseBody);
            log.debug("API ответ: {} {} → {}", method, url, response.getStatusCode().value());
            return new ApiResult<>(root, null, response.getStatusCode().value());

        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            String message = extractErrorMessage(status, e.getStatusText(), e.getResponseBodyAsString());
            if (status == 404) {
                log.info("API {} {} → 404: {}", method, url, message);
            } else {
                log.warn("API {} {} → {}: {}", method, url, status, message);
            }
            return ApiResult.failure(message, status);
        } catch (JsonProcessingException e) {
            log.error("API {} {}: не удалось разобрать JSON", method, url, e);
            return ApiResult.failure("Unexpected response from server");
        } catch (RestClientException e) {
            log.error("API {} {}: сетевая ошибка: {}", method, url, e.getMessage());
            return ApiResult.failure(e.getMessage() == null ? UNEXPECTED_ERROR : e.getMessage());
        }
    }

    /**
     * Текст ошибки для пользователя: поле error, потом message,
     * иначе "HTTP <status>: <statusText>".
     */
    String extractErrorMessage(int status, String statusText, String body) {
        String fallback = "HTTP " + status + ": " + (statusText == null ? "" : statusText);
        if (body == null || body.isBlank()) {
            return fallback;
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            String error = textOf(root, "error");
            if (error != null) {
                return error;
            }
            String message = textOf(root, "message");
            if (message != null) {
                return message;
            }
        } catch (JsonProcessingException e) {
            log.debug("Тело ошибки не JSON: {}", body);
        }
        return fallback;
    }

    private <T> T convert(JsonNode node, Class<T> type) {
        if (node == null || node.isNull()) {
            return null;
        }
        try {
            return objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Не удалось прочитать " + type.getSimpleName(), e);
        }
    }

    private static String textOf(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        return value != null && !value.isNull() && !value.asText().isEmpty() ? value.asText() : null;
    }
}
