package org.example.registration_flow.service;

import java.util.function.Function;

/**
 * Результат сетевого вызова: либо значение, либо текст ошибки.
 * <p>
 * Исключения наружу из клиента API не летят, всё превращается в ApiResult.
 *
 * @param value  значение (может быть null у успешных вызовов без тела)
 * @param error  сообщение об ошибке, null при успехе
 * @param status HTTP-статус ответа, 0 если до сервера не достучались
 */
public record ApiResult<T>(T value, String error, int status) {

    public static <T> ApiResult<T> success(T value) {
        return new ApiResult<>(value, null, 200);
    }

    public static <T> ApiResult<T> failure(String error, int status) {
        return new ApiResult<>(null, error, status);
    }

    public static <T> ApiResult<T> failure(String error) {
        return new ApiResult<>(null, error, 0);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isNotFound() {
        return status == 404;
    }

    public <R> ApiResult<R> map(Function<T, R> mapper) {
        if (!isSuccess()) {
            return new ApiResult<>(null, error, status);
        }
        return new ApiResult<>(mapper.apply(value), null, status);
    }
}
