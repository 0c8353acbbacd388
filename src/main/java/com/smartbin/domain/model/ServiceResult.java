package com.smartbin.domain.model;

import com.smartbin.domain.exception.ErrorKind;
import com.smartbin.domain.exception.ServiceException;

import java.util.Objects;
import java.util.function.Function;

/**
 * Resultado explícito de una operación: un valor, o un {@link ErrorKind} con
 * su mensaje. Obliga al llamador a decidir qué hacer con cada tipo de fallo.
 *
 * @param <T> tipo del valor en caso de éxito
 */
public final class ServiceResult<T> {

    private final T value;
    private final ErrorKind error;
    private final String message;

    private ServiceResult(T value, ErrorKind error, String message) {
        this.value = value;
        this.error = error;
        this.message = message;
    }

    public static <T> ServiceResult<T> success(T value) {
        return new ServiceResult<>(value, null, null);
    }

    public static <T> ServiceResult<T> failure(ErrorKind error, String message) {
        return new ServiceResult<>(null, Objects.requireNonNull(error, "error"), message);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * @return el valor de éxito
     * @throws IllegalStateException si el resultado es un fallo
     */
    public T getValue() {
        if (!isSuccess()) {
            throw new IllegalStateException("Resultado sin valor: " + error);
        }
        return value;
    }

    public ErrorKind getError() {
        return error;
    }

    public String getMessage() {
        return message;
    }

    public <R> ServiceResult<R> map(Function<? super T, ? extends R> mapper) {
        if (!isSuccess()) {
            return failure(error, message);
        }
        return success(mapper.apply(value));
    }

    /**
     * Devuelve el valor o lanza una {@link ServiceException} con el mismo tipo
     * de error.
     */
    public T orElseThrow() {
        if (!isSuccess()) {
            throw new ServiceException(error, message);
        }
        return value;
    }

    @Override
    public String toString() {
        return isSuccess() ? "ServiceResult[ok]" : "ServiceResult[" + error + ": " + message + "]";
    }
}
