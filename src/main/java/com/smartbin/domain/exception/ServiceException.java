package com.smartbin.domain.exception;

/**
 * Excepción de negocio con un {@link ErrorKind} asociado. Se traduce a una
 * respuesta HTTP en la capa de presentación.
 */
public class ServiceException extends RuntimeException {

    private final ErrorKind kind;

    public ServiceException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ServiceException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Excepción cuando falta el token o no corresponde a una sesión activa.
     */
    public static ServiceException unauthorized() {
        return new ServiceException(ErrorKind.UNAUTHORIZED, "Nao autorizado");
    }

    /**
     * Excepción cuando el papel del usuario no permite la acción.
     */
    public static ServiceException forbidden(String message) {
        return new ServiceException(ErrorKind.FORBIDDEN, message);
    }

    /**
     * Excepción cuando la entrada es inválida.
     */
    public static ServiceException validation(String message) {
        return new ServiceException(ErrorKind.VALIDATION, message);
    }

    /**
     * Excepción cuando falla el almacenamiento.
     */
    public static ServiceException storage(String operation, Throwable cause) {
        return new ServiceException(ErrorKind.STORAGE, "Falla de almacenamiento en " + operation, cause);
    }
}
