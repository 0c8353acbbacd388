package com.smartbin.domain.exception;

/**
 * Clasificación de los fallos que una operación puede reportar al llamador.
 */
public enum ErrorKind {

    /** Campos de entrada faltantes o mal formados */
    VALIDATION,

    /** Recurso inexistente */
    NOT_FOUND,

    /** Recurso duplicado (por ejemplo, username ya registrado) */
    CONFLICT,

    USER_NOT_FOUND,

    USER_DISABLED,

    WRONG_PASSWORD,

    /** Token de sesión ausente o inválido */
    UNAUTHORIZED,

    /** Papel sin permiso para la acción */
    FORBIDDEN,

    /** Activación MFA sin QR generado previamente */
    NO_SECRET_PENDING,

    /** Código TOTP que no coincide con ningún paso de la ventana */
    INVALID_CODE,

    /** El usuario no tiene MFA activado */
    MFA_NOT_REQUIRED,

    /** Muestra demasiado pequeña para el análisis solicitado */
    INSUFFICIENT_DATA,

    /** No hay lecturas en la ventana solicitada */
    NO_DATA,

    /** Fallo del almacenamiento subyacente */
    STORAGE
}
