package com.smartbin.domain.port;

/**
 * Puerto para generar imágenes de código QR.
 */
public interface QrCodeRenderer {

    /**
     * Genera un PNG del contenido y lo devuelve como data URI base64
     * ({@code data:image/png;base64,...}).
     *
     * @param content Texto a codificar
     * @return Data URI de la imagen
     */
    String renderPngDataUri(String content);
}
