package com.smartbin.domain.model;

/**
 * Acciones que pueden ser autorizadas por papel.
 */
public enum Permission {
    CREATE,
    READ,
    UPDATE,
    DELETE,
    EXPORT,
    ANALYZE
}
