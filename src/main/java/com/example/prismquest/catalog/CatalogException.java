package com.example.prismquest.catalog;

/**
 * Thrown when catalog documents cannot be read or are structurally invalid.
 * Only raised while loading; a loaded catalog never throws.
 */
public class CatalogException extends RuntimeException {

    public CatalogException(String message) {
        super(message);
    }

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
