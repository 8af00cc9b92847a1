package org.cleanseam.engine.catalog;

/**
 * Malformed or unreadable catalog data. Fatal at startup.
 */
public final class CatalogLoadException extends RuntimeException {

    public CatalogLoadException(String message) {
        super(message);
    }

    public CatalogLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
