package com.github.jhonatas48.schemaguard.core.backup;

/**
 * Falha ao restaurar um backup. Sempre propaga: restauração parcial silenciosa não é aceitável.
 */
public class RestoreFailedException extends IllegalStateException {

    public RestoreFailedException(String message) {
        super(message);
    }

    public RestoreFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
