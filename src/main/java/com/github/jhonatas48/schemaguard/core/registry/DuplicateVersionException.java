package com.github.jhonatas48.schemaguard.core.registry;

/**
 * Tentativa de registrar uma versão que já consta no registro.
 */
public class DuplicateVersionException extends IllegalStateException {

    private final int version;

    public DuplicateVersionException(int version, Throwable cause) {
        super("Versão de migração já registrada: " + version, cause);
        this.version = version;
    }

    public int getVersion() {
        return version;
    }
}
