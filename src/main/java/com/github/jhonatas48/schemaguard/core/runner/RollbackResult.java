package com.github.jhonatas48.schemaguard.core.runner;

public record RollbackResult(boolean success, int version, String name, String message) {

    static RollbackResult refused(int version, String name, String message) {
        return new RollbackResult(false, version, name, message);
    }

    static RollbackResult rolledBack(int version, String name) {
        return new RollbackResult(true, version, name, "Migração revertida");
    }
}
