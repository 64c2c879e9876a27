package com.github.jhonatas48.schemaguard.core.backup;

public class BackupFailedException extends IllegalStateException {

    public BackupFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
