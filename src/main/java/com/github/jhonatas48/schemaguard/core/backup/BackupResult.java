package com.github.jhonatas48.schemaguard.core.backup;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Resultado do backup síncrono. Não lança exceção: quem chama decide se a falha é só um aviso.
 * Sucesso sem {@code backupPath} significa que não havia banco para copiar.
 */
public final class BackupResult {

    private final boolean success;
    private final Path backupPath;
    private final String error;
    private final long durationMs;
    private final long sizeBytes;

    private BackupResult(boolean success, Path backupPath, String error, long durationMs, long sizeBytes) {
        this.success = success;
        this.backupPath = backupPath;
        this.error = error;
        this.durationMs = durationMs;
        this.sizeBytes = sizeBytes;
    }

    public static BackupResult created(Path backupPath, long durationMs, long sizeBytes) {
        return new BackupResult(true, backupPath, null, durationMs, sizeBytes);
    }

    public static BackupResult nothingToBackUp(long durationMs) {
        return new BackupResult(true, null, null, durationMs, 0L);
    }

    public static BackupResult failed(String error, long durationMs) {
        return new BackupResult(false, null, error, durationMs, 0L);
    }

    public boolean isSuccess() {
        return success;
    }

    public Optional<Path> getBackupPath() {
        return Optional.ofNullable(backupPath);
    }

    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }

    public long getDurationMs() {
        return durationMs;
    }

    public long getSizeBytes() {
        return sizeBytes;
    }

    @Override
    public String toString() {
        return success
                ? "BackupResult{success, path=" + backupPath + ", " + sizeBytes + " bytes, " + durationMs + " ms}"
                : "BackupResult{failed, error=" + error + "}";
    }
}
