package com.github.jhonatas48.schemaguard.core.backup;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Um backup no diretório de backups. Os arquivos irmãos {@code -wal}/{@code -shm},
 * quando existem, pertencem à mesma unidade lógica.
 */
public record BackupSnapshot(String filename,
                             Path path,
                             long sizeBytes,
                             Instant createdAt,
                             String reason) {
}
