package com.github.jhonatas48.schemaguard.core.registry;

import java.time.Instant;

/**
 * Linha do registro de migrações. Imutável depois de gravada;
 * {@code rolledBackAt} só é preenchido pelo caminho de rollback.
 */
public record MigrationRecord(int version,
                              String name,
                              Instant appliedAt,
                              String checksum,
                              boolean canRollback,
                              Instant rolledBackAt,
                              long executionTimeMs) {

    public boolean isRolledBack() {
        return rolledBackAt != null;
    }
}
