package com.github.jhonatas48.schemaguard;

import com.github.jhonatas48.schemaguard.core.backup.BackupSnapshot;
import com.github.jhonatas48.schemaguard.core.backup.BackupStore;
import com.github.jhonatas48.schemaguard.core.runner.MigrationRunner;
import com.github.jhonatas48.schemaguard.core.runner.MigrationStatus;

import java.nio.file.Path;
import java.util.List;

/**
 * Ponto de entrada para o resto da aplicação: "schema atualizado" e "snapshot antes de operação arriscada".
 * Os detalhes (parser, registro, catálogo) ficam atrás do runner e do store.
 */
public class MigrationService {

    private final MigrationRunner migrationRunner;
    private final BackupStore backupStore;

    public MigrationService(MigrationRunner migrationRunner, BackupStore backupStore) {
        this.migrationRunner = migrationRunner;
        this.backupStore = backupStore;
    }

    /** Aplica o que estiver pendente; falha propaga como MigrationException. */
    public void ensureSchemaCurrent() {
        migrationRunner.runMigrations();
    }

    public MigrationStatus status() {
        return migrationRunner.getMigrationStatus();
    }

    /** Snapshot consistente com a aplicação rodando. */
    public Path createSnapshot(String reason) {
        return backupStore.createBackup(reason);
    }

    public void restoreSnapshot(Path backupPath) {
        backupStore.restoreFromBackup(backupPath);
    }

    public List<BackupSnapshot> listSnapshots() {
        return backupStore.listBackups();
    }
}
