package com.github.jhonatas48.schemaguard.core.runner;

import java.util.List;

/**
 * @param currentVersion   maior versão aplicada, ou 0
 * @param appliedCount     quantidade de migrações aplicadas (não revertidas)
 * @param pendingFileNames arquivos (ou nomes, para migrações programáticas) ainda não aplicados
 */
public record MigrationStatus(int currentVersion, int appliedCount, List<String> pendingFileNames) {

    public boolean isUpToDate() {
        return pendingFileNames.isEmpty();
    }
}
