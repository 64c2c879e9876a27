package com.github.jhonatas48.schemaguard;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.InitializingBean;

/**
 * Roda as migrações durante a criação do contexto: se falhar, o startup aborta
 * antes de a aplicação aceitar tráfego.
 */
public class AutoMigrationRunner implements InitializingBean {

    private static final Logger LOGGER = LoggerFactory.getLogger(AutoMigrationRunner.class);

    private final SchemaGuardProperties properties;
    private final MigrationService migrationService;

    public AutoMigrationRunner(SchemaGuardProperties properties, MigrationService migrationService) {
        this.properties = properties;
        this.migrationService = migrationService;
    }

    @Override
    public void afterPropertiesSet() {
        if (!properties.isEnabled()) {
            LOGGER.info("Schema Guard: desabilitado via propriedade 'schemaguard.enabled=false'.");
            return;
        }

        LOGGER.info("Schema Guard: backup-before-migration={}, executando...", properties.isBackupBeforeMigration());
        migrationService.ensureSchemaCurrent();
    }
}
