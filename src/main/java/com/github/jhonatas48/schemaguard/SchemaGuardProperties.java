package com.github.jhonatas48.schemaguard;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuração do Schema Guard. Tudo pode vir de variáveis de ambiente
 * (ex.: {@code SCHEMAGUARD_BACKUP_DIR}, {@code SCHEMAGUARD_MAX_BACKUPS}).
 */
@ConfigurationProperties(prefix = "schemaguard")
public class SchemaGuardProperties {

    /** Ativa/desativa a execução automática das migrações no startup. */
    private boolean enabled = true;

    /** Arquivo do banco; vazio = derivado de spring.datasource.url. */
    private String databasePath = "";

    /** Script do schema base (versão 1). */
    private String baseSchemaLocation = "classpath:db/schema.sql";

    /** Diretório dos scripts NNN_descricao.sql. */
    private String migrationsLocation = "classpath:db/migrations";

    /** Lista explícita e ordenada de arquivos; vazia = varre migrationsLocation. */
    private List<String> manifest = new ArrayList<>();

    /** Diretório dos backups. */
    private String backupDir = "data/backups";

    /** Quantos backups manter (os mais antigos são apagados). */
    private int maxBackups = 10;

    /** Faz backup síncrono antes de migrar. */
    private boolean backupBeforeMigration = true;

    /** Prefixo dos arquivos de backup: <prefixo>-<timestamp>-<motivo>.db */
    private String filePrefix = "schemaguard";

    // Getters/Setters

    public boolean isEnabled() {
        return enabled;
    }
    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getDatabasePath() {
        return databasePath;
    }
    public void setDatabasePath(String databasePath) {
        this.databasePath = databasePath;
    }

    public String getBaseSchemaLocation() {
        return baseSchemaLocation;
    }
    public void setBaseSchemaLocation(String baseSchemaLocation) {
        this.baseSchemaLocation = baseSchemaLocation;
    }

    public String getMigrationsLocation() {
        return migrationsLocation;
    }
    public void setMigrationsLocation(String migrationsLocation) {
        this.migrationsLocation = migrationsLocation;
    }

    public List<String> getManifest() {
        return manifest;
    }
    public void setManifest(List<String> manifest) {
        this.manifest = manifest;
    }

    public String getBackupDir() {
        return backupDir;
    }
    public void setBackupDir(String backupDir) {
        this.backupDir = backupDir;
    }

    public int getMaxBackups() {
        return maxBackups;
    }
    public void setMaxBackups(int maxBackups) {
        this.maxBackups = maxBackups;
    }

    public boolean isBackupBeforeMigration() {
        return backupBeforeMigration;
    }
    public void setBackupBeforeMigration(boolean backupBeforeMigration) {
        this.backupBeforeMigration = backupBeforeMigration;
    }

    public String getFilePrefix() {
        return filePrefix;
    }
    public void setFilePrefix(String filePrefix) {
        this.filePrefix = filePrefix;
    }
}
