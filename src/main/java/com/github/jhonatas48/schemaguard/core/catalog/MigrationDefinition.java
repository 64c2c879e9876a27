package com.github.jhonatas48.schemaguard.core.catalog;

import java.util.Objects;
import java.util.Optional;

/**
 * Entrada do catálogo: versão, nome e como aplicar (script SQL ou {@link JdbcMigration}).
 * O down-script é opcional e só é usado pelo rollback da última migração.
 */
public final class MigrationDefinition {

    private final int version;
    private final String name;
    private final MigrationSource script;
    private final JdbcMigration jdbcMigration;
    private final MigrationSource downScript;

    private MigrationDefinition(int version,
                                String name,
                                MigrationSource script,
                                JdbcMigration jdbcMigration,
                                MigrationSource downScript) {
        if (version < 1) {
            throw new IllegalArgumentException("Versão de migração deve ser >= 1: " + version);
        }
        this.version = version;
        this.name = Objects.requireNonNull(name, "name não pode ser nulo");
        this.script = script;
        this.jdbcMigration = jdbcMigration;
        this.downScript = downScript;
    }

    public static MigrationDefinition script(int version, String name, MigrationSource script) {
        return new MigrationDefinition(version, name, Objects.requireNonNull(script, "script não pode ser nulo"), null, null);
    }

    public static MigrationDefinition programmatic(int version, String name, JdbcMigration migration) {
        return new MigrationDefinition(version, name, null, Objects.requireNonNull(migration, "migration não pode ser nulo"), null);
    }

    public MigrationDefinition withDownScript(MigrationSource down) {
        return new MigrationDefinition(version, name, script, jdbcMigration, down);
    }

    public int getVersion() {
        return version;
    }

    public String getName() {
        return name;
    }

    public boolean isProgrammatic() {
        return jdbcMigration != null;
    }

    public Optional<MigrationSource> getScript() {
        return Optional.ofNullable(script);
    }

    public Optional<JdbcMigration> getJdbcMigration() {
        return Optional.ofNullable(jdbcMigration);
    }

    public Optional<MigrationSource> getDownScript() {
        return Optional.ofNullable(downScript);
    }

    public boolean canRollback() {
        return downScript != null;
    }

    /** Nome do arquivo para status/logs; migrações programáticas usam o próprio nome. */
    public String describeSource() {
        return script != null ? script.describe() : name;
    }

    @Override
    public String toString() {
        return String.format("%03d_%s", version, name);
    }
}
