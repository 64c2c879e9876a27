package com.github.jhonatas48.schemaguard.core.registry;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.sqlite.SQLiteDataSource;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class MigrationRegistryTest {

    @TempDir
    Path tempDir;

    private SQLiteDataSource dataSource;
    private MigrationRegistry registry;

    @BeforeEach
    void setup() {
        dataSource = new SQLiteDataSource();
        dataSource.setUrl("jdbc:sqlite:" + tempDir.resolve("registry.db"));
        registry = new MigrationRegistry(dataSource);
        registry.ensureRegistryTable();
    }

    @Test
    void emptyRegistryReportsVersionZero() {
        assertThat(registry.currentVersion()).isZero();
        assertThat(registry.appliedMigrations()).isEmpty();
    }

    @Test
    void ensureRegistryTableIsIdempotent() {
        registry.recordMigration(1, "base_schema", false);

        registry.ensureRegistryTable();
        registry.ensureRegistryTable();

        assertThat(registry.currentVersion()).isEqualTo(1);
    }

    @Test
    void currentVersionIsHighestRecorded() {
        registry.recordMigration(1, "base_schema", false);
        registry.recordMigration(5, "analytics", true);
        registry.recordMigration(3, "agent_learning", false);

        assertThat(registry.currentVersion()).isEqualTo(5);
        assertThat(registry.isMigrationApplied(3)).isTrue();
        assertThat(registry.isMigrationApplied(4)).isFalse();
    }

    @Test
    void appliedMigrationsAreOrderedByVersion() {
        registry.recordMigration(3, "c", false);
        registry.recordMigration(1, "a", false);
        registry.recordMigration(2, "b", true);

        List<MigrationRecord> applied = registry.appliedMigrations();

        assertThat(applied).extracting(MigrationRecord::version).containsExactly(1, 2, 3);
        assertThat(applied).extracting(MigrationRecord::name).containsExactly("a", "b", "c");
        assertThat(applied.get(1).canRollback()).isTrue();
        assertThat(applied.get(0).appliedAt()).isNotNull().isBeforeOrEqualTo(Instant.now());
    }

    @Test
    @DisplayName("Registrar a mesma versão duas vezes lança DuplicateVersionException")
    void recordingSameVersionTwiceFails() {
        registry.recordMigration(2, "b", false);

        assertThatThrownBy(() -> registry.recordMigration(2, "b-again", false))
                .isInstanceOf(DuplicateVersionException.class)
                .hasMessageContaining("2")
                .extracting(e -> ((DuplicateVersionException) e).getVersion())
                .isEqualTo(2);
    }

    @Test
    void recordInsideTransactionIsDiscardedOnRollback() throws Exception {
        try (Connection c = dataSource.getConnection()) {
            c.setAutoCommit(false);
            registry.recordMigration(c, 7, "seven", MigrationChecksums.of("SELECT 1"), false, 12L);
            c.rollback();
        }

        assertThat(registry.currentVersion()).isZero();
    }

    @Test
    @DisplayName("Importa o registro legado uma única vez e não altera a tabela antiga")
    void migratesLegacyLedgerOnce() throws Exception {
        exec("CREATE TABLE schema_migrations (version INTEGER PRIMARY KEY, applied_at TEXT DEFAULT (datetime('now')))");
        exec("INSERT INTO schema_migrations (version, applied_at) VALUES (1, '2024-01-10 08:30:00'), (2, '2024-02-01 10:00:00')");

        registry.migrateFromOldSchema();
        registry.migrateFromOldSchema();

        List<MigrationRecord> applied = registry.appliedMigrations();
        assertThat(applied).extracting(MigrationRecord::version).containsExactly(1, 2);
        assertThat(applied).extracting(MigrationRecord::name).containsExactly("migration_001", "migration_002");
        assertThat(applied).extracting(MigrationRecord::checksum).containsOnly(MigrationChecksums.LEGACY);
        assertThat(applied.get(0).appliedAt()).isEqualTo(Instant.parse("2024-01-10T08:30:00Z"));
        assertThat(count("schema_migrations")).isEqualTo(2);
    }

    @Test
    void legacyImportSkippedWhenRegistryAlreadyHasRows() throws Exception {
        registry.recordMigration(1, "base_schema", false);
        exec("CREATE TABLE schema_migrations (version INTEGER PRIMARY KEY, applied_at TEXT)");
        exec("INSERT INTO schema_migrations (version, applied_at) VALUES (1, '2024-01-10 08:30:00'), (9, '2024-02-01 10:00:00')");

        registry.migrateFromOldSchema();

        assertThat(registry.currentVersion()).isEqualTo(1);
    }

    @Test
    void legacyImportWithoutLegacyTableIsNoOp() {
        assertThatCode(() -> registry.migrateFromOldSchema()).doesNotThrowAnyException();
        assertThat(registry.currentVersion()).isZero();
    }

    @Test
    void rolledBackVersionLeavesCurrentAndCanBeReapplied() throws Exception {
        registry.recordMigration(1, "a", false);
        registry.recordMigration(2, "b", true);

        try (Connection c = dataSource.getConnection()) {
            registry.markRolledBack(c, 2);
        }

        assertThat(registry.currentVersion()).isEqualTo(1);
        assertThat(registry.getMigrationHistory()).extracting(MigrationRecord::isRolledBack).containsExactly(false, true);

        registry.recordMigration(2, "b", true);

        assertThat(registry.currentVersion()).isEqualTo(2);
        assertThat(registry.getMigrationHistory()).hasSize(2);
    }

    @Test
    void verifyIntegrityReportsChangedScripts() throws Exception {
        try (Connection c = dataSource.getConnection()) {
            registry.recordMigration(c, 2, "b", MigrationChecksums.of("CREATE TABLE b (id INT);"), false, 1L);
            registry.recordMigration(c, 3, "c", MigrationChecksums.of("CREATE TABLE c (id INT);"), false, 1L);
        }

        List<Integer> modified = registry.verifyIntegrity(Map.of(
                2, "  CREATE TABLE b (id INT);\n",
                3, "CREATE TABLE c (id INT, name TEXT);"
        ));

        assertThat(modified).containsExactly(3);
    }

    @Test
    void checksumIgnoresSurroundingWhitespace() {
        assertThat(MigrationChecksums.of("SELECT 1;")).hasSize(16).isEqualTo(MigrationChecksums.of("\n SELECT 1; \n"));
        assertThat(MigrationChecksums.of(null)).isEqualTo(MigrationChecksums.INLINE);
    }

    private void exec(String sql) throws SQLException {
        try (Connection c = dataSource.getConnection(); Statement st = c.createStatement()) {
            st.execute(sql);
        }
    }

    private int count(String table) throws SQLException {
        try (Connection c = dataSource.getConnection();
             Statement st = c.createStatement();
             ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM " + table)) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }
}
