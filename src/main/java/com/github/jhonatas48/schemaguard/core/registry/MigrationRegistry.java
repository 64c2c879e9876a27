package com.github.jhonatas48.schemaguard.core.registry;

import com.github.jhonatas48.schemaguard.core.sqlite.SqliteErrors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Registro persistente das versões aplicadas (tabela {@value #REGISTRY_TABLE}).
 *
 * Sem cache: toda leitura vai ao banco, pois a decisão de versão nunca pode usar estado velho.
 * Métodos que recebem {@link Connection} participam da transação de quem chama;
 * os demais abrem (e fecham) uma conexão própria do DataSource.
 */
public class MigrationRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(MigrationRegistry.class);

    public static final String REGISTRY_TABLE = "migration_registry";
    public static final String LEGACY_TABLE   = "schema_migrations";

    private static final DateTimeFormatter SQLITE_DATETIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final String CREATE_REGISTRY_TABLE = """
            CREATE TABLE IF NOT EXISTS migration_registry (
                version INTEGER PRIMARY KEY,
                name TEXT NOT NULL,
                applied_at TEXT NOT NULL,
                checksum TEXT NOT NULL,
                can_rollback INTEGER NOT NULL DEFAULT 0,
                rolled_back_at TEXT,
                execution_time_ms INTEGER NOT NULL DEFAULT 0
            )
            """;

    private static final String SELECT_COLUMNS =
            "SELECT version, name, applied_at, checksum, can_rollback, rolled_back_at, execution_time_ms FROM migration_registry";

    private final DataSource dataSource;

    public MigrationRegistry(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource não pode ser nulo");
    }

    // ===================== Bootstrap =====================

    /** Cria a tabela do registro se ainda não existir. Pode ser chamado quantas vezes for preciso. */
    public void ensureRegistryTable() {
        try (Connection connection = dataSource.getConnection()) {
            ensureRegistryTable(connection);
        } catch (SQLException e) {
            throw new IllegalStateException("Falha ao criar a tabela " + REGISTRY_TABLE + ": " + e.getMessage(), e);
        }
    }

    public void ensureRegistryTable(Connection connection) throws SQLException {
        try (Statement st = connection.createStatement()) {
            st.execute(CREATE_REGISTRY_TABLE);
        }
        LOGGER.debug("Tabela {} garantida.", REGISTRY_TABLE);
    }

    /**
     * Importa, uma única vez, o registro legado (version, applied_at) quando ele existe
     * e o registro novo ainda está vazio. A tabela legada não é alterada.
     */
    public void migrateFromOldSchema() {
        try (Connection connection = dataSource.getConnection()) {
            migrateFromOldSchema(connection);
        } catch (SQLException e) {
            throw new IllegalStateException("Falha ao importar o registro legado: " + e.getMessage(), e);
        }
    }

    public void migrateFromOldSchema(Connection connection) throws SQLException {
        if (!tableExists(connection, LEGACY_TABLE)) {
            LOGGER.debug("Registro legado {} inexistente; nada a importar.", LEGACY_TABLE);
            return;
        }
        if (countRows(connection, REGISTRY_TABLE) > 0) {
            LOGGER.debug("Registro {} já populado; importação legada ignorada.", REGISTRY_TABLE);
            return;
        }

        final List<Object[]> legacyRows = new ArrayList<>();
        try (PreparedStatement ps = connection.prepareStatement(
                "SELECT version, applied_at FROM " + LEGACY_TABLE + " ORDER BY version ASC");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                legacyRows.add(new Object[]{rs.getInt(1), rs.getString(2)});
            }
        }
        if (legacyRows.isEmpty()) {
            return;
        }

        try (PreparedStatement insert = connection.prepareStatement(
                "INSERT OR IGNORE INTO " + REGISTRY_TABLE
                        + " (version, name, applied_at, checksum, can_rollback, execution_time_ms) VALUES (?, ?, ?, ?, 0, 0)")) {
            for (Object[] row : legacyRows) {
                final int version = (Integer) row[0];
                final Instant appliedAt = parseTimestamp((String) row[1]);
                insert.setInt(1, version);
                insert.setString(2, String.format("migration_%03d", version));
                insert.setString(3, (appliedAt != null ? appliedAt : Instant.now()).toString());
                insert.setString(4, MigrationChecksums.LEGACY);
                insert.addBatch();
            }
            insert.executeBatch();
        }
        LOGGER.info("Registro legado {} importado para {} ({} versões).", LEGACY_TABLE, REGISTRY_TABLE, legacyRows.size());
    }

    // ===================== Leitura =====================

    /** Só consulta o {@code sqlite_master}; não cria nada. */
    public boolean registryTableExists() {
        try (Connection connection = dataSource.getConnection()) {
            return tableExists(connection, REGISTRY_TABLE);
        } catch (SQLException e) {
            throw new IllegalStateException("Falha ao consultar " + REGISTRY_TABLE + ": " + e.getMessage(), e);
        }
    }

    /** Maior versão aplicada (e não revertida), ou 0 com o registro vazio. */
    public int currentVersion() {
        try (Connection connection = dataSource.getConnection()) {
            return currentVersion(connection);
        } catch (SQLException e) {
            throw new IllegalStateException("Falha ao ler a versão atual do schema: " + e.getMessage(), e);
        }
    }

    public int currentVersion(Connection connection) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(
                "SELECT MAX(version) FROM " + REGISTRY_TABLE + " WHERE rolled_back_at IS NULL");
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    public boolean isMigrationApplied(int version) {
        try (Connection connection = dataSource.getConnection();
             PreparedStatement ps = connection.prepareStatement(
                     "SELECT 1 FROM " + REGISTRY_TABLE + " WHERE version = ? AND rolled_back_at IS NULL")) {
            ps.setInt(1, version);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Falha ao consultar a versão " + version + ": " + e.getMessage(), e);
        }
    }

    /** Migrações aplicadas (não revertidas), em ordem crescente de versão. */
    public List<MigrationRecord> appliedMigrations() {
        return query(SELECT_COLUMNS + " WHERE rolled_back_at IS NULL ORDER BY version ASC");
    }

    /** Histórico completo, incluindo revertidas. */
    public List<MigrationRecord> getMigrationHistory() {
        return query(SELECT_COLUMNS + " ORDER BY version ASC");
    }

    /**
     * Compara o checksum gravado com o script atual de cada versão.
     * @param scriptsByVersion script atual por versão (migrações programáticas ficam de fora)
     * @return versões cujo script mudou depois de aplicado
     */
    public List<Integer> verifyIntegrity(Map<Integer, String> scriptsByVersion) {
        final List<Integer> modified = new ArrayList<>();
        for (MigrationRecord record : appliedMigrations()) {
            final String script = scriptsByVersion.get(record.version());
            if (script == null
                    || MigrationChecksums.LEGACY.equals(record.checksum())
                    || MigrationChecksums.INLINE.equals(record.checksum())) {
                continue;
            }
            final String actual = MigrationChecksums.of(script);
            if (!actual.equals(record.checksum())) {
                LOGGER.warn("Migração {} alterada depois de aplicada (esperado={}, atual={}).",
                        record.version(), record.checksum(), actual);
                modified.add(record.version());
            }
        }
        return modified;
    }

    // ===================== Escrita =====================

    /** Registra uma versão fora de transação, sem checksum de script. */
    public void recordMigration(int version, String name, boolean canRollback) {
        try (Connection connection = dataSource.getConnection()) {
            recordMigration(connection, version, name, MigrationChecksums.INLINE, canRollback, 0L);
        } catch (SQLException e) {
            throw new IllegalStateException("Falha ao registrar a migração " + version + ": " + e.getMessage(), e);
        }
    }

    /**
     * Grava a versão na transação corrente de {@code connection}.
     * Uma versão revertida anteriormente é reativada em vez de reinserida.
     *
     * @throws DuplicateVersionException se a versão já estiver registrada e ativa
     */
    public void recordMigration(Connection connection,
                                int version,
                                String name,
                                String checksum,
                                boolean canRollback,
                                long executionTimeMs) throws SQLException {
        if (isRolledBack(connection, version)) {
            try (PreparedStatement ps = connection.prepareStatement(
                    "UPDATE " + REGISTRY_TABLE + " SET name = ?, applied_at = ?, checksum = ?, can_rollback = ?,"
                            + " rolled_back_at = NULL, execution_time_ms = ? WHERE version = ?")) {
                ps.setString(1, name);
                ps.setString(2, Instant.now().toString());
                ps.setString(3, checksum);
                ps.setInt(4, canRollback ? 1 : 0);
                ps.setLong(5, executionTimeMs);
                ps.setInt(6, version);
                ps.executeUpdate();
            }
            LOGGER.info("Migração {} ({}) reaplicada após rollback.", version, name);
            return;
        }

        try (PreparedStatement ps = connection.prepareStatement(
                "INSERT INTO " + REGISTRY_TABLE
                        + " (version, name, applied_at, checksum, can_rollback, execution_time_ms) VALUES (?, ?, ?, ?, ?, ?)")) {
            ps.setInt(1, version);
            ps.setString(2, name);
            ps.setString(3, Instant.now().toString());
            ps.setString(4, checksum);
            ps.setInt(5, canRollback ? 1 : 0);
            ps.setLong(6, executionTimeMs);
            ps.executeUpdate();
        } catch (SQLException e) {
            if (SqliteErrors.isConstraintViolation(e)) {
                throw new DuplicateVersionException(version, e);
            }
            throw e;
        }
        LOGGER.info("Migração registrada: version={}, name={}, checksum={}, canRollback={}, {} ms",
                version, name, checksum, canRollback, executionTimeMs);
    }

    /** Marca a versão como revertida na transação corrente de {@code connection}. */
    public void markRolledBack(Connection connection, int version) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(
                "UPDATE " + REGISTRY_TABLE + " SET rolled_back_at = ? WHERE version = ? AND rolled_back_at IS NULL")) {
            ps.setString(1, Instant.now().toString());
            ps.setInt(2, version);
            if (ps.executeUpdate() == 0) {
                throw new IllegalStateException("Migração " + version + " não encontrada ou já revertida.");
            }
        }
    }

    // ===================== Helpers =====================

    private List<MigrationRecord> query(String sql) {
        try (Connection connection = dataSource.getConnection();
             PreparedStatement ps = connection.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            final List<MigrationRecord> records = new ArrayList<>();
            while (rs.next()) {
                records.add(new MigrationRecord(
                        rs.getInt("version"),
                        rs.getString("name"),
                        parseTimestamp(rs.getString("applied_at")),
                        rs.getString("checksum"),
                        rs.getInt("can_rollback") != 0,
                        parseTimestamp(rs.getString("rolled_back_at")),
                        rs.getLong("execution_time_ms")
                ));
            }
            return records;
        } catch (SQLException e) {
            throw new IllegalStateException("Falha ao consultar " + REGISTRY_TABLE + ": " + e.getMessage(), e);
        }
    }

    private static boolean isRolledBack(Connection connection, int version) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(
                "SELECT rolled_back_at FROM " + REGISTRY_TABLE + " WHERE version = ?")) {
            ps.setInt(1, version);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() && rs.getString(1) != null;
            }
        }
    }

    private static boolean tableExists(Connection connection, String table) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(
                "SELECT 1 FROM sqlite_master WHERE type = 'table' AND name = ?")) {
            ps.setString(1, table);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private static int countRows(Connection connection, String table) throws SQLException {
        try (Statement st = connection.createStatement();
             ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM " + table)) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    /** Aceita ISO-8601 (gravado por nós) e o formato datetime('now') do SQLite (registro legado). */
    static Instant parseTimestamp(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException notIso) {
            try {
                return LocalDateTime.parse(value, SQLITE_DATETIME).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException e) {
                LOGGER.warn("Data ilegível no registro de migrações: '{}'", value);
                return null;
            }
        }
    }
}
