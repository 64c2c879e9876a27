package com.github.jhonatas48.schemaguard.core.runner;

import com.github.jhonatas48.schemaguard.core.backup.BackupFailedException;
import com.github.jhonatas48.schemaguard.core.backup.BackupResult;
import com.github.jhonatas48.schemaguard.core.backup.BackupStore;
import com.github.jhonatas48.schemaguard.core.catalog.MigrationCatalog;
import com.github.jhonatas48.schemaguard.core.catalog.MigrationDefinition;
import com.github.jhonatas48.schemaguard.core.parser.SqlStatementParser;
import com.github.jhonatas48.schemaguard.core.registry.MigrationChecksums;
import com.github.jhonatas48.schemaguard.core.registry.MigrationRecord;
import com.github.jhonatas48.schemaguard.core.registry.MigrationRegistry;
import com.github.jhonatas48.schemaguard.core.sqlite.SqliteErrors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.*;

/**
 * Leva o schema até a última versão do catálogo.
 *
 * Fluxo de {@link #runMigrations()}:
 *  1) backup pre-migration (falha só gera aviso; o rollback da transação já protege o schema);
 *  2) garante a tabela do registro e importa o registro legado;
 *  3) lê a versão atual;
 *  4) para cada entrada acima dela, em ordem: carrega o script (arquivo ausente é pulado),
 *     executa as instruções numa transação, registra a versão e faz COMMIT;
 *  5) erro "já existe" em ALTER TABLE ... ADD / CREATE é tolerado (reaplicação parcial);
 *     qualquer outro erro faz ROLLBACK e aborta a execução inteira.
 *
 * Roda num único contexto de execução no startup; não é seguro chamar concorrentemente.
 */
public class MigrationRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(MigrationRunner.class);

    private static final int LOG_STATEMENT_LIMIT = 60;

    private final DataSource dataSource;
    private final MigrationRegistry registry;
    private final BackupStore backupStore;
    private final MigrationCatalog catalog;
    private final SqlStatementParser parser;
    private final boolean backupBeforeMigration;

    public MigrationRunner(DataSource dataSource,
                           MigrationRegistry registry,
                           BackupStore backupStore,
                           MigrationCatalog catalog,
                           SqlStatementParser parser,
                           boolean backupBeforeMigration) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource não pode ser nulo");
        this.registry = Objects.requireNonNull(registry, "registry não pode ser nulo");
        this.backupStore = backupStore;
        this.catalog = Objects.requireNonNull(catalog, "catalog não pode ser nulo");
        this.parser = Objects.requireNonNull(parser, "parser não pode ser nulo");
        this.backupBeforeMigration = backupBeforeMigration;
    }

    /**
     * Aplica as migrações pendentes. Sem pendências é só a checagem de versão.
     *
     * @throws MigrationException quando uma migração falha (a transação dela já foi desfeita)
     */
    public void runMigrations() {
        LOGGER.info("Executando migrações do banco...");

        if (backupBeforeMigration && backupStore != null) {
            final BackupResult backup = backupStore.createBackupSync("pre-migration");
            if (!backup.isSuccess()) {
                LOGGER.warn("Backup pre-migration falhou; migrando mesmo assim: {}", backup.getError().orElse("?"));
            }
        }

        try (Connection connection = dataSource.getConnection()) {
            final boolean previousAutoCommit = connection.getAutoCommit();
            connection.setAutoCommit(true);
            try {
                registry.ensureRegistryTable(connection);
                registry.migrateFromOldSchema(connection);

                final int currentVersion = registry.currentVersion(connection);
                LOGGER.info("Versão atual do schema: {}", currentVersion);

                final List<MigrationDefinition> pending = catalog.entriesAfter(currentVersion);
                if (pending.isEmpty()) {
                    LOGGER.info("Schema já está atualizado.");
                    return;
                }

                for (MigrationDefinition definition : pending) {
                    applyMigration(connection, definition);
                }
                LOGGER.info("Todas as migrações concluídas (versão {}).", registry.currentVersion(connection));
            } finally {
                connection.setAutoCommit(previousAutoCommit);
            }
        } catch (SQLException e) {
            LOGGER.error("Migração falhou: {}", e.getMessage());
            throw new MigrationException("Falha ao preparar as migrações: " + e.getMessage(), e);
        }
    }

    /** Estado atual do schema frente ao catálogo. Só leitura: sem tabela de registro, versão 0 e tudo pendente. */
    public MigrationStatus getMigrationStatus() {
        final boolean hasRegistry = registry.registryTableExists();
        final int currentVersion = hasRegistry ? registry.currentVersion() : 0;
        final int appliedCount = hasRegistry ? registry.appliedMigrations().size() : 0;
        final List<String> pending = catalog.entriesAfter(currentVersion).stream()
                .map(MigrationDefinition::describeSource)
                .toList();
        return new MigrationStatus(currentVersion, appliedCount, pending);
    }

    /** Versões aplicadas cujo script no catálogo mudou depois da aplicação. */
    public List<Integer> verifyIntegrity() {
        final Map<Integer, String> scripts = new HashMap<>();
        for (MigrationDefinition definition : catalog.entries()) {
            definition.getScript()
                    .flatMap(source -> source.loadScript())
                    .ifPresent(script -> scripts.put(definition.getVersion(), script));
        }
        return registry.verifyIntegrity(scripts);
    }

    /**
     * Reverte a última migração aplicada, se ela tiver down-script no catálogo.
     * Sempre tira um backup "pre-rollback" antes (falha só gera aviso).
     *
     * @return resultado recusado quando não há o que reverter ou não há down-script
     * @throws MigrationException se o down-script falhar (a transação é desfeita)
     */
    public RollbackResult rollbackLastMigration() {
        if (backupStore != null) {
            try {
                backupStore.createBackup("pre-rollback");
            } catch (BackupFailedException e) {
                LOGGER.warn("Backup pre-rollback falhou: {}", e.getMessage());
            }
        }

        final List<MigrationRecord> applied = registry.appliedMigrations();
        if (applied.isEmpty()) {
            return RollbackResult.refused(0, null, "Nenhuma migração aplicada");
        }
        final MigrationRecord last = applied.get(applied.size() - 1);

        final Optional<String> downScript = catalog.find(last.version())
                .flatMap(MigrationDefinition::getDownScript)
                .flatMap(source -> source.loadScript());
        if (downScript.isEmpty()) {
            LOGGER.warn("Rollback recusado: migração {} ({}) não possui down-script.", last.version(), last.name());
            return RollbackResult.refused(last.version(), last.name(),
                    "Migração " + last.version() + " não suporta rollback (sem down-script)");
        }

        try (Connection connection = dataSource.getConnection()) {
            final boolean previousAutoCommit = connection.getAutoCommit();
            connection.setAutoCommit(false);
            String currentStatement = null;
            try {
                for (String statement : parser.parse(downScript.get())) {
                    currentStatement = statement;
                    execute(connection, statement);
                }
                currentStatement = null;
                registry.markRolledBack(connection, last.version());
                connection.commit();
                LOGGER.info("Migração {} ({}) revertida.", last.version(), last.name());
                return RollbackResult.rolledBack(last.version(), last.name());
            } catch (SQLException | RuntimeException e) {
                safeRollback(connection);
                LOGGER.error("Rollback da migração {} falhou: {}", last.version(), e.getMessage());
                throw new MigrationException(last.version(), currentStatement, e);
            } finally {
                connection.setAutoCommit(previousAutoCommit);
            }
        } catch (SQLException e) {
            throw new MigrationException(last.version(), null, e);
        }
    }

    // ===================== Aplicação =====================

    private void applyMigration(Connection connection, MigrationDefinition definition) throws SQLException {
        final int version = definition.getVersion();

        String script = null;
        if (!definition.isProgrammatic()) {
            final Optional<String> loaded = definition.getScript().flatMap(source -> source.loadScript());
            if (loaded.isEmpty()) {
                LOGGER.warn("Arquivo da migração {} ({}) não encontrado; pulando.", version, definition.describeSource());
                return;
            }
            script = loaded.get();
        }

        LOGGER.info("Aplicando migração {}: {}", String.format("%03d", version), definition.getName());
        final long start = System.currentTimeMillis();

        connection.setAutoCommit(false);
        String currentStatement = null;
        try {
            if (definition.isProgrammatic()) {
                definition.getJdbcMigration().orElseThrow().migrate(connection);
            } else {
                for (String statement : parser.parse(script)) {
                    currentStatement = statement;
                    executeTolerant(connection, statement);
                }
                currentStatement = null;
            }

            registry.recordMigration(connection,
                    version,
                    definition.getName(),
                    MigrationChecksums.of(script),
                    definition.canRollback(),
                    System.currentTimeMillis() - start);

            connection.commit();
            LOGGER.info("Migração {} aplicada com sucesso.", String.format("%03d", version));
        } catch (SQLException | RuntimeException e) {
            safeRollback(connection);
            LOGGER.error("Migração {} falhou; transação desfeita: {}", String.format("%03d", version), e.getMessage());
            throw new MigrationException(version, currentStatement, e);
        } finally {
            connection.setAutoCommit(true);
        }
    }

    /** Executa a instrução; "já existe" em ADD COLUMN/CREATE indica aplicação parcial anterior e é ignorado. */
    private static void executeTolerant(Connection connection, String statement) throws SQLException {
        try {
            execute(connection, statement);
        } catch (SQLException e) {
            if (SqliteErrors.isIgnorableReplayError(statement, e)) {
                LOGGER.warn("Ignorando (já existe): {}", abbreviate(statement));
                return;
            }
            throw e;
        }
    }

    private static void execute(Connection connection, String statement) throws SQLException {
        try (Statement st = connection.createStatement()) {
            st.execute(statement);
        }
    }

    private static void safeRollback(Connection connection) {
        try {
            connection.rollback();
        } catch (SQLException e) {
            LOGGER.warn("Falha ao executar ROLLBACK: {}", e.getMessage());
        }
    }

    static String abbreviate(String statement) {
        final String singleLine = statement.replaceAll("\\s+", " ").trim();
        return singleLine.length() <= LOG_STATEMENT_LIMIT
                ? singleLine
                : singleLine.substring(0, LOG_STATEMENT_LIMIT) + "...";
    }
}
