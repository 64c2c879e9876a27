package com.github.jhonatas48.schemaguard.core.catalog;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Migração escrita em Java, executada dentro da transação aberta pelo runner.
 * Não deve fazer commit nem rollback em {@code connection}.
 */
@FunctionalInterface
public interface JdbcMigration {

    void migrate(Connection connection) throws SQLException;
}
