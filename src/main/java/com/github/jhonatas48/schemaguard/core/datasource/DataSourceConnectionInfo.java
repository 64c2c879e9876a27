package com.github.jhonatas48.schemaguard.core.datasource;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Valor imutável com a URL JDBC e o arquivo físico do banco SQLite (alvo dos backups).
 */
public final class DataSourceConnectionInfo {

    private final String jdbcUrl;
    private final Path databasePath;

    public DataSourceConnectionInfo(String jdbcUrl, Path databasePath) {
        this.jdbcUrl = jdbcUrl;
        this.databasePath = Objects.requireNonNull(databasePath, "databasePath não pode ser nulo");
    }

    /** Pode ser nula quando o caminho do banco foi configurado explicitamente. */
    public String getJdbcUrl() {
        return jdbcUrl;
    }

    public Path getDatabasePath() {
        return databasePath;
    }
}
