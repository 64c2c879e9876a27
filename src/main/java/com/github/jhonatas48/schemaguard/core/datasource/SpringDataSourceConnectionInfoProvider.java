package com.github.jhonatas48.schemaguard.core.datasource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;

/**
 * Resolve o arquivo do banco a partir do contexto Spring.
 * Regra:
 *   1) {@code schemaguard.database-path}, se configurado;
 *   2) {@code spring.datasource.url} ({@code jdbc:sqlite:<arquivo>});
 *   3) DataSource#getConnection().getMetaData().getURL();
 *   4) se nada der certo (ou o banco for em memória), IllegalStateException com mensagem clara.
 */
public class SpringDataSourceConnectionInfoProvider implements DataSourceConnectionInfoProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(SpringDataSourceConnectionInfoProvider.class);

    private static final String SQLITE_URL_PREFIX = "jdbc:sqlite:";

    private final DataSourceProperties dataSourceProperties;
    private final DataSource dataSource;
    private final String explicitDatabasePath;

    public SpringDataSourceConnectionInfoProvider(DataSourceProperties dataSourceProperties,
                                                  DataSource dataSource,
                                                  String explicitDatabasePath) {
        this.dataSourceProperties = dataSourceProperties;
        this.dataSource = dataSource;
        this.explicitDatabasePath = explicitDatabasePath;
    }

    @Override
    public DataSourceConnectionInfo resolve() {
        String jdbcUrl = (dataSourceProperties != null) ? dataSourceProperties.getUrl() : null;

        if (explicitDatabasePath != null && !explicitDatabasePath.isBlank()) {
            return new DataSourceConnectionInfo(jdbcUrl, Path.of(explicitDatabasePath.trim()));
        }

        if (jdbcUrl == null || jdbcUrl.isBlank()) {
            jdbcUrl = tryResolveUrlFromDataSource();
        }

        if (jdbcUrl == null || jdbcUrl.isBlank()) {
            throw new IllegalStateException(
                    "Schema Guard: não foi possível determinar o arquivo do banco. " +
                            "Defina 'schemaguard.database-path' ou 'spring.datasource.url' (jdbc:sqlite:<arquivo>)."
            );
        }

        return new DataSourceConnectionInfo(jdbcUrl, databaseFileFromUrl(jdbcUrl));
    }

    /** Extrai o arquivo de {@code jdbc:sqlite:[file:]<caminho>[?params]}. */
    static Path databaseFileFromUrl(String jdbcUrl) {
        if (!jdbcUrl.startsWith(SQLITE_URL_PREFIX)) {
            throw new IllegalStateException("Schema Guard só suporta SQLite; URL recebida: " + jdbcUrl);
        }
        String location = jdbcUrl.substring(SQLITE_URL_PREFIX.length());
        if (location.startsWith("file:")) {
            location = location.substring("file:".length());
        }
        final int query = location.indexOf('?');
        if (query >= 0) {
            location = location.substring(0, query);
        }
        if (location.isBlank() || location.contains(":memory:") || jdbcUrl.contains("mode=memory")) {
            throw new IllegalStateException(
                    "Schema Guard: banco em memória não tem arquivo para backup (" + jdbcUrl + ").");
        }
        return Path.of(location);
    }

    private String tryResolveUrlFromDataSource() {
        if (dataSource == null) return null;
        try (Connection connection = dataSource.getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            return (metaData != null) ? metaData.getURL() : null;
        } catch (SQLException e) {
            LOGGER.warn("Não foi possível obter a URL pelo metadata do DataSource: {}", e.getMessage());
            return null;
        }
    }
}
