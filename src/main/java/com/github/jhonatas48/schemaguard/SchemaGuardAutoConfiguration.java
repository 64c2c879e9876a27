package com.github.jhonatas48.schemaguard;

import com.github.jhonatas48.schemaguard.core.backup.BackupStore;
import com.github.jhonatas48.schemaguard.core.catalog.MigrationCatalog;
import com.github.jhonatas48.schemaguard.core.catalog.MigrationCatalogLoader;
import com.github.jhonatas48.schemaguard.core.datasource.DataSourceConnectionInfoProvider;
import com.github.jhonatas48.schemaguard.core.datasource.SpringDataSourceConnectionInfoProvider;
import com.github.jhonatas48.schemaguard.core.parser.SqlStatementParser;
import com.github.jhonatas48.schemaguard.core.registry.MigrationRegistry;
import com.github.jhonatas48.schemaguard.core.runner.MigrationRunner;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.io.ResourceLoader;
import org.springframework.core.io.support.ResourcePatternUtils;

import javax.sql.DataSource;
import java.nio.file.Path;

/**
 * Auto configuração do Schema Guard.
 * - Todos os componentes recebem o DataSource da aplicação (nada de handle global).
 * - O catálogo vem dos recursos configurados em {@link SchemaGuardProperties}; a aplicação pode
 *   publicar o seu próprio {@link MigrationCatalog} (por exemplo, com migrações programáticas).
 * - O {@link AutoMigrationRunner} migra durante o refresh do contexto.
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(SchemaGuardProperties.class)
public class SchemaGuardAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public DataSourceConnectionInfoProvider dataSourceConnectionInfoProvider(ObjectProvider<DataSourceProperties> dataSourceProperties,
                                                                             DataSource dataSource,
                                                                             SchemaGuardProperties properties) {
        return new SpringDataSourceConnectionInfoProvider(dataSourceProperties.getIfAvailable(), dataSource,
                properties.getDatabasePath());
    }

    @Bean
    @ConditionalOnMissingBean
    public SqlStatementParser sqlStatementParser() {
        return new SqlStatementParser();
    }

    @Bean
    @ConditionalOnMissingBean
    public MigrationRegistry migrationRegistry(DataSource dataSource) {
        return new MigrationRegistry(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean
    public BackupStore backupStore(DataSource dataSource,
                                   DataSourceConnectionInfoProvider connectionInfoProvider,
                                   SchemaGuardProperties properties) {
        return new BackupStore(
                dataSource,
                connectionInfoProvider.resolve().getDatabasePath(),
                Path.of(properties.getBackupDir()),
                properties.getMaxBackups(),
                properties.getFilePrefix()
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public MigrationCatalog migrationCatalog(SchemaGuardProperties properties, ResourceLoader resourceLoader) {
        return new MigrationCatalogLoader(ResourcePatternUtils.getResourcePatternResolver(resourceLoader))
                .load(properties.getBaseSchemaLocation(), properties.getMigrationsLocation(), properties.getManifest());
    }

    @Bean
    @ConditionalOnMissingBean
    public MigrationRunner migrationRunner(DataSource dataSource,
                                           MigrationRegistry migrationRegistry,
                                           BackupStore backupStore,
                                           MigrationCatalog migrationCatalog,
                                           SqlStatementParser sqlStatementParser,
                                           SchemaGuardProperties properties) {
        return new MigrationRunner(dataSource, migrationRegistry, backupStore, migrationCatalog,
                sqlStatementParser, properties.isBackupBeforeMigration());
    }

    @Bean
    @ConditionalOnMissingBean
    public MigrationService migrationService(MigrationRunner migrationRunner, BackupStore backupStore) {
        return new MigrationService(migrationRunner, backupStore);
    }

    @Bean
    public AutoMigrationRunner autoMigrationRunner(SchemaGuardProperties properties,
                                                   MigrationService migrationService) {
        return new AutoMigrationRunner(properties, migrationService);
    }
}
