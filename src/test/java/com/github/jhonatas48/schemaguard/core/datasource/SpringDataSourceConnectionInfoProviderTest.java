package com.github.jhonatas48.schemaguard.core.datasource;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.mock.env.MockEnvironment;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class SpringDataSourceConnectionInfoProviderTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldResolveDatabaseFileFromSpringEnvironment() {
        // Arrange (MockEnvironment convertido em DataSourceProperties, como no Boot)
        MockEnvironment env = new MockEnvironment()
                .withProperty("spring.datasource.url", "jdbc:sqlite:./target/testdb.sqlite");

        DataSourceProperties props = new DataSourceProperties();
        props.setUrl(env.getProperty("spring.datasource.url"));

        SpringDataSourceConnectionInfoProvider provider =
                new SpringDataSourceConnectionInfoProvider(props, null, "");

        // Act
        DataSourceConnectionInfo info = provider.resolve();

        // Assert
        assertThat(info.getJdbcUrl()).isEqualTo("jdbc:sqlite:./target/testdb.sqlite");
        assertThat(info.getDatabasePath()).isEqualTo(Path.of("./target/testdb.sqlite"));
    }

    @Test
    void explicitDatabasePathWins() {
        DataSourceProperties props = new DataSourceProperties();
        props.setUrl("jdbc:sqlite:other.db");

        SpringDataSourceConnectionInfoProvider provider =
                new SpringDataSourceConnectionInfoProvider(props, null, " data/app.db ");

        assertThat(provider.resolve().getDatabasePath()).isEqualTo(Path.of("data/app.db"));
    }

    @Test
    void shouldFallBackToDataSourceMetadata() {
        Path file = tempDir.resolve("meta.db");
        SQLiteDataSource dataSource = new SQLiteDataSource();
        dataSource.setUrl("jdbc:sqlite:" + file);

        SpringDataSourceConnectionInfoProvider provider =
                new SpringDataSourceConnectionInfoProvider(new DataSourceProperties(), dataSource, null);

        assertThat(provider.resolve().getDatabasePath()).isEqualTo(file);
    }

    @Test
    void shouldThrowWhenUrlIsMissing() {
        // Arrange: sem URL nas propriedades e sem DataSource (força a exceção)
        DataSourceProperties props = new DataSourceProperties();
        DataSource dataSource = null;

        SpringDataSourceConnectionInfoProvider provider =
                new SpringDataSourceConnectionInfoProvider(props, dataSource, null);

        // Act + Assert
        assertThatThrownBy(provider::resolve)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("spring.datasource.url");
    }

    @Test
    void parsesFileUrlsWithQueryString() {
        assertThat(SpringDataSourceConnectionInfoProvider.databaseFileFromUrl("jdbc:sqlite:file:data/app.db?cache=shared"))
                .isEqualTo(Path.of("data/app.db"));
    }

    @Test
    void rejectsInMemoryAndNonSqliteUrls() {
        assertThatThrownBy(() -> SpringDataSourceConnectionInfoProvider.databaseFileFromUrl("jdbc:sqlite::memory:"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("memória");
        assertThatThrownBy(() -> SpringDataSourceConnectionInfoProvider.databaseFileFromUrl("jdbc:sqlite:file:mem?mode=memory"))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> SpringDataSourceConnectionInfoProvider.databaseFileFromUrl("jdbc:h2:mem:test"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("SQLite");
    }
}
