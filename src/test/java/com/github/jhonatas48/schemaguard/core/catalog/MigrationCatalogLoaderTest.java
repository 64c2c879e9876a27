package com.github.jhonatas48.schemaguard.core.catalog;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class MigrationCatalogLoaderTest {

    private static final String BASE = "classpath:db/catalog/schema.sql";
    private static final String MIGRATIONS = "classpath:db/catalog/migrations";

    private final MigrationCatalogLoader loader = new MigrationCatalogLoader();

    @Test
    void scansDirectoryAndOrdersByVersion() {
        MigrationCatalog catalog = loader.load(BASE, MIGRATIONS, List.of());

        assertThat(catalog.entries()).extracting(MigrationDefinition::getVersion).containsExactly(1, 2, 4);
        assertThat(catalog.entries()).extracting(MigrationDefinition::getName)
                .containsExactly(MigrationCatalogLoader.BASE_SCHEMA_NAME, "book_summary", "book_audit");
        assertThat(catalog.latestVersion()).isEqualTo(4);
    }

    @Test
    void downScriptIsAttachedToItsMigration() {
        MigrationCatalog catalog = loader.load(BASE, MIGRATIONS, List.of());

        assertThat(catalog.find(4).orElseThrow().canRollback()).isTrue();
        assertThat(catalog.find(2).orElseThrow().canRollback()).isFalse();
        assertThat(catalog.find(4).orElseThrow().getDownScript().orElseThrow().loadScript().orElseThrow())
                .contains("DROP TABLE IF EXISTS book_audit");
    }

    @Test
    void manifestKeepsMissingFilesAsSparseEntries() {
        MigrationCatalog catalog = loader.load(BASE, MIGRATIONS,
                List.of("002_book_summary.sql", "003_removed_feature.sql", "004_book_audit.sql"));

        assertThat(catalog.entries()).extracting(MigrationDefinition::getVersion).containsExactly(1, 2, 3, 4);
        MigrationDefinition missing = catalog.find(3).orElseThrow();
        assertThat(missing.getScript().orElseThrow().loadScript()).isEmpty();
        assertThat(missing.describeSource()).isEqualTo("003_removed_feature.sql");
    }

    @Test
    void rejectsManifestEntryOutsideNamingConvention() {
        assertThatThrownBy(() -> loader.load(BASE, MIGRATIONS, List.of("seed.sql")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("seed.sql");
    }

    @Test
    void loadsFromFileSystemDirectory(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("010_first.sql"), "CREATE TABLE a (id INT);");
        Files.writeString(dir.resolve("012_second.sql"), "CREATE TABLE b (id INT);");

        MigrationCatalog catalog = loader.load("", dir.toUri().toString(), List.of());

        assertThat(catalog.entries()).extracting(MigrationDefinition::toString)
                .containsExactly("010_first", "012_second");
        assertThat(catalog.entriesAfter(10)).extracting(MigrationDefinition::getVersion).containsExactly(12);
    }

    @Test
    void builderRejectsDuplicateVersions() {
        MigrationCatalog.Builder builder = MigrationCatalog.builder()
                .script(2, "a", MigrationSource.inline("SELECT 1;"));

        assertThatThrownBy(() -> builder.script(2, "b", MigrationSource.inline("SELECT 2;")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Versão duplicada");
    }

    @Test
    void builderSortsEntriesAndMixesSources() {
        MigrationCatalog catalog = MigrationCatalog.builder()
                .programmatic(3, "backfill", connection -> { })
                .script(1, "base", MigrationSource.inline("CREATE TABLE t (id INT);"))
                .build();

        assertThat(catalog.entries()).extracting(MigrationDefinition::getVersion).containsExactly(1, 3);
        assertThat(catalog.find(3).orElseThrow().isProgrammatic()).isTrue();
        assertThat(catalog.find(1).orElseThrow().describeSource()).isEqualTo("inline");
        assertThat(catalog.entriesAfter(3)).isEmpty();
    }
}
