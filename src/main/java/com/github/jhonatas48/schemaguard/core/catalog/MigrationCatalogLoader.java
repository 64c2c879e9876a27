package com.github.jhonatas48.schemaguard.core.catalog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Monta o {@link MigrationCatalog} a partir de recursos do Spring ({@code classpath:} ou {@code file:}).
 *
 * Regras:
 *  - o schema base é a versão {@value #BASE_SCHEMA_VERSION};
 *  - scripts {@code NNN_descricao.sql} viram a versão NNN;
 *  - com manifesto explícito, cada arquivo listado entra mesmo que não exista (catálogo esparso,
 *    o runner pula os ausentes); sem manifesto, o diretório é varrido;
 *  - {@code NNN_descricao.down.sql} ao lado do script é o seu down-script.
 */
public class MigrationCatalogLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(MigrationCatalogLoader.class);

    public static final int BASE_SCHEMA_VERSION = 1;
    public static final String BASE_SCHEMA_NAME = "base_schema";

    private static final Pattern MIGRATION_FILE = Pattern.compile("^(\\d+)_(.+?)\\.sql$");
    private static final String DOWN_SUFFIX = ".down.sql";

    private final ResourcePatternResolver resolver;

    public MigrationCatalogLoader() {
        this(new PathMatchingResourcePatternResolver());
    }

    public MigrationCatalogLoader(ResourcePatternResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver não pode ser nulo");
    }

    /**
     * @param baseSchemaLocation  ex.: {@code classpath:db/schema.sql}; vazio = sem schema base
     * @param migrationsLocation  ex.: {@code classpath:db/migrations}
     * @param manifest            nomes de arquivo em ordem; vazio = varrer o diretório
     */
    public MigrationCatalog load(String baseSchemaLocation, String migrationsLocation, List<String> manifest) {
        final MigrationCatalog.Builder builder = MigrationCatalog.builder();

        if (baseSchemaLocation != null && !baseSchemaLocation.isBlank()) {
            builder.script(BASE_SCHEMA_VERSION, BASE_SCHEMA_NAME,
                    MigrationSource.resource(resolver.getResource(baseSchemaLocation)));
        }

        final List<String> fileNames = (manifest == null || manifest.isEmpty())
                ? scanDirectory(migrationsLocation)
                : manifest;

        for (String fileName : fileNames) {
            final Matcher m = MIGRATION_FILE.matcher(fileName.trim());
            if (!m.matches()) {
                throw new IllegalArgumentException(
                        "Nome de migração fora do padrão NNN_descricao.sql: '" + fileName + "'");
            }
            final int version = Integer.parseInt(m.group(1));
            final String name = m.group(2);

            final Resource script = relative(migrationsLocation, fileName.trim());
            MigrationDefinition definition = MigrationDefinition.script(version, name, MigrationSource.resource(script));

            final Resource down = relative(migrationsLocation, m.group(1) + "_" + name + DOWN_SUFFIX);
            if (down.exists()) {
                definition = definition.withDownScript(MigrationSource.resource(down));
            }
            builder.add(definition);
        }

        final MigrationCatalog catalog = builder.build();
        LOGGER.info("Catálogo de migrações carregado: {} entradas (última versão {}).",
                catalog.size(), catalog.latestVersion());
        return catalog;
    }

    private List<String> scanDirectory(String migrationsLocation) {
        if (migrationsLocation == null || migrationsLocation.isBlank()) {
            return Collections.emptyList();
        }
        try {
            final Resource[] resources = resolver.getResources(stripTrailingSlash(migrationsLocation) + "/*.sql");
            final List<String> names = new ArrayList<>();
            for (Resource resource : resources) {
                final String fileName = resource.getFilename();
                if (fileName == null || fileName.endsWith(DOWN_SUFFIX)) continue;
                if (!MIGRATION_FILE.matcher(fileName).matches()) {
                    LOGGER.warn("Arquivo ignorado (fora do padrão NNN_descricao.sql): {}", fileName);
                    continue;
                }
                names.add(fileName);
            }
            names.sort(Comparator.naturalOrder());
            return names;
        } catch (IOException e) {
            throw new UncheckedIOException("Falha ao varrer migrações em " + migrationsLocation, e);
        }
    }

    private Resource relative(String location, String fileName) {
        return resolver.getResource(stripTrailingSlash(location) + "/" + fileName);
    }

    private static String stripTrailingSlash(String location) {
        return location.endsWith("/") ? location.substring(0, location.length() - 1) : location;
    }
}
