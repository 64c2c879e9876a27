package com.github.jhonatas48.schemaguard.core.catalog;

import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Origem do script SQL de uma migração.
 */
public interface MigrationSource {

    /**
     * @return conteúdo do script, ou vazio quando o arquivo externo não existe
     * @throws java.io.UncheckedIOException quando o arquivo existe mas não pode ser lido
     */
    Optional<String> loadScript();

    /** Nome curto para logs e status (nome do arquivo, ou "inline"). */
    String describe();

    static MigrationSource inline(String sql) {
        return new InlineSqlMigrationSource(sql);
    }

    static MigrationSource resource(Resource resource) {
        return new ResourceMigrationSource(resource);
    }

    static MigrationSource file(Path path) {
        return new ResourceMigrationSource(new FileSystemResource(path));
    }
}
