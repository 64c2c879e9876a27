package com.github.jhonatas48.schemaguard.core.catalog;

import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

/**
 * Script em arquivo ou no classpath (qualquer {@link Resource} do Spring).
 */
final class ResourceMigrationSource implements MigrationSource {

    private final Resource resource;

    ResourceMigrationSource(Resource resource) {
        this.resource = Objects.requireNonNull(resource, "resource não pode ser nulo");
    }

    @Override
    public Optional<String> loadScript() {
        if (!resource.exists()) {
            return Optional.empty();
        }
        try (InputStream in = resource.getInputStream()) {
            return Optional.of(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Falha ao ler o script " + resource.getDescription(), e);
        }
    }

    @Override
    public String describe() {
        final String filename = resource.getFilename();
        return filename != null ? filename : resource.getDescription();
    }
}
