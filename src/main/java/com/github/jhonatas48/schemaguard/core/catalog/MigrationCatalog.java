package com.github.jhonatas48.schemaguard.core.catalog;

import java.util.*;

/**
 * Manifesto ordenado das migrações por versão. Imutável.
 */
public final class MigrationCatalog {

    private final List<MigrationDefinition> entries;

    private MigrationCatalog(List<MigrationDefinition> entries) {
        this.entries = List.copyOf(entries);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static MigrationCatalog empty() {
        return new MigrationCatalog(List.of());
    }

    /** Todas as entradas, em ordem crescente de versão. */
    public List<MigrationDefinition> entries() {
        return entries;
    }

    /** Entradas com versão maior que {@code version}, em ordem crescente. */
    public List<MigrationDefinition> entriesAfter(int version) {
        final List<MigrationDefinition> pending = new ArrayList<>();
        for (MigrationDefinition entry : entries) {
            if (entry.getVersion() > version) pending.add(entry);
        }
        return pending;
    }

    public Optional<MigrationDefinition> find(int version) {
        return entries.stream().filter(e -> e.getVersion() == version).findFirst();
    }

    public int latestVersion() {
        return entries.isEmpty() ? 0 : entries.get(entries.size() - 1).getVersion();
    }

    public int size() {
        return entries.size();
    }

    public static final class Builder {

        private final Map<Integer, MigrationDefinition> byVersion = new TreeMap<>();

        private Builder() {
        }

        public Builder add(MigrationDefinition definition) {
            Objects.requireNonNull(definition, "definition não pode ser nulo");
            final MigrationDefinition previous = byVersion.putIfAbsent(definition.getVersion(), definition);
            if (previous != null) {
                throw new IllegalArgumentException("Versão duplicada no catálogo: " + definition.getVersion()
                        + " (" + previous + " e " + definition + ")");
            }
            return this;
        }

        public Builder script(int version, String name, MigrationSource source) {
            return add(MigrationDefinition.script(version, name, source));
        }

        public Builder programmatic(int version, String name, JdbcMigration migration) {
            return add(MigrationDefinition.programmatic(version, name, migration));
        }

        public MigrationCatalog build() {
            return new MigrationCatalog(new ArrayList<>(byVersion.values()));
        }
    }
}
