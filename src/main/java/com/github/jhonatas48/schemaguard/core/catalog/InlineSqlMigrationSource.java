package com.github.jhonatas48.schemaguard.core.catalog;

import java.util.Objects;
import java.util.Optional;

final class InlineSqlMigrationSource implements MigrationSource {

    private final String sql;

    InlineSqlMigrationSource(String sql) {
        this.sql = Objects.requireNonNull(sql, "sql não pode ser nulo");
    }

    @Override
    public Optional<String> loadScript() {
        return Optional.of(sql);
    }

    @Override
    public String describe() {
        return "inline";
    }
}
