package com.github.jhonatas48.schemaguard.core.sqlite;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.sqlite.SQLiteDataSource;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class SqliteErrorsTest {

    @TempDir
    Path tempDir;

    private SQLiteDataSource dataSource;

    @BeforeEach
    void setup() throws Exception {
        dataSource = new SQLiteDataSource();
        dataSource.setUrl("jdbc:sqlite:" + tempDir.resolve("errors.db"));
        exec("CREATE TABLE books (id TEXT PRIMARY KEY, title TEXT)");
    }

    @Test
    void duplicateColumnOnAddColumnIsIgnorable() {
        String statement = "ALTER TABLE books ADD COLUMN title TEXT";
        SQLException error = failureOf(statement);

        assertThat(SqliteErrors.isAlreadyExists(error)).isTrue();
        assertThat(SqliteErrors.isIgnorableReplayError(statement, error)).isTrue();
    }

    @Test
    void existingTableOnCreateIsIgnorable() {
        String statement = "CREATE TABLE books (id TEXT)";
        SQLException error = failureOf(statement);

        assertThat(SqliteErrors.isIgnorableReplayError(statement, error)).isTrue();
    }

    @Test
    void syntaxErrorIsNotIgnorable() {
        String statement = "CREATE TABLE broken (";
        SQLException error = failureOf(statement);

        assertThat(SqliteErrors.isAlreadyExists(error)).isFalse();
        assertThat(SqliteErrors.isIgnorableReplayError(statement, error)).isFalse();
    }

    @Test
    void alreadyExistsMessageOnOtherStatementKindsIsNotIgnorable() {
        SQLException error = new SQLException("table books already exists", null, 1);

        assertThat(SqliteErrors.isIgnorableReplayError("INSERT INTO books VALUES ('1', 'x')", error)).isFalse();
        assertThat(SqliteErrors.isIgnorableReplayError("create unique index idx on books(title)", error)).isTrue();
    }

    @Test
    void constraintViolationIsDetectedByCode() throws Exception {
        exec("INSERT INTO books VALUES ('1', 'a')");
        SQLException error = failureOf("INSERT INTO books VALUES ('1', 'b')");

        assertThat(SqliteErrors.isConstraintViolation(error)).isTrue();
        assertThat(SqliteErrors.isAlreadyExists(error)).isFalse();
    }

    @Test
    void messageFallbackWhenNoCodeIsExposed() {
        SQLException withoutCode = new SQLException("duplicate column name: title");

        assertThat(SqliteErrors.isAlreadyExists(withoutCode)).isTrue();
    }

    private SQLException failureOf(String sql) {
        return catchThrowableOfType(() -> exec(sql), SQLException.class);
    }

    private void exec(String sql) throws SQLException {
        try (Connection c = dataSource.getConnection(); Statement st = c.createStatement()) {
            st.execute(sql);
        }
    }
}
