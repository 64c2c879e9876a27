package com.github.jhonatas48.schemaguard.core.sqlite;

import org.sqlite.SQLiteErrorCode;

import java.sql.SQLException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Classificação de erros do SQLite pelo código estruturado do driver (sqlite-jdbc),
 * com fallback para a mensagem só quando o código não distingue o caso.
 */
public final class SqliteErrors {

    private static final Pattern ADD_COLUMN =
            Pattern.compile("^ALTER\\s+TABLE\\s+.+?\\s+ADD\\s+", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern CREATE_OBJECT =
            Pattern.compile("^CREATE\\s+(?:UNIQUE\\s+|TEMP\\s+|TEMPORARY\\s+|VIRTUAL\\s+)?(?:TABLE|INDEX|TRIGGER|VIEW)\\b",
                    Pattern.CASE_INSENSITIVE);

    private SqliteErrors() {}

    /** Código primário (os 8 bits baixos do código estendido que o driver coloca em getErrorCode). */
    public static int primaryCode(SQLException exception) {
        return exception.getErrorCode() & 0xFF;
    }

    public static boolean isConstraintViolation(SQLException exception) {
        return primaryCode(exception) == SQLiteErrorCode.SQLITE_CONSTRAINT.code;
    }

    /**
     * "Objeto/coluna já existe": o SQLite reporta como SQLITE_ERROR genérico, então o código
     * só filtra a classe e a mensagem decide. Se o driver não expôs código algum, vale a mensagem.
     */
    public static boolean isAlreadyExists(SQLException exception) {
        final int code = primaryCode(exception);
        if (code != 0 && code != SQLiteErrorCode.SQLITE_ERROR.code) {
            return false;
        }
        final String message = exception.getMessage() == null
                ? ""
                : exception.getMessage().toLowerCase(Locale.ROOT);
        return message.contains("already exists") || message.contains("duplicate column");
    }

    /** ALTER TABLE ... ADD [COLUMN] ou CREATE TABLE/INDEX/TRIGGER/VIEW. */
    public static boolean isIdempotentReplayCandidate(String statement) {
        if (statement == null) return false;
        final String trimmed = statement.trim();
        return ADD_COLUMN.matcher(trimmed).find() || CREATE_OBJECT.matcher(trimmed).find();
    }

    /** Erro tolerável durante reaplicação parcial de uma migração. */
    public static boolean isIgnorableReplayError(String statement, SQLException exception) {
        return isIdempotentReplayCandidate(statement) && isAlreadyExists(exception);
    }
}
