package com.github.jhonatas48.schemaguard.core.runner;

/**
 * Migração abortada: a transação foi desfeita e o schema continua na versão anterior.
 */
public class MigrationException extends IllegalStateException {

    private final int version;
    private final String failedStatement;

    public MigrationException(int version, String failedStatement, Throwable cause) {
        super(buildMessage(version, failedStatement, cause), cause);
        this.version = version;
        this.failedStatement = failedStatement;
    }

    public MigrationException(String message, Throwable cause) {
        super(message, cause);
        this.version = 0;
        this.failedStatement = null;
    }

    public int getVersion() {
        return version;
    }

    /** Instrução que falhou, ou null quando a falha não veio de uma instrução do script. */
    public String getFailedStatement() {
        return failedStatement;
    }

    private static String buildMessage(int version, String failedStatement, Throwable cause) {
        final StringBuilder message = new StringBuilder("Falha na migração ").append(String.format("%03d", version));
        if (failedStatement != null) {
            message.append(" ao executar: ").append(MigrationRunner.abbreviate(failedStatement));
        }
        if (cause != null && cause.getMessage() != null) {
            message.append(" - ").append(cause.getMessage());
        }
        return message.toString();
    }
}
