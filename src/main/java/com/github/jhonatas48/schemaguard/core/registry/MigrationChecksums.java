package com.github.jhonatas48.schemaguard.core.registry;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Formatter;

/**
 * Checksums gravados junto de cada migração, usados para detectar scripts alterados depois de aplicados.
 */
public final class MigrationChecksums {

    /** Marcador das linhas importadas do registro legado. */
    public static final String LEGACY = "legacy";
    /** Marcador de migrações programáticas (sem script). */
    public static final String INLINE = "inline";

    private static final int CHECKSUM_LENGTH = 16;

    private MigrationChecksums() {}

    public static String of(String script) {
        if (script == null) return INLINE;
        return sha256Hex(script.trim()).substring(0, CHECKSUM_LENGTH);
    }

    static String sha256Hex(String input) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] dig = md.digest(input.getBytes(StandardCharsets.UTF_8));
            try (Formatter f = new Formatter()) {
                for (byte b : dig) {
                    f.format("%02x", b);
                }
                return f.toString();
            }
        } catch (Exception e) {
            throw new IllegalStateException("Erro ao calcular SHA-256", e);
        }
    }
}
