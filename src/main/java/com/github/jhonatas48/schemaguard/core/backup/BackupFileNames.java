package com.github.jhonatas48.schemaguard.core.backup;

import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Convenção de nomes: {@code <prefixo>-yyyy-MM-dd_HH-mm-ss-SSS-<motivo>.db} (UTC),
 * com irmãos opcionais {@code <nome>-wal} e {@code <nome>-shm}.
 */
final class BackupFileNames {

    static final String EXTENSION = ".db";
    static final String WAL_SUFFIX = "-wal";
    static final String SHM_SUFFIX = "-shm";

    private static final String DEFAULT_REASON = "manual";
    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss-SSS", Locale.ROOT).withZone(ZoneOffset.UTC);

    private final String prefix;
    private final Pattern parser;

    BackupFileNames(String prefix) {
        this.prefix = Objects.requireNonNull(prefix, "prefix não pode ser nulo");
        this.parser = Pattern.compile("^" + Pattern.quote(prefix)
                + "-(\\d{4}-\\d{2}-\\d{2}_\\d{2}-\\d{2}-\\d{2}-\\d{3})-(.+)" + Pattern.quote(EXTENSION) + "$");
    }

    String format(Instant createdAt, String reason) {
        return prefix + "-" + TIMESTAMP.format(createdAt) + "-" + sanitizeReason(reason) + EXTENSION;
    }

    /** Nome completo de arquivo principal de backup (ignora {@code -wal}/{@code -shm} e nomes fora da convenção). */
    boolean isBackupFile(String filename) {
        return parser.matcher(filename).matches();
    }

    Optional<Instant> parseCreatedAt(String filename) {
        final Matcher m = parser.matcher(filename);
        if (!m.matches()) return Optional.empty();
        try {
            return Optional.of(Instant.from(TIMESTAMP.parse(m.group(1))));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    Optional<String> parseReason(String filename) {
        final Matcher m = parser.matcher(filename);
        return m.matches() ? Optional.of(m.group(2)) : Optional.empty();
    }

    static String sanitizeReason(String reason) {
        if (reason == null || reason.isBlank()) return DEFAULT_REASON;
        return reason.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "-");
    }

    static Path walOf(Path file) {
        return file.resolveSibling(file.getFileName().toString() + WAL_SUFFIX);
    }

    static Path shmOf(Path file) {
        return file.resolveSibling(file.getFileName().toString() + SHM_SUFFIX);
    }
}
