package com.github.jhonatas48.schemaguard.core.backup;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.nio.file.attribute.BasicFileAttributes;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.stream.Stream;

/**
 * Backups do arquivo SQLite e dos seus arquivos auxiliares (WAL/SHM).
 *
 * Dois caminhos de criação:
 *  - {@link #createBackup(String)}: usa {@code VACUUM INTO} numa conexão do DataSource, snapshot consistente
 *    mesmo com leitores/escritores concorrentes e em modo WAL; falha com {@link BackupFailedException};
 *  - {@link #createBackupSync(String)}: cópia direta dos arquivos, para o início do processo antes de existir pool.
 *    Não é seguro contra escritores concorrentes e nunca lança exceção.
 *
 * Restauração e remoção tratam o arquivo principal e os irmãos {@code -wal}/{@code -shm} como uma unidade.
 */
public class BackupStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(BackupStore.class);

    /** Cabeçalho fixo de todo arquivo SQLite 3. */
    private static final byte[] SQLITE_HEADER = "SQLite format 3\0".getBytes(StandardCharsets.US_ASCII);

    private static final String RESTORE_STAGING_SUFFIX = ".restoring";
    private static final String RESTORE_SET_ASIDE_SUFFIX = ".pre-restore";

    private final DataSource dataSource;
    private final Path databasePath;
    private final Path backupDirectory;
    private final int maxBackups;
    private final BackupFileNames fileNames;
    private final Clock clock;

    public BackupStore(DataSource dataSource,
                       Path databasePath,
                       Path backupDirectory,
                       int maxBackups,
                       String filePrefix) {
        this(dataSource, databasePath, backupDirectory, maxBackups, filePrefix, Clock.systemUTC());
    }

    public BackupStore(DataSource dataSource,
                       Path databasePath,
                       Path backupDirectory,
                       int maxBackups,
                       String filePrefix,
                       Clock clock) {
        if (maxBackups < 1) {
            throw new IllegalArgumentException("maxBackups deve ser >= 1: " + maxBackups);
        }
        this.dataSource = dataSource;
        this.databasePath = Objects.requireNonNull(databasePath, "databasePath não pode ser nulo");
        this.backupDirectory = Objects.requireNonNull(backupDirectory, "backupDirectory não pode ser nulo");
        this.maxBackups = maxBackups;
        this.fileNames = new BackupFileNames(filePrefix);
        this.clock = Objects.requireNonNull(clock, "clock não pode ser nulo");
    }

    public Path getBackupDirectory() {
        return backupDirectory;
    }

    public Path getDatabasePath() {
        return databasePath;
    }

    // ===================== Criação =====================

    /**
     * Snapshot consistente via {@code VACUUM INTO}. Aplica a retenção depois do sucesso.
     *
     * @return caminho do backup criado
     * @throws BackupFailedException em qualquer erro de I/O ou do SQLite
     */
    public Path createBackup(String reason) {
        return createBackup(reason, null);
    }

    /** {@code protectedPath}, quando informado, nunca é removido pela retenção desta chamada. */
    private Path createBackup(String reason, Path protectedPath) {
        final long start = clock.millis();
        if (dataSource == null) {
            throw new BackupFailedException("Backup falhou: nenhum DataSource configurado para o snapshot consistente", null);
        }
        try {
            ensureBackupDirectory();
            final Path backupPath = nextBackupPath(reason);

            try (Connection connection = dataSource.getConnection();
                 Statement st = connection.createStatement()) {
                st.execute("VACUUM INTO " + sqlLiteral(backupPath.toAbsolutePath().toString()));
            }

            final long sizeBytes = Files.size(backupPath);
            LOGGER.info("Backup criado: path={}, reason={}, {} bytes, {} ms",
                    backupPath, reason, sizeBytes, clock.millis() - start);

            applyRetention(maxBackups, protectedPath);
            return backupPath;
        } catch (SQLException | IOException e) {
            LOGGER.error("Falha ao criar backup (reason={}): {}", reason, e.getMessage());
            throw new BackupFailedException("Backup falhou: " + e.getMessage(), e);
        }
    }

    /**
     * Cópia direta do arquivo principal e, se existirem, de {@code -wal} e {@code -shm}.
     * Pré-condição (não verificada): nenhum pool de conexões aberto sobre o banco.
     */
    public BackupResult createBackupSync(String reason) {
        final long start = clock.millis();

        if (!Files.exists(databasePath)) {
            LOGGER.info("Banco {} ainda não existe; nada para copiar.", databasePath);
            return BackupResult.nothingToBackUp(clock.millis() - start);
        }

        Path backupPath = null;
        try {
            ensureBackupDirectory();
            backupPath = nextBackupPath(reason);

            Files.copy(databasePath, backupPath);
            copyIfExists(BackupFileNames.walOf(databasePath), BackupFileNames.walOf(backupPath));
            copyIfExists(BackupFileNames.shmOf(databasePath), BackupFileNames.shmOf(backupPath));

            final long sizeBytes = Files.size(backupPath);
            final long durationMs = clock.millis() - start;
            LOGGER.info("Backup (síncrono) criado: path={}, reason={}, {} bytes, {} ms",
                    backupPath, reason, sizeBytes, durationMs);

            cleanOldBackups(maxBackups);
            return BackupResult.created(backupPath, durationMs, sizeBytes);
        } catch (IOException | RuntimeException e) {
            LOGGER.error("Backup síncrono falhou (reason={}): {}", reason, e.getMessage());
            if (backupPath != null) {
                deleteQuietly(backupPath);
            }
            return BackupResult.failed(e.getMessage(), clock.millis() - start);
        }
    }

    // ===================== Restauração =====================

    /**
     * Sobrescreve o banco atual com o backup informado.
     * Antes: backup "pre-restore" (falha só gera aviso) e checkpoint do WAL.
     * Sem {@code -wal}/{@code -shm} no backup, os irmãos atuais do banco são apagados para o SQLite
     * não reaplicar um log de outro arquivo.
     * Os arquivos atuais só são apagados depois que o principal do backup está no lugar; se algum passo
     * falhar, eles voltam ao caminho original. O backup informado nunca entra na retenção do pre-restore.
     *
     * @throws RestoreFailedException sempre que a restauração não se completar
     */
    public void restoreFromBackup(Path backupPath) {
        Objects.requireNonNull(backupPath, "backupPath não pode ser nulo");
        if (!Files.isRegularFile(backupPath)) {
            throw new RestoreFailedException("Backup não encontrado: " + backupPath);
        }

        if (Files.exists(databasePath)) {
            try {
                createBackup("pre-restore", backupPath);
            } catch (BackupFailedException e) {
                LOGGER.warn("Não foi possível criar o backup pre-restore; seguindo com a restauração: {}", e.getMessage());
            }
        }

        checkpointWal();

        final Path liveWal = BackupFileNames.walOf(databasePath);
        final Path liveShm = BackupFileNames.shmOf(databasePath);
        final Path backupWal = BackupFileNames.walOf(backupPath);
        final Path backupShm = BackupFileNames.shmOf(backupPath);
        final Path stagedMain = staged(databasePath);
        final Path stagedWal = staged(liveWal);
        final Path stagedShm = staged(liveShm);

        // arquivos atuais postos de lado, na ordem em que foram movidos
        final List<Path> setAside = new ArrayList<>();
        // arquivos do backup já colocados no lugar dos atuais
        final List<Path> placed = new ArrayList<>();

        try {
            // 1) copia tudo para arquivos temporários ao lado do banco; falha aqui não toca o banco atual
            Files.copy(backupPath, stagedMain, StandardCopyOption.REPLACE_EXISTING);
            if (Files.exists(backupWal)) Files.copy(backupWal, stagedWal, StandardCopyOption.REPLACE_EXISTING);
            if (Files.exists(backupShm)) Files.copy(backupShm, stagedShm, StandardCopyOption.REPLACE_EXISTING);

            // 2) tira os atuais do caminho sem apagar nada: irmãos primeiro, principal por último
            for (Path live : List.of(liveWal, liveShm, databasePath)) {
                if (Files.exists(live)) {
                    moveReplacing(live, setAsidePath(live));
                    setAside.add(live);
                }
            }

            // 3) coloca os irmãos do backup e, por último, o arquivo principal
            if (Files.exists(stagedWal)) {
                moveReplacing(stagedWal, liveWal);
                placed.add(liveWal);
            }
            if (Files.exists(stagedShm)) {
                moveReplacing(stagedShm, liveShm);
                placed.add(liveShm);
            }
            moveReplacing(stagedMain, databasePath);
            placed.add(databasePath);
        } catch (IOException e) {
            LOGGER.error("Restauração de {} falhou: {}", backupPath, e.getMessage());
            undoRestore(placed, setAside);
            deleteQuietly(stagedMain);
            deleteQuietly(stagedWal);
            deleteQuietly(stagedShm);
            throw new RestoreFailedException("Falha ao restaurar " + backupPath + ": " + e.getMessage(), e);
        }

        // 4) só agora os atuais antigos somem; irmãos sem par no backup vão junto
        for (Path live : setAside) {
            deleteQuietly(setAsidePath(live));
        }

        LOGGER.info("Banco {} restaurado a partir de {}", databasePath, backupPath);
    }

    // ===================== Consulta e retenção =====================

    /** Backups do diretório, do mais novo para o mais antigo. */
    public List<BackupSnapshot> listBackups() {
        if (!Files.isDirectory(backupDirectory)) {
            return Collections.emptyList();
        }
        try (Stream<Path> files = Files.list(backupDirectory)) {
            final List<BackupSnapshot> backups = new ArrayList<>();
            for (Path file : (Iterable<Path>) files::iterator) {
                final String filename = file.getFileName().toString();
                if (!Files.isRegularFile(file) || !fileNames.isBackupFile(filename)) continue;
                backups.add(toSnapshot(file, filename));
            }
            backups.sort(Comparator.comparing(BackupSnapshot::createdAt)
                    .thenComparing(BackupSnapshot::filename)
                    .reversed());
            return backups;
        } catch (IOException | UncheckedIOException e) {
            LOGGER.error("Falha ao listar backups em {}: {}", backupDirectory, e.getMessage());
            return Collections.emptyList();
        }
    }

    public Optional<BackupSnapshot> getLatestBackup() {
        final List<BackupSnapshot> backups = listBackups();
        return backups.isEmpty() ? Optional.empty() : Optional.of(backups.get(0));
    }

    public BackupStats getStats() {
        final List<BackupSnapshot> backups = listBackups();
        final long totalSize = backups.stream().mapToLong(BackupSnapshot::sizeBytes).sum();
        return new BackupStats(
                backups.size(),
                totalSize,
                backups.isEmpty() ? null : backups.get(backups.size() - 1).createdAt(),
                backups.isEmpty() ? null : backups.get(0).createdAt()
        );
    }

    /** Mantém os {@code keep} backups mais novos e apaga o resto (com {@code -wal}/{@code -shm}). */
    public void cleanOldBackups(int keep) {
        applyRetention(keep, null);
    }

    private void applyRetention(int keep, Path protectedPath) {
        final List<BackupSnapshot> backups = listBackups();
        if (backups.size() <= keep) {
            return;
        }

        final List<BackupSnapshot> toDelete = backups.subList(Math.max(keep, 0), backups.size());
        int deleted = 0;
        for (BackupSnapshot backup : toDelete) {
            if (isSameFile(backup.path(), protectedPath)) {
                LOGGER.info("Backup {} em restauração; mantido fora da retenção.", backup.filename());
                continue;
            }
            try {
                deleteSnapshotFiles(backup.path());
                deleted++;
                LOGGER.info("Backup antigo removido: {}", backup.filename());
            } catch (IOException e) {
                LOGGER.error("Falha ao remover backup {}: {}", backup.path(), e.getMessage());
            }
        }
        LOGGER.info("Retenção aplicada: {} removidos, {} mantidos.", deleted, backups.size() - deleted);
    }

    /**
     * Remove um backup e seus irmãos.
     * @return false se o backup não existia
     */
    public boolean deleteBackup(Path backupPath) {
        Objects.requireNonNull(backupPath, "backupPath não pode ser nulo");
        if (!Files.exists(backupPath)) {
            return false;
        }
        try {
            deleteSnapshotFiles(backupPath);
            LOGGER.info("Backup removido: {}", backupPath);
            return true;
        } catch (IOException e) {
            throw new UncheckedIOException("Falha ao remover backup " + backupPath, e);
        }
    }

    /** Confere o cabeçalho de 16 bytes do SQLite. Nunca lança exceção. */
    public boolean verifyBackup(Path backupPath) {
        if (backupPath == null || !Files.isRegularFile(backupPath)) {
            return false;
        }
        try (InputStream in = Files.newInputStream(backupPath)) {
            final byte[] header = in.readNBytes(SQLITE_HEADER.length);
            return Arrays.equals(header, SQLITE_HEADER);
        } catch (IOException e) {
            LOGGER.warn("Não foi possível ler o cabeçalho de {}: {}", backupPath, e.getMessage());
            return false;
        }
    }

    // ===================== Helpers =====================

    private void ensureBackupDirectory() throws IOException {
        if (!Files.isDirectory(backupDirectory)) {
            Files.createDirectories(backupDirectory);
            LOGGER.info("Diretório de backups criado: {}", backupDirectory);
        }
    }

    /** Nome livre no diretório; em colisão avança o timestamp em 1 ms. */
    private Path nextBackupPath(String reason) {
        Instant timestamp = clock.instant();
        Path candidate = backupDirectory.resolve(fileNames.format(timestamp, reason));
        while (Files.exists(candidate)) {
            timestamp = timestamp.plusMillis(1);
            candidate = backupDirectory.resolve(fileNames.format(timestamp, reason));
        }
        return candidate;
    }

    private BackupSnapshot toSnapshot(Path file, String filename) {
        try {
            final BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class);
            final Instant createdAt = fileNames.parseCreatedAt(filename)
                    .orElseGet(() -> attributes.creationTime().toInstant());
            final String reason = fileNames.parseReason(filename).orElse(null);
            return new BackupSnapshot(filename, file, attributes.size(), createdAt, reason);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void checkpointWal() {
        if (dataSource == null) {
            return;
        }
        try (Connection connection = dataSource.getConnection();
             Statement st = connection.createStatement()) {
            st.execute("PRAGMA wal_checkpoint(TRUNCATE)");
        } catch (SQLException e) {
            LOGGER.warn("Checkpoint do WAL antes da restauração falhou: {}", e.getMessage());
        }
    }

    private static void deleteSnapshotFiles(Path backupPath) throws IOException {
        Files.deleteIfExists(backupPath);
        Files.deleteIfExists(BackupFileNames.walOf(backupPath));
        Files.deleteIfExists(BackupFileNames.shmOf(backupPath));
    }

    private static void copyIfExists(Path source, Path target) throws IOException {
        if (Files.exists(source)) {
            Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void moveReplacing(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
            Files.deleteIfExists(BackupFileNames.walOf(file));
            Files.deleteIfExists(BackupFileNames.shmOf(file));
        } catch (IOException e) {
            LOGGER.warn("Não foi possível remover o arquivo parcial {}: {}", file, e.getMessage());
        }
    }

    /** Desfaz os passos 2 e 3 da restauração: devolve os arquivos atuais ao lugar original. */
    private static void undoRestore(List<Path> placed, List<Path> setAside) {
        for (Path target : placed) {
            try {
                Files.deleteIfExists(target);
            } catch (IOException e) {
                LOGGER.error("Não foi possível remover {} ao desfazer a restauração: {}", target, e.getMessage());
            }
        }
        for (int i = setAside.size() - 1; i >= 0; i--) {
            final Path live = setAside.get(i);
            try {
                moveReplacing(setAsidePath(live), live);
            } catch (IOException e) {
                LOGGER.error("Não foi possível devolver {} (cópia em {}): {}", live, setAsidePath(live), e.getMessage());
            }
        }
    }

    private static boolean isSameFile(Path a, Path b) {
        if (a == null || b == null) return false;
        return a.toAbsolutePath().normalize().equals(b.toAbsolutePath().normalize());
    }

    private static Path setAsidePath(Path file) {
        return file.resolveSibling(file.getFileName().toString() + RESTORE_SET_ASIDE_SUFFIX);
    }

    private static Path staged(Path file) {
        return file.resolveSibling(file.getFileName().toString() + RESTORE_STAGING_SUFFIX);
    }

    private static String sqlLiteral(String value) {
        return "'" + value.replace("'", "''") + "'";
    }
}
