package com.paxkun.magpie.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Tagged run log shared by every stage of a run. Lines go to the console and to
 * {@code <archiveRoot>/logs/latest.log}; the previous latest log is rotated on startup.
 * <p>
 * Also owns resolution of the archive root, the directory under which every
 * book root lives.
 */
@Slf4j
@Service
public class LoggerService implements InitializingBean, DisposableBean {

    private static final String LATEST_LOG = "latest.log";
    private static final int MAX_LOGS = 5;
    private static final DateTimeFormatter FILE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss");
    private static final DateTimeFormatter LOG_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final Path CONTAINER_FALLBACK = Path.of("/app", "archive");

    @Value("${magpie.archive-root:}")
    private String configuredArchiveRoot;

    private Path archiveRoot;
    private Path logsPath;
    private BufferedWriter writer;

    @Override
    public void afterPropertiesSet() {
        archiveRoot = initializeArchiveRoot();

        if (archiveRoot == null) {
            log.warn("No archive root could be created; the run log goes to the console only");
            return;
        }

        logsPath = archiveRoot.resolve("logs");
        try {
            Files.createDirectories(logsPath);
        } catch (IOException e) {
            log.warn("Cannot create {}; the run log goes to the console only", logsPath.toAbsolutePath(), e);
            logsPath = null;
            return;
        }

        try {
            rotateLogs();
        } catch (IOException e) {
            log.warn("Run log rotation under {} failed; older logs are left as they are", logsPath.toAbsolutePath(), e);
        }

        Path latestLogPath = logsPath.resolve(LATEST_LOG);
        try {
            writer = Files.newBufferedWriter(latestLogPath, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            write("SYSTEM", "ARCHIVE_ROOT", archiveRoot.toAbsolutePath().toString());
            write("SYSTEM", "OS", System.getProperty("os.name") + " " + System.getProperty("os.version"));
            log.info("Run log: {}", latestLogPath.toAbsolutePath());
        } catch (IOException e) {
            log.warn("Cannot open run log {}; the run log goes to the console only", latestLogPath.toAbsolutePath(), e);
            writer = null;
        }
    }

    @Override
    public synchronized void destroy() {
        if (writer == null) {
            return;
        }
        try {
            writer.close();
        } catch (IOException e) {
            log.warn("Failed to close run log writer", e);
        } finally {
            writer = null;
        }
    }

    /**
     * First usable candidate of: configured root, APPDATA, user home, container path.
     */
    private Path initializeArchiveRoot() {
        if (configuredArchiveRoot != null && !configuredArchiveRoot.isBlank()) {
            Path configured = tryArchiveRoot("configured", Path.of(configuredArchiveRoot.trim()));
            if (configured != null) {
                return configured;
            }
        }

        Path resolved = tryArchiveRoot("APPDATA", resolveAppDataArchivePath());
        if (resolved == null) {
            resolved = tryArchiveRoot("user home", resolveUserHomeArchivePath());
        }
        if (resolved == null) {
            resolved = tryArchiveRoot("container", resolveContainerFallbackPath());
        }
        return resolved;
    }

    private Path tryArchiveRoot(String origin, Path candidate) {
        if (candidate == null) {
            return null;
        }

        try {
            Path created = createDirectories(candidate);
            log.info("Archive root ({}): {}", origin, created.toAbsolutePath());
            return created;
        } catch (IOException e) {
            log.warn("Archive root candidate {} ({}) is unusable, trying the next one", candidate.toAbsolutePath(), origin, e);
            return null;
        }
    }

    protected Path createDirectories(Path path) throws IOException {
        return Files.createDirectories(path);
    }

    protected Path resolveAppDataArchivePath() {
        String appData = System.getenv("APPDATA");
        if (appData != null && !appData.isBlank()) {
            return Path.of(appData, "Noona", "magpie", "archive");
        }
        return null;
    }

    protected Path resolveUserHomeArchivePath() {
        String userHome = System.getProperty("user.home");
        if (userHome != null && !userHome.isBlank()) {
            return Path.of(userHome, ".noona", "magpie", "archive");
        }
        return Path.of(".noona", "magpie", "archive");
    }

    protected Path resolveContainerFallbackPath() {
        return CONTAINER_FALLBACK;
    }

    /**
     * Renames a non-empty latest log after the current time, then keeps only the newest
     * archived logs so that at most {@value #MAX_LOGS} files remain with the new latest log.
     */
    private void rotateLogs() throws IOException {
        Path latestLog = logsPath.resolve(LATEST_LOG);
        if (Files.exists(latestLog) && Files.size(latestLog) > 0) {
            Path archivedLog = logsPath.resolve(LocalDateTime.now().format(FILE_FORMATTER) + ".log");
            Files.move(latestLog, archivedLog, StandardCopyOption.REPLACE_EXISTING);
            log.info("Previous run log kept as {}", archivedLog.getFileName());
        }

        List<Path> archived;
        try (Stream<Path> files = Files.list(logsPath)) {
            archived = files
                    .filter(p -> p.getFileName().toString().endsWith(".log"))
                    .filter(p -> !p.getFileName().toString().equals(LATEST_LOG))
                    .sorted(Comparator.comparingLong(this::getFileModifiedTime).reversed())
                    .collect(Collectors.toList());
        }

        for (Path stale : archived.subList(Math.min(archived.size(), MAX_LOGS - 1), archived.size())) {
            try {
                Files.delete(stale);
                log.info("Pruned run log {}", stale.getFileName());
            } catch (IOException e) {
                log.warn("Could not prune run log {}", stale.getFileName(), e);
            }
        }
    }

    private long getFileModifiedTime(Path path) {
        try {
            return Files.getLastModifiedTime(path).toMillis();
        } catch (IOException e) {
            return 0L;
        }
    }

    private synchronized void write(String level, String tag, String message) {
        String logLine = String.format("%s [%s] [%s] %s%n", LocalDateTime.now().format(LOG_FORMATTER), level, tag, message);
        if (writer != null) {
            try {
                writer.write(logLine);
                writer.flush();
            } catch (IOException e) {
                log.error("Failed to write to run log file", e);
                writer = null;
            }
        }
        System.out.print(logLine);
    }

    public void info(String tag, String message) {
        write("INFO", tag, message);
    }

    public void warn(String tag, String message) {
        write("WARN", tag, message);
    }

    public void error(String tag, String message) {
        write("ERROR", tag, message);
    }

    public void error(String tag, String message, Throwable throwable) {
        write("ERROR", tag, message + " | " + throwable.getClass().getSimpleName() + ": " + throwable.getMessage());
    }

    public void debug(String tag, String message) {
        if (log.isDebugEnabled()) {
            write("DEBUG", tag, message);
        }
    }

    public Path getArchiveRoot() {
        return archiveRoot;
    }
}
