package com.paxkun.magpie.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(OutputCaptureExtension.class)
class LoggerServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void initializesWithContainerFallbackWhenAccessDenied(CapturedOutput output) {
        Path containerFallback = tempDir.resolve("container");

        LoggerService service = new LoggerService() {
            private int attempts = 0;

            @Override
            protected Path resolveAppDataArchivePath() {
                return Path.of("/denied/appdata");
            }

            @Override
            protected Path resolveUserHomeArchivePath() {
                return Path.of("/denied/userhome");
            }

            @Override
            protected Path resolveContainerFallbackPath() {
                return containerFallback;
            }

            @Override
            protected Path createDirectories(Path path) throws IOException {
                attempts++;
                if (attempts <= 2) {
                    throw new AccessDeniedException(path.toString());
                }
                return Files.createDirectories(path);
            }
        };

        service.afterPropertiesSet();
        try {
            assertThat(service.getArchiveRoot()).isEqualTo(containerFallback);
            assertThat(output).contains("Archive root candidate " + Path.of("/denied/appdata").toAbsolutePath() + " (APPDATA) is unusable");
        } finally {
            service.destroy();
        }
    }

    @Test
    void configuredRootWinsAndTaggedLinesReachLatestLog(CapturedOutput output) throws IOException {
        Path configured = tempDir.resolve("configured");
        LoggerService service = new LoggerService();
        ReflectionTestUtils.setField(service, "configuredArchiveRoot", configured.toString());

        service.afterPropertiesSet();
        service.warn("ACQUIRE", "Attempt 1/3 failed for ch0001 page 2");
        service.destroy();

        assertThat(service.getArchiveRoot()).isEqualTo(configured);
        assertThat(output).contains("[SYSTEM] [ARCHIVE_ROOT] " + configured.toAbsolutePath());
        assertThat(Files.readString(configured.resolve("logs").resolve("latest.log")))
                .contains("[WARN] [ACQUIRE] Attempt 1/3 failed for ch0001 page 2");
    }

    @Test
    void rotatesPreviousLatestLogOnStartup() throws IOException {
        Path logs = Files.createDirectories(tempDir.resolve("root").resolve("logs"));
        Files.writeString(logs.resolve("latest.log"), "previous run\n");

        LoggerService service = new LoggerService();
        ReflectionTestUtils.setField(service, "configuredArchiveRoot", tempDir.resolve("root").toString());
        service.afterPropertiesSet();
        service.destroy();

        try (Stream<Path> files = Files.list(logs)) {
            assertThat(files.map(p -> p.getFileName().toString()))
                    .contains("latest.log")
                    .anyMatch(name -> name.matches("\\d{4}-\\d{2}-\\d{2}_\\d{2}-\\d{2}-\\d{2}\\.log"));
        }
        assertThat(Files.readString(logs.resolve("latest.log"))).doesNotContain("previous run");
    }

    @Test
    void errorLinesNameTheFailure(CapturedOutput output) {
        LoggerService service = new LoggerService();
        ReflectionTestUtils.setField(service, "configuredArchiveRoot", tempDir.toString());
        service.afterPropertiesSet();

        service.error("NAVIGATE", "Failed chapter 3 (Finale)", new IllegalStateException("boom"));
        service.destroy();

        assertThat(output).contains("[ERROR] [NAVIGATE] Failed chapter 3 (Finale) | IllegalStateException: boom");
    }

    @Test
    void errorWithoutCauseIsWrittenAsIs(CapturedOutput output) {
        LoggerService service = new LoggerService();
        ReflectionTestUtils.setField(service, "configuredArchiveRoot", tempDir.toString());
        service.afterPropertiesSet();

        service.error("NAVIGATE", "No images found for chapter 2");
        service.destroy();

        assertThat(output).contains("[ERROR] [NAVIGATE] No images found for chapter 2" + System.lineSeparator());
    }
}
