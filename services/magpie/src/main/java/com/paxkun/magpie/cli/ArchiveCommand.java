package com.paxkun.magpie.cli;

import com.paxkun.magpie.exception.FatalRunException;
import com.paxkun.magpie.service.LoggerService;
import com.paxkun.magpie.service.RunOrchestrator;
import com.paxkun.magpie.service.RunSummary;
import com.paxkun.magpie.service.source.SourceRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.awt.Desktop;
import java.awt.GraphicsEnvironment;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Command line entry: validates the arguments, runs the orchestrator and retries
 * the whole run from scratch while it fails. Any failure that escapes the
 * orchestrator counts as fatal.
 * <p>
 * Exit codes: 0 done (possibly with skipped chapters), 1 fatal run error, 2 usage error.
 * <p>
 * Author: Pax
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ArchiveCommand implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 1;
    static final int EXIT_USAGE = 2;

    private final SourceRegistry sourceRegistry;
    private final RunOrchestrator orchestrator;
    private final LoggerService logger;

    @Value("${magpie.run.max-attempts:3}")
    private int maxRunAttempts = 3;

    private int exitCode = EXIT_OK;

    @Override
    public void run(ApplicationArguments args) {
        ArchiveRequest request;
        try {
            request = ArchiveRequest.parse(args, sourceRegistry);
        } catch (IllegalArgumentException e) {
            logger.warn("CLI", e.getMessage());
            exitCode = EXIT_USAGE;
            return;
        }

        if (request.rescan()) {
            logger.info("CLI", "--rescan is reserved and currently does nothing");
        }

        RunSummary summary = runWithRetries(request);
        if (summary == null) {
            exitCode = EXIT_FATAL;
            return;
        }

        if (summary.getLayout() != null) {
            logger.info("CLI", "Successfully processed " + summary.getLayout().bookDir());
        }
        if (request.showIndex()) {
            showIndex(summary.getIndexPath());
        }
        exitCode = EXIT_OK;
    }

    private RunSummary runWithRetries(ArchiveRequest request) {
        int attempts = Math.max(1, maxRunAttempts);
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                return orchestrator.run(request.source(), request.bookId(), request.overwrite());
            } catch (FatalRunException e) {
                logger.error("CLI", "Run attempt " + attempt + "/" + attempts + " for book " + request.bookId()
                        + " failed", e);
            } catch (RuntimeException e) {
                log.error("Unexpected failure in run attempt {} for book {}", attempt, request.bookId(), e);
                logger.error("CLI", "Run attempt " + attempt + "/" + attempts + " for book " + request.bookId()
                        + " failed unexpectedly", e);
            }
        }
        logger.warn("CLI", "Giving up on book " + request.bookId() + " after " + attempts + " attempts");
        return null;
    }

    private void showIndex(Path indexPath) {
        if (indexPath == null) {
            logger.warn("CLI", "No listing was generated");
            return;
        }
        if (!canBrowse()) {
            logger.info("CLI", "Listing available at " + indexPath.toUri());
            return;
        }
        try {
            Desktop.getDesktop().browse(indexPath.toUri());
        } catch (IOException | UnsupportedOperationException e) {
            log.warn("Could not open {} in a browser: {}", indexPath, e.getMessage());
            logger.info("CLI", "Listing available at " + indexPath.toUri());
        }
    }

    /**
     * False on hosts without a display, where touching {@link Desktop} fails with an error.
     */
    protected boolean canBrowse() {
        return !GraphicsEnvironment.isHeadless()
                && Desktop.isDesktopSupported()
                && Desktop.getDesktop().isSupported(Desktop.Action.BROWSE);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
