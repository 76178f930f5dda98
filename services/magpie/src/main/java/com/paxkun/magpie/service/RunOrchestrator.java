package com.paxkun.magpie.service;

import com.paxkun.magpie.config.AcquisitionSettings;
import com.paxkun.magpie.config.NavigationSettings;
import com.paxkun.magpie.exception.ArtifactIOException;
import com.paxkun.magpie.exception.FatalRunException;
import com.paxkun.magpie.service.acquisition.AcquisitionWorkerPool;
import com.paxkun.magpie.service.acquisition.ImageFetcher;
import com.paxkun.magpie.service.acquisition.ImageNormalizer;
import com.paxkun.magpie.service.assembly.AssemblyStage;
import com.paxkun.magpie.service.assembly.ListingGenerator;
import com.paxkun.magpie.service.discovery.ChapterNavigationController;
import com.paxkun.magpie.service.discovery.ChapterResolver;
import com.paxkun.magpie.service.discovery.RenderingSession;
import com.paxkun.magpie.service.discovery.RenderingSessionFactory;
import com.paxkun.magpie.service.library.Book;
import com.paxkun.magpie.service.library.Chapter;
import com.paxkun.magpie.service.source.SourceAdapter;
import com.paxkun.magpie.service.storage.ArtifactStore;
import com.paxkun.magpie.service.storage.BookLayout;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs one book from landing page to archive: discovery over a single rendering
 * session, then acquisition and assembly of every chapter lacking a document, then
 * the listing, then relocation of finished books.
 * <p>
 * Every stage decides what to do from the artifacts on disk, so a run that died
 * half-way is simply started again.
 * <p>
 * Author: Pax
 */
@Service
@RequiredArgsConstructor
public class RunOrchestrator {

    private final RenderingSessionFactory sessionFactory;
    private final ChapterResolver resolver;
    private final ChapterNavigationController navigator;
    private final AssemblyStage assemblyStage;
    private final ListingGenerator listingGenerator;
    private final ArtifactStore artifactStore;
    private final ImageFetcher imageFetcher;
    private final ImageNormalizer imageNormalizer;
    private final AcquisitionSettings acquisitionSettings;
    private final NavigationSettings navigationSettings;
    private final LoggerService logger;

    /**
     * @throws FatalRunException if the book cannot be opened or the rendering session is lost
     */
    public RunSummary run(SourceAdapter source, String bookId, boolean overwrite) {
        Path archiveRoot = logger.getArchiveRoot();
        if (archiveRoot == null) {
            throw new FatalRunException("No writable archive root available");
        }

        RunSummary summary = new RunSummary();
        String bookUrl = source.bookUrl(bookId);
        logger.info("RUN", "Starting " + source.siteTag() + " book " + bookId + " | url=" + bookUrl
                + " | overwrite=" + overwrite);

        Book book;
        BookLayout layout;
        try (RenderingSession session = openSession()) {
            book = openBook(session, source, bookId);
            layout = artifactStore.layoutFor(archiveRoot, book);
            summary.setBook(book);
            summary.setLayout(layout);
            logger.info("RUN", "Book: " + book.title() + " | state=" + book.state() + " | root=" + layout.activeRoot());

            if (book.isCompleted() && Files.exists(layout.completedRoot())) {
                logger.info("RUN", "Book already archived at " + layout.completedRoot() + ", nothing to do");
                summary.setAlreadyArchived(true);
                Path archivedIndex = layout.relocated(layout.documentsDir().resolve(ListingGenerator.INDEX_FILE));
                if (Files.exists(archivedIndex)) {
                    summary.setIndexPath(archivedIndex);
                }
                return summary;
            }

            artifactStore.ensureBookDirectories(layout);
            List<Chapter> pending = resolver.resolve(readChapterList(session, source), source, layout, overwrite);
            if (pending.isEmpty()) {
                logger.info("RUN", "No chapters pending discovery");
            } else {
                source.prepareNavigation(session, pending.get(0), navigationSettings.timeout());
                summary.setDiscovered(navigator.discover(session, source, book, layout, pending));
            }
        }

        try (AcquisitionWorkerPool workerPool = createWorkerPool()) {
            RunContext context = new RunContext(book, layout, overwrite, bookUrl, workerPool, logger);
            summary.setAssembled(assemblyStage.assembleAll(context));
        }

        try {
            summary.setIndexPath(listingGenerator.generate(layout.documentsDir()));
        } catch (ArtifactIOException e) {
            logger.error("RUN", "Listing generation failed for " + layout.documentsDir(), e);
        }

        if (book.isCompleted()) {
            archive(summary, layout);
        }

        logger.info("RUN", "Finished " + book.title() + " | discovered=" + summary.getDiscovered().size()
                + " | skippedChapters=" + summary.skippedChapters()
                + " | failedDocuments=" + summary.failedDocuments()
                + " | archived=" + summary.isArchived());
        return summary;
    }

    protected AcquisitionWorkerPool createWorkerPool() {
        return new AcquisitionWorkerPool(imageFetcher, imageNormalizer, logger, acquisitionSettings);
    }

    private RenderingSession openSession() {
        try {
            return sessionFactory.open();
        } catch (FatalRunException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new FatalRunException("Could not open rendering session: " + e.getMessage(), e);
        }
    }

    private Book openBook(RenderingSession session, SourceAdapter source, String bookId) {
        String bookUrl = source.bookUrl(bookId);
        try {
            session.navigate(bookUrl);
            session.waitForSelector(source.chapterListRegion(), navigationSettings.timeout());
            return source.readBook(bookId, session.pageSource());
        } catch (FatalRunException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new FatalRunException("Could not open book page " + bookUrl, e);
        }
    }

    private String readChapterList(RenderingSession session, SourceAdapter source) {
        try {
            return session.innerHtml(source.chapterListRegion());
        } catch (FatalRunException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new FatalRunException("Chapter list " + source.chapterListRegion() + " not found", e);
        }
    }

    private void archive(RunSummary summary, BookLayout layout) {
        if (!summary.isComplete()) {
            logger.warn("RUN", "Book is completed but " + summary.skippedChapters() + " chapters and "
                    + summary.failedDocuments() + " documents failed; leaving it at " + layout.activeRoot());
            return;
        }
        try {
            artifactStore.relocateToCompleted(layout);
            summary.setArchived(true);
            if (summary.getIndexPath() != null) {
                summary.setIndexPath(layout.relocated(summary.getIndexPath()));
            }
        } catch (ArtifactIOException e) {
            logger.error("RUN", "Archiving " + layout.activeRoot() + " failed", e);
        }
    }
}
