package com.paxkun.magpie.service.storage;

import com.paxkun.magpie.exception.ArtifactIOException;
import com.paxkun.magpie.service.LoggerService;
import com.paxkun.magpie.service.library.Book;
import lombok.RequiredArgsConstructor;
import org.jetbrains.annotations.NotNull;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads and writes chapter artifacts. Every write lands in a temporary file next
 * to the target and is then moved into place, so readers never see a partial file.
 * <p>
 * Author: Pax
 */
@Component
@RequiredArgsConstructor
public class ArtifactStore {

    private final LoggerService logger;

    public BookLayout layoutFor(@NotNull Path archiveRoot, @NotNull Book book) {
        String bookDir = sanitizeFileName(book.title() + "_" + book.bookId());
        return new BookLayout(archiveRoot, book.siteTag(), bookDir);
    }

    /**
     * Replaces characters that are not allowed in file names on common file systems.
     */
    public static String sanitizeFileName(String value) {
        if (value == null) {
            return "";
        }
        String cleaned = value.replaceAll("[\\\\/:*?\"<>|\\p{Cntrl}]", "_").trim();
        while (cleaned.endsWith(".")) {
            cleaned = cleaned.substring(0, cleaned.length() - 1).trim();
        }
        return cleaned.isEmpty() ? "_" : cleaned;
    }

    public void writeUrlList(Path target, List<String> urls) {
        String content = urls.stream().map(url -> url + "\n").collect(Collectors.joining());
        writeAtomically(target, content.getBytes(StandardCharsets.UTF_8));
        logger.info("STORAGE", "Saved " + urls.size() + " image URLs to " + target);
    }

    public List<String> readUrlList(Path source) {
        try {
            List<String> urls = new ArrayList<>();
            for (String line : Files.readAllLines(source, StandardCharsets.UTF_8)) {
                String trimmed = line.strip();
                if (!trimmed.isEmpty()) {
                    urls.add(trimmed);
                }
            }
            return urls;
        } catch (IOException e) {
            throw new ArtifactIOException("Failed to read URL list " + source, e);
        }
    }

    public void writeDocument(Path target, byte[] document) {
        writeAtomically(target, document);
        logger.info("STORAGE", "Saved document " + target + " (" + document.length + " bytes)");
    }

    /**
     * URL-list files of a book, sorted by name, which is chapter order.
     */
    public List<Path> listUrlLists(BookLayout layout) {
        Path imagesDir = layout.imagesDir();
        if (!Files.isDirectory(imagesDir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(imagesDir)) {
            return files.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".txt"))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new ArtifactIOException("Failed to list URL lists in " + imagesDir, e);
        }
    }

    public void ensureBookDirectories(BookLayout layout) {
        try {
            Files.createDirectories(layout.imagesDir());
            Files.createDirectories(layout.documentsDir());
        } catch (IOException e) {
            throw new ArtifactIOException("Failed to create book directories under " + layout.activeRoot(), e);
        }
    }

    /**
     * Moves the book root from its site root to the completed root in one rename.
     *
     * @throws ArtifactIOException if the completed root already exists or the move fails
     */
    public Path relocateToCompleted(BookLayout layout) {
        Path source = layout.activeRoot();
        Path target = layout.completedRoot();
        if (Files.exists(target)) {
            throw new ArtifactIOException("Completed root already exists: " + target);
        }
        try {
            Files.createDirectories(target.getParent());
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
            logger.info("STORAGE", "Archived book root " + source + " -> " + target);
            return target;
        } catch (IOException e) {
            throw new ArtifactIOException("Failed to archive " + source + " to " + target, e);
        }
    }

    private void writeAtomically(Path target, byte[] content) {
        Path tempFile = null;
        try {
            Path parent = target.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            tempFile = Files.createTempFile(parent, ".magpie-", ".tmp");
            Files.write(tempFile, content);
            try {
                Files.move(tempFile, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tempFile, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(tempFile);
            throw new ArtifactIOException("Failed to write " + target, e);
        }
    }

    private void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.warn("STORAGE", "Failed to delete temporary file " + path + ": " + e.getMessage());
        }
    }
}
