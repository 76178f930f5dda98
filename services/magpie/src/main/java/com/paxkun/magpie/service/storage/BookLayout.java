package com.paxkun.magpie.service.storage;

import com.paxkun.magpie.service.library.Chapter;

import java.nio.file.Path;

/**
 * On-disk layout of one book:
 * <pre>
 * &lt;archiveRoot&gt;/&lt;siteTag&gt;/&lt;bookDir&gt;/&lt;bookDir&gt;-images/ch0001 - name - &lt;siteTag&gt;.txt
 * &lt;archiveRoot&gt;/&lt;siteTag&gt;/&lt;bookDir&gt;/&lt;bookDir&gt;-pdf/ch0001 - name.pdf
 * </pre>
 * Archiving moves {@code <siteTag>/<bookDir>} to {@code completed/<bookDir>}.
 */
public record BookLayout(Path archiveRoot, String siteTag, String bookDir) {

    public static final String COMPLETED_TAG = "completed";
    public static final String DOCUMENT_EXTENSION = ".pdf";
    private static final String URL_LIST_EXTENSION = ".txt";

    public Path activeRoot() {
        return archiveRoot.resolve(siteTag).resolve(bookDir);
    }

    public Path completedRoot() {
        return archiveRoot.resolve(COMPLETED_TAG).resolve(bookDir);
    }

    public Path imagesDir() {
        return activeRoot().resolve(bookDir + "-images");
    }

    public Path documentsDir() {
        return activeRoot().resolve(bookDir + "-pdf");
    }

    public Path urlListPath(Chapter chapter) {
        return imagesDir().resolve(chapter.label() + " - " + siteTag + URL_LIST_EXTENSION);
    }

    /**
     * Document path paired with a URL-list file found on disk.
     */
    public Path documentPathFor(Path urlListPath) {
        String fileName = urlListPath.getFileName().toString();
        String siteSuffix = " - " + siteTag + URL_LIST_EXTENSION;
        String stem;
        if (fileName.endsWith(siteSuffix)) {
            stem = fileName.substring(0, fileName.length() - siteSuffix.length());
        } else if (fileName.endsWith(URL_LIST_EXTENSION)) {
            stem = fileName.substring(0, fileName.length() - URL_LIST_EXTENSION.length());
        } else {
            stem = fileName;
        }
        return documentsDir().resolve(stem + DOCUMENT_EXTENSION);
    }

    /**
     * Where {@code path}, currently under the active root, lives once the book is archived.
     */
    public Path relocated(Path path) {
        return completedRoot().resolve(activeRoot().relativize(path));
    }
}
