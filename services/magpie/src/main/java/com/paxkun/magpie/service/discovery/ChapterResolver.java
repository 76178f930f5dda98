package com.paxkun.magpie.service.discovery;

import com.paxkun.magpie.service.LoggerService;
import com.paxkun.magpie.service.library.Chapter;
import com.paxkun.magpie.service.library.ChapterHandle;
import com.paxkun.magpie.service.source.ChapterEntry;
import com.paxkun.magpie.service.source.ChapterOrder;
import com.paxkun.magpie.service.source.SourceAdapter;
import com.paxkun.magpie.service.storage.ArtifactStore;
import com.paxkun.magpie.service.storage.BookLayout;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns a rendered chapter list into the chapters that still need discovery.
 * A chapter is done once its URL-list file exists; nothing else is consulted.
 * <p>
 * Author: Pax
 */
@Component
@RequiredArgsConstructor
public class ChapterResolver {

    private final LoggerService logger;

    /**
     * @param chapterListMarkup inner markup of the source's chapter list region
     * @param source            adapter that knows how to read the list and its ordering
     * @param layout            where this book's artifacts live
     * @param overwrite         when set, every chapter is returned regardless of artifacts
     * @return pending chapters in reading order with 1-based indices
     */
    public List<Chapter> resolve(String chapterListMarkup, SourceAdapter source, BookLayout layout, boolean overwrite) {
        List<ChapterEntry> entries = new ArrayList<>(source.parseChapterEntries(chapterListMarkup));
        if (source.chapterOrder() == ChapterOrder.NEWEST_FIRST) {
            Collections.reverse(entries);
        }

        Set<ChapterHandle> seen = new HashSet<>();
        List<Chapter> pending = new ArrayList<>();
        int index = 0;
        for (ChapterEntry entry : entries) {
            if (!seen.add(entry.handle())) {
                continue;
            }
            index++;
            Chapter chapter = new Chapter(index, ArtifactStore.sanitizeFileName(entry.name()), entry.handle());
            Path urlList = layout.urlListPath(chapter);
            if (overwrite || !Files.exists(urlList)) {
                pending.add(chapter);
                logger.info("RESOLVE", "Found chapter " + index + ": " + chapter.name());
            } else {
                logger.debug("RESOLVE", "Chapter " + index + " already discovered at " + urlList);
            }
        }

        logger.info("RESOLVE", pending.size() + " of " + index + " chapters pending for " + layout.bookDir());
        return pending;
    }
}
