package com.paxkun.magpie.service.discovery;

import com.paxkun.magpie.service.library.Chapter;

import java.nio.file.Path;

/**
 * Outcome of discovering one chapter: either the persisted URL list or the reason it was skipped.
 */
public record ChapterResult(Chapter chapter, ChapterStatus status, Path urlList, int imageCount, SkipReason skipReason) {

    public static ChapterResult persisted(Chapter chapter, Path urlList, int imageCount) {
        return new ChapterResult(chapter, ChapterStatus.DISCOVERED, urlList, imageCount, null);
    }

    public static ChapterResult skipped(Chapter chapter, SkipReason reason) {
        return new ChapterResult(chapter, ChapterStatus.FAILED, null, 0, reason);
    }

    public boolean isPersisted() {
        return status == ChapterStatus.DISCOVERED;
    }
}
