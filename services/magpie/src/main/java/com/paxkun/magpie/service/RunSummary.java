package com.paxkun.magpie.service;

import com.paxkun.magpie.service.assembly.AssemblyResult;
import com.paxkun.magpie.service.discovery.ChapterResult;
import com.paxkun.magpie.service.library.Book;
import com.paxkun.magpie.service.storage.BookLayout;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * What one orchestrator run did: the chapters it tried to discover, the documents it
 * tried to build and where the book ended up.
 * <p>
 * Author: Pax
 */
@Data
@NoArgsConstructor
public class RunSummary {
    private Book book;
    private BookLayout layout;
    private List<ChapterResult> discovered = new ArrayList<>();
    private List<AssemblyResult> assembled = new ArrayList<>();
    private Path indexPath;

    /**
     * The book root was moved to the completed root by this run.
     */
    private boolean archived;

    /**
     * The book was already under the completed root; nothing was done.
     */
    private boolean alreadyArchived;

    public long skippedChapters() {
        return discovered.stream().filter(result -> !result.isPersisted()).count();
    }

    public long failedDocuments() {
        return assembled.stream().filter(AssemblyResult::isFailed).count();
    }

    /**
     * Every chapter discovered this run was persisted and every document was built.
     */
    public boolean isComplete() {
        return skippedChapters() == 0 && failedDocuments() == 0;
    }
}
