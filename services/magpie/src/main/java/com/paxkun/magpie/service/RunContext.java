package com.paxkun.magpie.service;

import com.paxkun.magpie.service.acquisition.AcquisitionWorkerPool;
import com.paxkun.magpie.service.library.Book;
import com.paxkun.magpie.service.storage.BookLayout;

/**
 * Everything one run hands to its stages: the book being archived, where its
 * artifacts live, the worker pool that fetches its pages and the run log.
 *
 * @param book       book identity and lifecycle as read from the source
 * @param layout     on-disk layout of the book
 * @param overwrite  re-discover and re-assemble even when artifacts exist
 * @param referer    page presented as Referer when fetching images
 * @param workerPool acquisition pool owned by this run
 * @param logger     tagged run log
 */
public record RunContext(Book book,
                         BookLayout layout,
                         boolean overwrite,
                         String referer,
                         AcquisitionWorkerPool workerPool,
                         LoggerService logger) {
}
