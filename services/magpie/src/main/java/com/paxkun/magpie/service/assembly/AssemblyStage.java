package com.paxkun.magpie.service.assembly;

import com.paxkun.magpie.exception.ArtifactIOException;
import com.paxkun.magpie.exception.AssemblyException;
import com.paxkun.magpie.exception.FetchException;
import com.paxkun.magpie.service.RunContext;
import com.paxkun.magpie.service.acquisition.EncodedImage;
import com.paxkun.magpie.service.storage.ArtifactStore;
import com.paxkun.magpie.service.storage.BookLayout;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds a document for every URL-list artifact of a book that lacks one. Works from
 * what is on disk, so chapters discovered by earlier runs are picked up too.
 * <p>
 * Chapters go one after another; the pages of each chapter are fetched in parallel by
 * the run's worker pool. A failed chapter leaves no document behind and does not stop
 * the others.
 * <p>
 * Author: Pax
 */
@Component
@RequiredArgsConstructor
public class AssemblyStage {

    private final ArtifactStore artifactStore;
    private final DocumentAssembler assembler;

    public List<AssemblyResult> assembleAll(RunContext context) {
        BookLayout layout = context.layout();
        List<Path> urlLists = artifactStore.listUrlLists(layout);
        context.logger().info("ASSEMBLY", "Checking " + urlLists.size() + " URL lists for " + layout.bookDir());

        List<AssemblyResult> results = new ArrayList<>(urlLists.size());
        for (Path urlList : urlLists) {
            results.add(assembleOne(context, urlList));
        }

        long written = results.stream().filter(r -> r.outcome() == AssemblyResult.Outcome.WRITTEN).count();
        long failed = results.stream().filter(AssemblyResult::isFailed).count();
        context.logger().info("ASSEMBLY", "Assembly finished | written=" + written + " | failed=" + failed
                + " | total=" + results.size());
        return results;
    }

    private AssemblyResult assembleOne(RunContext context, Path urlList) {
        Path document = context.layout().documentPathFor(urlList);
        String fileName = document.getFileName().toString();
        String label = fileName.substring(0, fileName.length() - BookLayout.DOCUMENT_EXTENSION.length());
        if (!context.overwrite() && Files.exists(document)) {
            context.logger().debug("ASSEMBLY", "Document already present: " + document);
            return AssemblyResult.alreadyPresent(urlList, document);
        }

        context.logger().info("ASSEMBLY", "Generating document for " + urlList.getFileName());
        try {
            List<String> urls = artifactStore.readUrlList(urlList);
            List<EncodedImage> pages = context.workerPool().acquire(urls, context.referer(), label);
            byte[] pdf = assembler.assemble(pages, label);
            artifactStore.writeDocument(document, pdf);
            return AssemblyResult.written(urlList, document, pages.size());
        } catch (FetchException | AssemblyException | ArtifactIOException e) {
            context.logger().error("ASSEMBLY", "Skipping document " + label, e);
            return AssemblyResult.failed(urlList, document, e.getMessage());
        }
    }
}
