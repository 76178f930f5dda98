package com.paxkun.magpie.service.assembly;

import java.nio.file.Path;

/**
 * Outcome of assembling one chapter document.
 *
 * @param urlList   URL-list artifact the document was built from
 * @param document  document path, written or not
 * @param outcome   what happened
 * @param pageCount pages in the written document, 0 otherwise
 * @param error     failure description when {@code outcome} is {@link Outcome#FAILED}
 */
public record AssemblyResult(Path urlList, Path document, Outcome outcome, int pageCount, String error) {

    public enum Outcome {
        WRITTEN,
        ALREADY_PRESENT,
        FAILED
    }

    public static AssemblyResult written(Path urlList, Path document, int pageCount) {
        return new AssemblyResult(urlList, document, Outcome.WRITTEN, pageCount, null);
    }

    public static AssemblyResult alreadyPresent(Path urlList, Path document) {
        return new AssemblyResult(urlList, document, Outcome.ALREADY_PRESENT, 0, null);
    }

    public static AssemblyResult failed(Path urlList, Path document, String error) {
        return new AssemblyResult(urlList, document, Outcome.FAILED, 0, error);
    }

    public boolean isFailed() {
        return outcome == Outcome.FAILED;
    }
}
