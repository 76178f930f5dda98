package com.paxkun.magpie.service.discovery;

/**
 * Why discovery left a chapter behind. The chapter is retried on the next run.
 */
public enum SkipReason {
    NAVIGATION_TIMEOUT,
    EXTRACTION_EMPTY,
    ARTIFACT_IO,
    RENDERING_ERROR
}
