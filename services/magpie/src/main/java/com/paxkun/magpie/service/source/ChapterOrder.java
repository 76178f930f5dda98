package com.paxkun.magpie.service.source;

/**
 * How a source orders its chapter list relative to reading order.
 */
public enum ChapterOrder {
    READING_ORDER,
    NEWEST_FIRST
}
