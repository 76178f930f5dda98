package com.paxkun.magpie.service.library;

/**
 * Lifecycle of a book as reported by its source.
 */
public enum BookState {
    ACTIVE,
    COMPLETED
}
