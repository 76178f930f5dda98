package com.paxkun.magpie.service.library;

import java.util.Objects;

/**
 * A comic as identified by its source.
 *
 * @param bookId  source-assigned identifier
 * @param title   display title read from the landing page
 * @param siteTag tag of the source adapter that produced this book
 * @param state   lifecycle reported by the source
 *
 * Author: Pax
 */
public record Book(String bookId, String title, String siteTag, BookState state) {

    public Book {
        Objects.requireNonNull(bookId, "bookId");
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(siteTag, "siteTag");
        Objects.requireNonNull(state, "state");
    }

    public boolean isCompleted() {
        return state == BookState.COMPLETED;
    }
}
