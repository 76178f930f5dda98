package com.paxkun.magpie.service.library;

/**
 * One chapter of a book, in reading order.
 *
 * @param index  1-based reading-order index, stable across runs for a book
 * @param name   display name, already made safe for file names
 * @param handle how to open the chapter from the chapter list
 *
 * Author: Pax
 */
public record Chapter(int index, String name, ChapterHandle handle) {

    public String label() {
        return String.format("ch%04d - %s", index, name);
    }
}
