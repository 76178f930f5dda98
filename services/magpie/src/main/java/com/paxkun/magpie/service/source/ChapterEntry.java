package com.paxkun.magpie.service.source;

import com.paxkun.magpie.service.library.ChapterHandle;

/**
 * A chapter as declared in a source's chapter list, before indexing.
 */
public record ChapterEntry(ChapterHandle handle, String name) {
}
