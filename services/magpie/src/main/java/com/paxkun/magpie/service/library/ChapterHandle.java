package com.paxkun.magpie.service.library;

/**
 * Source-specific way of opening a chapter from the chapter list: either the
 * link's href or the id of the element carrying the click handler.
 */
public record ChapterHandle(Kind kind, String value) {

    public enum Kind {
        HREF,
        ELEMENT_ID
    }

    public static ChapterHandle href(String href) {
        return new ChapterHandle(Kind.HREF, href);
    }

    public static ChapterHandle elementId(String id) {
        return new ChapterHandle(Kind.ELEMENT_ID, id);
    }

    /**
     * CSS selector that locates the clickable element for this handle.
     */
    public String toSelector() {
        String attribute = kind == Kind.ELEMENT_ID ? "id" : "href";
        return "a[" + attribute + "=\"" + value.replace("\"", "\\\"") + "\"]";
    }
}
