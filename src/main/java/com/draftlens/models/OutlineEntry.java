package com.draftlens.models;

/**
 * One heading of a caller-supplied outline. Level 0 is a part, 1 a chapter, 2 a heading.
 * Offsets are character positions in the analyzed text and may exceed its length.
 */
public record OutlineEntry(String title, int level, int rangeStart, int rangeEnd, int page) {

    public OutlineEntry(String title, int level, int rangeStart, int rangeEnd) {
        this(title, level, rangeStart, rangeEnd, 0);
    }
}
