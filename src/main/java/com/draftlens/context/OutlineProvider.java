package com.draftlens.context;

import com.draftlens.models.OutlineEntry;

import java.util.List;

/**
 * Supplies chapter and scene headings for the text being analyzed, in document order.
 */
@FunctionalInterface
public interface OutlineProvider {

    List<OutlineEntry> outlineEntries();

    static OutlineProvider of(List<OutlineEntry> entries) {
        List<OutlineEntry> copy = entries == null ? List.of() : List.copyOf(entries);
        return () -> copy;
    }

    static OutlineProvider none() {
        return List::of;
    }
}
