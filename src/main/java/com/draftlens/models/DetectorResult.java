package com.draftlens.models;

import java.util.List;

/**
 * Count of every match plus a bounded, de-duplicated sample of the matched text.
 */
public record DetectorResult(int count, List<String> examples) {

    public static final DetectorResult EMPTY = new DetectorResult(0, List.of());

    public DetectorResult {
        examples = examples == null ? List.of() : List.copyOf(examples);
    }
}
