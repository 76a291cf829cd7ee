package com.draftlens.analysis;

/**
 * A slice of the analyzed text. {@code number} is 1-based; offsets are half-open character positions.
 */
public record Chapter(int number, String title, int start, int end, String text) {
}
