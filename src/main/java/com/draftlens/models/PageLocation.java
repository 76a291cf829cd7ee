package com.draftlens.models;

/**
 * Maps a character offset to the page number it starts on.
 */
public record PageLocation(int location, int page) {
}
