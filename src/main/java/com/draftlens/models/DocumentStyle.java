package com.draftlens.models;

/**
 * Template flag chosen by the caller. POETRY routes analysis through the poetry branch.
 */
public enum DocumentStyle {
    PROSE,
    SCREENPLAY,
    POETRY
}
