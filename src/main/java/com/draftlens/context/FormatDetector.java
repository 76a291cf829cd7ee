package com.draftlens.context;

import com.draftlens.models.FormatDetection;

/**
 * Decides whether a text is laid out as novel prose or as a screenplay.
 */
@FunctionalInterface
public interface FormatDetector {

    FormatDetection detect(String text);
}
