package com.draftlens.analysis;

import com.draftlens.models.DocumentFormat;
import com.draftlens.models.FormatDetection;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HeuristicFormatDetectorTest {

    private final HeuristicFormatDetector detector = new HeuristicFormatDetector();

    @Test
    void shortTextIsUndecided() {
        FormatDetection detection = detector.detect("INT. KITCHEN - DAY\n\nJANE\nHi.");
        assertEquals(FormatDetection.undecided(), detection);
        assertEquals(FormatDetection.undecided(), detector.detect(null));
    }

    @Test
    void sluglinesAndCuesReadAsScreenplay() {
        String block = "INT. KITCHEN - DAY\n\nJane pours coffee.\n\nJANE\nMorning.\n\nTOM (V.O.)\nLate again.\n\nCUT TO:\n\n";
        FormatDetection detection = detector.detect(block.repeat(8));

        assertEquals(DocumentFormat.SCREENPLAY, detection.format());
        assertTrue(detection.confidence() > HeuristicFormatDetector.SCREENPLAY_THRESHOLD);
        assertTrue(detection.confidence() <= 1.0);
        assertTrue(detection.isScreenplay());
    }

    @Test
    void longParagraphsWithInteriorityReadAsNovel() {
        String paragraph = "Mara walked through the old market while the rain fell on the canvas roofs, and she thought "
                + "about the letter folded in her coat. She remembered the way her mother had written the address, "
                + "slow and careful, as if every letter mattered more than the words. The next morning she would "
                + "have to decide, and she felt the weight of it pressing on her like the wet air. \"We should go,\" "
                + "he said, but she did not answer him.";
        String text = "Chapter 1\n\n" + String.join("\n\n", paragraph, paragraph, paragraph, paragraph);
        FormatDetection detection = detector.detect(text);

        assertEquals(DocumentFormat.NOVEL, detection.format());
        assertTrue(detection.confidence() > 1.0 - HeuristicFormatDetector.NOVEL_THRESHOLD);
    }
}
