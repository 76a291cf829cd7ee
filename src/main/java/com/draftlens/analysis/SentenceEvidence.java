package com.draftlens.analysis;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Sentence picking over one chapter: sentences naming a character, sentences carrying an indicator word,
 * or both. Returned sentences are trimmed and cut to {@value #MAX_SENTENCE_LENGTH} chars.
 */
final class SentenceEvidence {

    static final int MAX_SENTENCE_LENGTH = 120;

    private final List<String> sentences;

    SentenceEvidence(String chapterText) {
        this.sentences = new ArrayList<>();
        for (String sentence : TextSegmenter.splitSentences(chapterText)) {
            sentences.add(sentence.trim());
        }
    }

    List<String> sentences() {
        return sentences;
    }

    List<String> mentioning(CharacterAliases character) {
        List<String> out = new ArrayList<>();
        for (String sentence : sentences) {
            if (character.matches(sentence)) {
                out.add(sentence);
            }
        }
        return out;
    }

    /**
     * First sentence naming the character and carrying an indicator, else the first naming it at all.
     */
    String aliasWithIndicatorOrAlias(CharacterAliases character, Pattern indicators) {
        String firstAlias = null;
        for (String sentence : sentences) {
            if (!character.matches(sentence)) {
                continue;
            }
            if (indicators.matcher(sentence).find()) {
                return cut(sentence);
            }
            if (firstAlias == null) {
                firstAlias = sentence;
            }
        }
        return firstAlias == null ? "" : cut(firstAlias);
    }

    /**
     * Alias plus indicator, else indicator only, else alias only, else empty.
     */
    String bestEvidence(CharacterAliases character, Pattern indicators) {
        String firstAlias = null;
        String firstIndicator = null;
        for (String sentence : sentences) {
            boolean named = character.matches(sentence);
            boolean indicated = indicators.matcher(sentence).find();
            if (named && indicated) {
                return cut(sentence);
            }
            if (indicated && firstIndicator == null) {
                firstIndicator = sentence;
            }
            if (named && firstAlias == null) {
                firstAlias = sentence;
            }
        }
        if (firstIndicator != null) {
            return cut(firstIndicator);
        }
        return firstAlias == null ? "" : cut(firstAlias);
    }

    /**
     * Alias plus indicator, else indicator only, else empty.
     */
    String indicatedEvidence(CharacterAliases character, Pattern indicators) {
        String firstIndicator = null;
        for (String sentence : sentences) {
            if (!indicators.matcher(sentence).find()) {
                continue;
            }
            if (character.matches(sentence)) {
                return cut(sentence);
            }
            if (firstIndicator == null) {
                firstIndicator = sentence;
            }
        }
        return firstIndicator == null ? "" : cut(firstIndicator);
    }

    /**
     * Only a sentence naming the character and carrying an indicator counts.
     */
    String strictEvidence(CharacterAliases character, Pattern indicators) {
        for (String sentence : sentences) {
            if (character.matches(sentence) && indicators.matcher(sentence).find()) {
                return cut(sentence);
            }
        }
        return "";
    }

    static Pattern indicatorPattern(List<String> indicators) {
        StringBuilder alternation = new StringBuilder();
        for (String indicator : indicators) {
            if (alternation.length() > 0) {
                alternation.append('|');
            }
            alternation.append(Pattern.quote(indicator));
        }
        return Pattern.compile("\\b(?:" + alternation + ")\\b", Pattern.CASE_INSENSITIVE);
    }

    static String cut(String sentence) {
        String trimmed = sentence.trim();
        return trimmed.length() > MAX_SENTENCE_LENGTH ? trimmed.substring(0, MAX_SENTENCE_LENGTH) : trimmed;
    }
}
