package com.draftlens.poetry;

import com.draftlens.models.PoetryInsights.Sense;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Word lists read by the poetry analyzers. All comparisons are against lower-cased tokens.
 */
final class PoetryLexicon {

    private PoetryLexicon() {
    }

    static final Set<String> STOPWORDS = Set.of(
            "the", "a", "an", "and", "or", "but", "if", "then", "so", "than", "as",
            "to", "of", "in", "on", "at", "by", "for", "from", "with", "without", "into", "over", "under",
            "is", "are", "was", "were", "be", "been", "being", "do", "did", "does", "have", "has", "had",
            "i", "me", "my", "mine", "you", "your", "yours", "we", "us", "our", "ours", "he", "him", "his",
            "she", "her", "hers", "they", "them", "their", "theirs",
            "this", "that", "these", "those", "it", "its", "not", "no", "yes", "all", "any", "some",
            "there", "here", "where", "when", "why", "how", "what", "who", "whom",
            "up", "down", "out", "off", "again", "once", "very", "just", "only", "even");

    /**
     * Sense vocabularies in classification order; a token counts for the first sense that lists it.
     */
    static final Map<Sense, Set<String>> SENSES;

    static {
        Map<Sense, Set<String>> senses = new LinkedHashMap<>();
        senses.put(Sense.VISUAL, Set.of("see", "saw", "look", "looked", "light", "bright", "dark", "color",
                "shadow", "glow", "shimmer", "spark", "glitter", "eyes"));
        senses.put(Sense.AUDITORY, Set.of("hear", "heard", "sound", "sing", "song", "voice", "whisper", "shout",
                "silence", "echo", "rumble", "buzz"));
        senses.put(Sense.TACTILE, Set.of("touch", "feel", "felt", "cold", "warm", "hot", "soft", "hard", "rough",
                "smooth", "skin", "bone"));
        senses.put(Sense.OLFACTORY, Set.of("smell", "scent", "odor", "fragrant", "musty", "stale", "fresh", "acrid",
                "perfume"));
        senses.put(Sense.GUSTATORY, Set.of("taste", "tasted", "sweet", "sour", "bitter", "salt", "salty", "honey",
                "tongue"));
        senses.put(Sense.KINESTHETIC, Set.of("run", "ran", "walk", "walked", "move", "moved", "fall", "fell", "rise",
                "rising", "turn", "lean", "tremble", "shiver"));
        SENSES = Collections.unmodifiableMap(senses);
    }

    static final Set<String> FIRST_PERSON = Set.of("i", "me", "my", "mine", "myself");
    static final Set<String> SECOND_PERSON = Set.of("you", "your", "yours", "yourself");
    static final Set<String> THIRD_PERSON = Set.of(
            "he", "him", "his", "she", "her", "hers", "they", "them", "their", "theirs");

    static final Set<String> NARRATIVE_VERBS = Set.of(
            "said", "say", "told", "tell", "asked", "ask", "went", "go", "came", "come", "took", "take",
            "made", "make", "saw", "see", "heard", "hear", "did", "do", "had", "have", "was", "were",
            "fell", "fall", "rose", "rise");

    static final Set<String> HEDGES = Set.of(
            "maybe", "perhaps", "seems", "seemed", "almost", "nearly", "kind", "sort", "possibly");
    static final Set<String> MODALITY = Set.of(
            "must", "should", "ought", "need", "can't", "cannot", "won't", "never", "always");
    static final Set<String> VOLTA_CUES = Set.of(
            "but", "yet", "however", "though", "although", "instead", "still", "then", "so", "therefore");

    static final Set<String> POSITIVE = Set.of(
            "love", "loved", "light", "bright", "warm", "hope", "joy", "gentle", "tender", "laugh", "smile",
            "grace", "bloom");
    static final Set<String> NEGATIVE = Set.of(
            "dark", "cold", "fear", "grief", "sad", "sorrow", "hate", "anger", "alone", "lonely", "hurt",
            "loss", "die", "dead", "empty");
    static final Set<String> INTENSIFIERS = Set.of(
            "very", "so", "too", "utterly", "completely", "always", "never");

    static final Set<String> SEQUENCE_AND_ACTION = Set.of(
            "then", "when", "after", "before", "suddenly", "later", "once", "while", "until",
            "walk", "walked", "run", "ran", "went", "go", "came", "come", "turned", "turn", "took", "take",
            "gave", "give", "made", "make",
            "said", "say", "told", "tell", "asked", "ask");
    static final Set<String> ADDRESS = Set.of(
            "you", "your", "yours", "thou", "thee", "thy", "thine", "ye", "o", "oh");
    static final Set<String> CONTEMPLATION = Set.of(
            "think", "thought", "know", "knew", "see", "saw", "seem", "seems", "remember", "imagine",
            "wonder", "ask", "tell", "consider");
    static final Set<String> ABSTRACTIONS = Set.of(
            "truth", "beauty", "time", "eternity", "forever", "still", "silence", "mind", "soul", "idea",
            "meaning");

    static final Set<String> EXPOSITION_MARKERS = Set.of(
            "because", "therefore", "thus", "hence", "since", "means", "meaning", "explains", "explain",
            "define", "definition", "conclude", "conclusion", "implies", "imply");
    static final Set<String> DIRECTION_WORDS = Set.of(
            "toward", "into", "beyond", "away", "home", "forward", "out", "through");

    static boolean isContentWord(String token) {
        return token.length() > 2 && !STOPWORDS.contains(token);
    }
}
