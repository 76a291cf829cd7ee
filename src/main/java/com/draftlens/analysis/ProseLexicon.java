package com.draftlens.analysis;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fixed word and phrase lists used by the prose and dialogue detectors.
 */
final class ProseLexicon {

    private ProseLexicon() {
    }

    static final List<String> PASSIVE_IRREGULAR_PARTICIPLES = List.of(
            "known", "seen", "given", "taken", "done", "gone", "made", "found", "kept", "left", "lost",
            "built", "bought", "caught", "felt", "held", "heard", "lent", "paid", "read", "said",
            "sold", "sent", "set", "told", "thought", "understood", "written", "driven", "eaten",
            "thrown", "grown", "broken", "chosen", "spoken", "forgotten", "forgiven", "hidden",
            "shown", "sung", "worn", "born", "put", "cut", "hit", "hurt", "won", "beaten",
            "bound", "fed", "laid", "led", "met");

    static final Set<String> ADVERB_EXCEPTIONS = Set.of(
            "family", "only", "lovely", "lonely", "friendly", "silly", "ugly", "early", "daily", "weekly",
            "monthly", "yearly", "holy", "jelly", "belly", "bully", "fly", "rely", "supply", "apply", "reply");

    static final List<String> SENSORY_WORDS = List.of(
            // visual
            "see", "saw", "look", "looked", "bright", "dark", "colorful", "gleaming", "shadowy", "shimmering",
            // auditory
            "hear", "heard", "sound", "loud", "quiet", "whisper", "shout", "echo", "silence", "rumble",
            // tactile
            "feel", "felt", "touch", "rough", "smooth", "soft", "hard", "cold", "warm", "hot",
            // olfactory
            "smell", "smelled", "scent", "fragrant", "musty", "fresh", "acrid", "aromatic",
            // gustatory
            "taste", "tasted", "flavor", "sweet", "sour", "bitter", "salty", "savory", "delicious");

    static final Set<String> WEAK_VERBS = Set.of(
            "is", "are", "was", "were", "be", "being", "been",
            "have", "has", "had", "having",
            "do", "does", "did", "doing",
            "get", "gets", "got", "getting", "gotten",
            "make", "makes", "made", "making",
            "go", "goes", "went", "going", "gone",
            "come", "comes", "came", "coming",
            "take", "takes", "took", "taking", "taken",
            "give", "gives", "gave", "giving", "given",
            "put", "puts", "putting",
            "seem", "seems", "seemed", "seeming",
            "become", "becomes", "became", "becoming");

    static final List<String> CLICHES = List.of(
            "at the end of the day", "think outside the box", "bottom line",
            "hit the ground running", "low-hanging fruit", "move the needle",
            "eyes sparkled", "eyes gleamed", "heart raced", "blood ran cold",
            "time stood still", "moment of truth", "breath caught",
            "crystal clear", "clear as day", "cold as ice", "dark as night",
            "quiet as a mouse", "quick as lightning", "strong as an ox",
            "busy as a bee", "light as a feather", "fit as a fiddle",
            "last but not least", "it goes without saying", "needless to say",
            "at this point in time", "in this day and age", "for all intents and purposes",
            "each and every", "first and foremost", "sad but true",
            "only time will tell", "easier said than done", "better late than never",
            "actions speak louder than words", "the tip of the iceberg",
            "a blessing in disguise", "add insult to injury", "beat around the bush",
            // physical reactions
            "heart pounded", "heart sank", "heart skipped", "heart leaped",
            "stomach churned", "stomach dropped", "stomach turned",
            "knees buckled", "knees weak", "jaw dropped", "jaw clenched",
            "fists clenched", "pulse quickened", "palms sweaty",
            "spine tingled", "hair stood on end", "goosebumps",
            "butterflies in stomach", "lump in throat", "face flushed",
            "cheeks burned", "ears burned", "blood boiled",
            // emotional
            "breath away", "swept off feet", "head over heels",
            "love at first sight", "match made in heaven",
            "writing on the wall", "threw caution to the wind",
            "caught between a rock and a hard place",
            "avoid like the plague", "bite the bullet", "break the ice",
            "cutting corners", "give the benefit of the doubt",
            "hit the nail on the head", "in the heat of the moment",
            "jump on the bandwagon", "let the cat out of the bag",
            "piece of cake", "raining cats and dogs", "bite off more than you can chew");

    static final Set<String> FILTER_WORDS = Set.of(
            "saw", "see", "sees", "seeing", "seen",
            "heard", "hear", "hears", "hearing",
            "felt", "feel", "feels", "feeling",
            "noticed", "notice", "notices", "noticing",
            "seemed", "seem", "seems", "seeming",
            "realized", "realize", "realizes", "realizing",
            "thought", "think", "thinks", "thinking",
            "wondered", "wonder", "wonders", "wondering",
            "watched", "watch", "watches", "watching",
            "looked", "look", "looks", "looking",
            "smelled", "smell", "smells", "smelling");

    static final List<String> DIALOGUE_FILLERS = List.of(
            "uh", "um", "well", "like", "you know", "actually",
            "basically", "literally", "honestly", "i mean",
            "sort of", "kind of", "you see", "right");

    static final List<String> PREDICTABLE_DIALOGUE = List.of(
            "we need to talk", "it's not what it looks like",
            "i can explain", "you wouldn't understand",
            "this isn't over", "we meet again",
            "you have no idea", "trust me", "believe me",
            "i'm fine", "everything's fine", "don't worry about it",
            "it's complicated", "long story", "never mind",
            "forget about it", "what are you doing here",
            "who are you", "what do you want");

    static final Set<String> CONFLICT_WORDS = Set.of(
            "but", "no", "never", "don't", "can't", "won't",
            "disagree", "wrong", "impossible", "ridiculous",
            "stupid", "idiot", "fool", "liar", "lie",
            "fight", "argue", "angry", "furious", "hate");

    static final List<String> DIALOGUE_TAGS = List.of(
            "said", "asked", "replied", "answered", "whispered",
            "shouted", "yelled", "muttered", "murmured", "exclaimed",
            "stated", "remarked", "noted", "added", "continued");

    /**
     * Valence in [-1, 1] for a handful of emotion words.
     */
    static final Map<String, Double> SENTIMENT = Map.ofEntries(
            Map.entry("happy", 0.7), Map.entry("joy", 0.8), Map.entry("love", 0.9), Map.entry("smile", 0.6),
            Map.entry("laugh", 0.6), Map.entry("excited", 0.7), Map.entry("hope", 0.6), Map.entry("proud", 0.7),
            Map.entry("grateful", 0.7), Map.entry("relieved", 0.6), Map.entry("calm", 0.5), Map.entry("peace", 0.7),
            Map.entry("smiled", 0.6), Map.entry("laughed", 0.6), Map.entry("hoped", 0.6), Map.entry("loved", 0.9),
            Map.entry("sad", -0.6), Map.entry("angry", -0.7), Map.entry("fear", -0.7), Map.entry("hate", -0.9),
            Map.entry("cry", -0.6), Map.entry("scream", -0.6), Map.entry("terror", -0.8), Map.entry("despair", -0.9),
            Map.entry("rage", -0.8), Map.entry("bitter", -0.6), Map.entry("guilt", -0.6), Map.entry("shame", -0.7),
            Map.entry("cried", -0.6), Map.entry("screamed", -0.6), Map.entry("feared", -0.7), Map.entry("hated", -0.9));

    static final Set<String> INTENSITY_WORDS = Set.of(
            "violent", "explosive", "intense", "extreme", "desperate",
            "frantic", "wild", "furious", "dramatic",
            "urgent", "critical", "severe", "acute");
}
