package dev.ebullient.interrogation.chat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Typed;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import dev.ebullient.interrogation.model.Location;

/**
 * Rule-based reveal detection. Within one sentence, a known location counts as
 * revealed when its name appears
 * <ul>
 * <li>within {@code window} characters of a granting phrase ("meet me at", "the password for", ...),</li>
 * <li>next to a bracketed hand-over of a key, map, pass or similar ("[hands over key]"), or</li>
 * <li>together with a meeting word and a time ("see you at the docks tomorrow").</li>
 * </ul>
 * A denial ("can't", "don't know", ...) in the clause holding the name cancels the reveal.
 * A sentence ending in a question mark that is answered by a denial ("The password
 * for the lab? Forget it.") is an echoed question, not a grant.
 */
@ApplicationScoped
@Typed(HeuristicLocationRevealDetector.class)
public class HeuristicLocationRevealDetector implements LocationRevealDetector {
    private static final Logger log = Logger.getLogger(HeuristicLocationRevealDetector.class);

    static final int DEFAULT_WINDOW = 30;

    static final List<String> GRANTING_PHRASES = List.of(
            "meet me at", "meet me in", "find me at", "find me in",
            "i'll take you to", "i will take you to", "take you to", "bring you to",
            "head to", "go to", "get you in", "get you into", "get you to", "let you in", "let you into",
            "here's the key to", "the key to", "the key for",
            "the password for", "the password to", "the code for", "the code to",
            "access to", "clearance for", "is open to you", "open to you", "expecting you",
            "a way into", "way in to", "how to get to", "how to get into", "how to find",
            "directions to", "this opens", "will get you into");

    static final List<String> DENIALS = List.of(
            "can't", "cannot", "can not", "won't", "will not", "wouldn't", "couldn't",
            "don't know", "do not know", "don't have", "do not have", "no access", "not allowed",
            "no idea", "refuse", "don't go", "do not go", "stay away",
            "forget it", "no way", "not a chance", "not happening", "not telling", "never");

    private static final Pattern ACCESS_ACTION = Pattern.compile(
            "\\[[^\\]]*\\b(?:hands?|handing|gives?|giving|shows?|showing|draws?|drawing|slides?|sliding"
                    + "|passes|passing|offers?|tosses|unlocks?|writes?|scribbles?)\\b[^\\]]*"
                    + "\\b(?:key|keys|keycard|card|map|pass|badge|code|password|address|directions|coordinates)\\b[^\\]]*\\]");

    private static final Pattern MEETING = Pattern.compile(
            "\\b(?:meet|meeting|see you|rendezvous|join me|come by|i'll be waiting|i will be waiting)\\b");

    private static final Pattern TIME = Pattern.compile(
            "\\b(?:tonight|tomorrow|today|midnight|noon|dawn|dusk|morning|afternoon|evening|later"
                    + "|after dark|o'clock|at \\d{1,2}(?::\\d{2})?)\\b");

    private static final Pattern SENTENCE_BREAK = Pattern.compile("(?<=[.!?])\\s+|\\n+");
    private static final Pattern CLAUSE_BREAK = Pattern.compile("[,;:]|\\bbut\\b|\\bthough\\b");

    @ConfigProperty(name = "interrogation.detector.window", defaultValue = "30")
    int window = DEFAULT_WINDOW;

    @Override
    public Set<String> detect(String dialogue, List<Location> candidates) {
        if (dialogue == null || dialogue.isBlank() || candidates == null || candidates.isEmpty()) {
            return Set.of();
        }
        List<String> sentences = sentences(normalize(dialogue));
        Set<String> revealed = new LinkedHashSet<>();
        for (Location location : candidates) {
            String name = matchableName(location);
            if (name.isEmpty()) {
                continue;
            }
            for (int i = 0; i < sentences.size(); i++) {
                String next = i + 1 < sentences.size() ? sentences.get(i + 1) : null;
                if (revealsIn(sentences.get(i), next, name)) {
                    revealed.add(location.id());
                    break;
                }
            }
        }
        log.debugf("Detected location reveals %s", revealed);
        return Collections.unmodifiableSet(revealed);
    }

    /**
     * @param next the sentence after {@code sentence}, or null
     */
    boolean revealsIn(String sentence, String next, String name) {
        List<int[]> names = occurrences(sentence, name);
        boolean undenied = false;
        for (int[] span : names) {
            if (!denied(clauseAround(sentence, span[0]))) {
                undenied = true;
                break;
            }
        }
        if (!undenied) {
            return false;
        }
        if (sentence.trim().endsWith("?") && next != null && denied(next)) {
            return false;
        }
        for (String phrase : GRANTING_PHRASES) {
            if (withinProximity(sentence, phrase, name, window)) {
                return true;
            }
        }
        if (ACCESS_ACTION.matcher(sentence).find()) {
            return true;
        }
        return MEETING.matcher(sentence).find() && TIME.matcher(sentence).find();
    }

    /**
     * True if some occurrence of {@code first} and some occurrence of
     * {@code second} are at most {@code maxDistance} characters apart, in either order.
     * Both are matched on word boundaries.
     */
    static boolean withinProximity(String text, String first, String second, int maxDistance) {
        List<int[]> a = occurrences(text, first);
        if (a.isEmpty()) {
            return false;
        }
        List<int[]> b = occurrences(text, second);
        for (int[] x : a) {
            for (int[] y : b) {
                int gap = x[1] <= y[0] ? y[0] - x[1]
                        : y[1] <= x[0] ? x[0] - y[1]
                                : 0;
                if (gap <= maxDistance) {
                    return true;
                }
            }
        }
        return false;
    }

    static List<int[]> occurrences(String text, String term) {
        List<int[]> spans = new ArrayList<>();
        Matcher m = Pattern.compile("(?<![a-z0-9])" + Pattern.quote(term) + "(?![a-z0-9])").matcher(text);
        while (m.find()) {
            spans.add(new int[] { m.start(), m.end() });
        }
        return spans;
    }

    static String matchableName(Location location) {
        if (location == null || location.name() == null) {
            return "";
        }
        String name = normalize(location.name()).trim();
        // "The Docks" is matched as "docks"
        if (name.startsWith("the ") && name.length() > 4) {
            name = name.substring(4);
        }
        return name;
    }

    static String normalize(String text) {
        return text.toLowerCase(Locale.ROOT)
                .replace('’', '\'')
                .replace('‘', '\'');
    }

    private static List<String> sentences(String text) {
        List<String> result = new ArrayList<>();
        for (String s : SENTENCE_BREAK.split(text)) {
            if (!s.isBlank()) {
                result.add(s);
            }
        }
        return result;
    }

    private static String clauseAround(String sentence, int position) {
        int start = 0;
        int end = sentence.length();
        Matcher m = CLAUSE_BREAK.matcher(sentence);
        while (m.find()) {
            if (m.end() <= position) {
                start = m.end();
            } else if (m.start() >= position) {
                end = m.start();
                break;
            }
        }
        return sentence.substring(start, end);
    }

    private static boolean denied(String clause) {
        for (String denial : DENIALS) {
            if (clause.contains(denial)) {
                return true;
            }
        }
        return false;
    }
}
