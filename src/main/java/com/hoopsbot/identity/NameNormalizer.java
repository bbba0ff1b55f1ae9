package com.hoopsbot.identity;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Canonical comparison keys for player display names.
 *
 * <pre>
 *   "Nikola Jokić"            -> "nikola jokic"
 *   "C.J. McCollum"           -> "cj mccollum"
 *   "C. J. McCollum"          -> "cj mccollum"
 *   "Jaren Jackson Jr."       -> "jaren jackson"
 *   "Gilgeous-Alexander"      -> "gilgeousalexander"
 *   "Nah'Shon (Bones) Hyland" -> "nahshon bones hyland"
 * </pre>
 */
public final class NameNormalizer {
    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern SEPARATORS = Pattern.compile("[.,]");
    private static final Pattern JOINERS = Pattern.compile("['’`\\-]");
    private static final Pattern OTHER_PUNCTUATION = Pattern.compile("[^\\p{L}\\p{N}\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Set<String> SUFFIXES = Set.of("jr", "sr", "ii", "iii", "iv");

    private NameNormalizer() {
    }

    public static String normalize(String rawName) {
        if (rawName == null || rawName.isBlank()) {
            throw new InvalidNameException("player name is empty");
        }
        String decomposed = Normalizer.normalize(rawName, Normalizer.Form.NFKD);
        String ascii = COMBINING_MARKS.matcher(decomposed).replaceAll("");
        String lower = ascii.toLowerCase(Locale.ROOT);
        String joined = JOINERS.matcher(lower).replaceAll("");
        String separated = SEPARATORS.matcher(joined).replaceAll(" ");
        String stripped = OTHER_PUNCTUATION.matcher(separated).replaceAll("");

        List<String> tokens = new ArrayList<>();
        for (String token : WHITESPACE.split(stripped.trim())) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        // "c j mccollum" came from "C.J." or "C. J."; rejoin the initials first
        tokens = collapseLeadingInitials(tokens);
        while (tokens.size() > 2 && SUFFIXES.contains(tokens.get(tokens.size() - 1))) {
            tokens.remove(tokens.size() - 1);
        }
        if (tokens.isEmpty()) {
            throw new InvalidNameException("player name has no letters: '" + rawName + "'");
        }
        return String.join(" ", tokens);
    }

    /**
     * Key for the last-name/first-initial fallback, e.g. {@code "cj mccollum" -> "mccollum c"}.
     * Single-token keys are returned unchanged.
     */
    public static String lastNameFirstInitial(String normalizedKey) {
        String[] parts = normalizedKey.split(" ");
        if (parts.length < 2) {
            return normalizedKey;
        }
        return parts[parts.length - 1] + " " + parts[0].charAt(0);
    }

    private static List<String> collapseLeadingInitials(List<String> tokens) {
        int run = 0;
        while (run < tokens.size() && tokens.get(run).length() == 1) {
            run++;
        }
        if (run < 2) {
            return tokens;
        }
        List<String> out = new ArrayList<>();
        StringBuilder initials = new StringBuilder();
        for (int i = 0; i < run; i++) {
            initials.append(tokens.get(i));
        }
        out.add(initials.toString());
        out.addAll(tokens.subList(run, tokens.size()));
        return out;
    }
}
