package com.gamearr.release;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Reduces release and catalog titles to a comparable lower-case word sequence.
 */
public final class TitleNormalizer {

    private static final Pattern APOSTROPHES = Pattern.compile("['‘’`]");
    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    // Longest numerals first so "VIII" is not consumed as "V" + "III".
    private static final String[][] ROMAN_NUMERALS = {
            {"VIII", "8"}, {"VII", "7"}, {"III", "3"}, {"II", "2"}, {"IX", "9"},
            {"IV", "4"}, {"VI", "6"}, {"X", "10"}, {"V", "5"}, {"I", "1"}
    };

    private TitleNormalizer() {}

    public static String normalize(String text) {
        if (text == null) return "";
        String t = text.toLowerCase(Locale.ROOT);
        t = APOSTROPHES.matcher(t).replaceAll("");
        t = NON_ALNUM.matcher(t).replaceAll(" ");
        t = WHITESPACE.matcher(t).replaceAll(" ");
        return t.trim();
    }

    public static List<String> words(String normalized) {
        List<String> out = new ArrayList<>();
        if (normalized == null || normalized.isBlank()) {
            return out;
        }
        for (String w : WHITESPACE.split(normalized.trim())) {
            if (!w.isEmpty()) out.add(w);
        }
        return out;
    }

    /**
     * Builds an indexer query from a catalog title. Release names drop apostrophes
     * and spell sequel numerals as digits, so both are rewritten here.
     */
    public static String toSearchQuery(String title) {
        if (title == null) return "";
        String q = APOSTROPHES.matcher(title).replaceAll("");
        for (String[] numeral : ROMAN_NUMERALS) {
            q = q.replaceAll("(?<=\\s)" + numeral[0] + "(?=\\s|$)", numeral[1]);
        }
        return WHITESPACE.matcher(q).replaceAll(" ").trim();
    }
}
