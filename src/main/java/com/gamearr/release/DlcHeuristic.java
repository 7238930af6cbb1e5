package com.gamearr.release;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Flags releases that are add-ons or upgraded editions rather than the base game.
 */
public final class DlcHeuristic {

    private static final List<Pattern> CONTENT_PHRASES = List.of(
            phrase("DLC"),
            phrase("Expansion"),
            phrase("Season Pass"),
            phrase("Deluxe Edition"),
            phrase("Complete Edition"),
            phrase("GOTY"),
            phrase("Game of the Year"),
            phrase("Ultimate Edition"),
            phrase("Gold Edition"),
            phrase("Premium Edition"),
            phrase("Collector'?s Edition"),
            phrase("Definitive Edition"),
            phrase("Legendary Edition")
    );

    // A dash needs whitespace in front so group tags glued to the title ("Title-CODEX") do not count.
    private static final List<Pattern> TRAILING_CONTENT = List.of(
            Pattern.compile("^\\s+-\\s*\\w+"),
            Pattern.compile("^\\s*:\\s*\\w+"),
            Pattern.compile("^\\s*\\+"),
            Pattern.compile("^\\s*and\\b"),
            Pattern.compile("^\\s*with\\b")
    );

    private static final int MIN_TRAILING_LENGTH = 5;

    private DlcHeuristic() {}

    public static boolean isAdditionalContent(String releaseTitle, String catalogTitle) {
        if (releaseTitle == null || releaseTitle.isBlank()) {
            return false;
        }
        for (Pattern p : CONTENT_PHRASES) {
            if (p.matcher(releaseTitle).find()) {
                return true;
            }
        }
        if (catalogTitle == null || catalogTitle.isBlank()) {
            return false;
        }
        String lowerRelease = releaseTitle.toLowerCase(Locale.ROOT);
        String lowerCatalog = catalogTitle.toLowerCase(Locale.ROOT);
        int idx = lowerRelease.indexOf(lowerCatalog);
        if (idx < 0) {
            return false;
        }
        String remainder = lowerRelease.substring(idx + lowerCatalog.length());
        if (remainder.trim().length() <= MIN_TRAILING_LENGTH) {
            return false;
        }
        for (Pattern p : TRAILING_CONTENT) {
            if (p.matcher(remainder).find()) {
                return true;
            }
        }
        return false;
    }

    private static Pattern phrase(String words) {
        return Pattern.compile("\\b" + words + "\\b", Pattern.CASE_INSENSITIVE);
    }
}
