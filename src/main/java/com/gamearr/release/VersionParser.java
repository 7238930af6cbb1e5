package com.gamearr.release;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a version token from a release title. Patterns are tried in order and the
 * first hit wins; titles matching none of them simply have no version.
 */
public final class VersionParser {

    private static final List<Pattern> PATTERNS = List.of(
            // v1.2.3 after a separator
            Pattern.compile("[._\\s-]v(\\d+(?:\\.\\d+)+)", Pattern.CASE_INSENSITIVE),
            // v1 as its own token
            Pattern.compile("[._\\s-]v(\\d+)(?:[._\\s-]|$)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^v(\\d+(?:\\.\\d+)*)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("version[.\\s_]?(\\d+(?:\\.\\d+)*)", Pattern.CASE_INSENSITIVE),
            // bare run of three or more dotted numbers
            Pattern.compile("[._\\s-](\\d+(?:\\.\\d+){2,})(?:[._\\s-]|$)"),
            Pattern.compile("build[.\\s_]?(\\d+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("update[.\\s_]?(\\d+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("[._\\s-]u(\\d+)(?:[._\\s-]|$)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("[._\\s-]r(\\d+)(?:[._\\s-]|$)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("patch[.\\s_]?(\\d+(?:\\.\\d+)*)", Pattern.CASE_INSENSITIVE)
    );

    private VersionParser() {}

    public static Optional<String> parse(String title) {
        if (title == null || title.isBlank()) {
            return Optional.empty();
        }
        for (Pattern p : PATTERNS) {
            Matcher m = p.matcher(title);
            if (m.find()) {
                return Optional.of(m.group(1));
            }
        }
        return Optional.empty();
    }
}
