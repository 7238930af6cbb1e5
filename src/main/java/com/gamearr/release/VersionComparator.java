package com.gamearr.release;

import java.util.Comparator;

/**
 * Orders dot-separated numeric versions. Missing components count as zero, so
 * {@code 1.0} and {@code 1.0.0} are equal; non-numeric components also count as zero.
 */
public final class VersionComparator implements Comparator<String> {

    public static final VersionComparator INSTANCE = new VersionComparator();

    private VersionComparator() {}

    @Override
    public int compare(String a, String b) {
        return compareVersions(a, b);
    }

    public static int compareVersions(String a, String b) {
        String[] left = split(a);
        String[] right = split(b);
        int len = Math.max(left.length, right.length);
        for (int i = 0; i < len; i++) {
            long l = i < left.length ? component(left[i]) : 0;
            long r = i < right.length ? component(right[i]) : 0;
            if (l > r) return 1;
            if (l < r) return -1;
        }
        return 0;
    }

    public static boolean isNewer(String candidate, String installed) {
        return compareVersions(candidate, installed) > 0;
    }

    private static String[] split(String version) {
        if (version == null || version.isBlank()) {
            return new String[0];
        }
        return version.trim().split("\\.");
    }

    private static long component(String part) {
        try {
            return Long.parseLong(part.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
