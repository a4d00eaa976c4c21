package com.semver.version;

/**
 * Precedence ordering between versions. Build metadata never takes part in it.
 */
public final class Precedence {

    private Precedence() {
    }

    public static int compare(Version a, Version b) {
        if (a.major() != b.major()) {
            return Long.compare(a.major(), b.major());
        }
        if (a.minor() != b.minor()) {
            return Long.compare(a.minor(), b.minor());
        }
        if (a.patch() != b.patch()) {
            return Long.compare(a.patch(), b.patch());
        }
        return comparePreRelease(a.preRelease().orElse(null), b.preRelease().orElse(null));
    }

    /**
     * Compares two pre-release sections, {@code null} meaning absent. A release sorts after
     * any pre-release of the same core version.
     */
    public static int comparePreRelease(String a, String b) {
        if (a == null && b == null) {
            return 0;
        }
        if (a == null) {
            return 1;
        }
        if (b == null) {
            return -1;
        }

        String[] left = a.split("\\.", -1);
        String[] right = b.split("\\.", -1);
        int shared = Math.min(left.length, right.length);
        for (int i = 0; i < shared; i++) {
            int result = compareIdentifiers(left[i], right[i]);
            if (result != 0) {
                return result;
            }
        }
        return Integer.compare(left.length, right.length);
    }

    /**
     * Identifiers that parse fully as 64-bit signed integers compare by value and sort before
     * all others; the rest compare in ASCII order.
     */
    public static int compareIdentifiers(String a, String b) {
        Long left = parseInteger(a);
        Long right = parseInteger(b);

        if (left != null && right != null) {
            return Long.compare(left, right);
        }
        if (left != null) {
            return -1;
        }
        if (right != null) {
            return 1;
        }
        return Integer.signum(a.compareTo(b));
    }

    // Signed forms such as "-1" count as integers; digit runs beyond the long range do not.
    static Long parseInteger(String identifier) {
        try {
            return Long.parseLong(identifier);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
