package com.semver.version;

import java.util.regex.Pattern;

/**
 * Regular-expression check for the same grammar {@link VersionParser} accepts. It answers only
 * yes or no; use the parser when the caller needs to know why a string was rejected.
 */
public final class VersionPattern {
    private static final Pattern SEMVER = Pattern.compile(
            "^(0|[1-9]\\d*)\\.(0|[1-9]\\d*)\\.(0|[1-9]\\d*)"
                    + "(?:-([0-9A-Za-z-]+(?:\\.[0-9A-Za-z-]+)*))?"
                    + "(?:\\+([0-9A-Za-z-]+(?:\\.[0-9A-Za-z-]+)*))?$");

    private VersionPattern() {
    }

    public static boolean matches(String value) {
        return value != null && SEMVER.matcher(value).matches();
    }

    public static Pattern pattern() {
        return SEMVER;
    }
}
