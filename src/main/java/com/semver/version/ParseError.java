package com.semver.version;

/**
 * Where and why a version string was rejected. {@code position} is the offset of the offending
 * character; everything before it is ASCII, so it is both a char index and a byte offset.
 */
public record ParseError(int position, Section section, Reason reason, String message) {

    public enum Section {
        MAJOR("invalid version core: major"),
        MINOR("invalid version core: minor"),
        PATCH("invalid version core: patch"),
        PRE_RELEASE("invalid pre-release"),
        BUILD("invalid build"),
        TRAILING("invalid version");

        private final String label;

        Section(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    public enum Reason {
        UNEXPECTED_END,
        UNEXPECTED_CHARACTER,
        LEADING_ZERO,
        MISSING_SEPARATOR,
        EMPTY_IDENTIFIER,
        NUMBER_OUT_OF_RANGE,
        TRAILING_CHARACTERS
    }

    public String describe() {
        return section.label() + ": " + message + " (at position " + position + ")";
    }
}
