package com.semver.version;

public class VersionParseException extends IllegalArgumentException {
    private final String input;
    private final ParseError error;

    public VersionParseException(String input, ParseError error) {
        super("Invalid semantic version '" + input + "': " + error.describe());
        this.input = input;
        this.error = error;
    }

    public String input() {
        return input;
    }

    public ParseError error() {
        return error;
    }
}
