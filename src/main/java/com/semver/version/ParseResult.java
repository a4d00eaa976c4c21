package com.semver.version;

import java.util.Optional;

/**
 * Outcome of {@link VersionParser#parse(String)}: exactly one of {@code version} and
 * {@code error} is set.
 */
public record ParseResult(String input, Version version, ParseError error) {

    public static ParseResult success(String input, Version version) {
        return new ParseResult(input, version, null);
    }

    public static ParseResult failure(String input, ParseError error) {
        return new ParseResult(input, null, error);
    }

    public boolean isSuccess() {
        return version != null;
    }

    public Optional<Version> toOptional() {
        return Optional.ofNullable(version);
    }

    public Version orElseThrow() {
        if (!isSuccess()) {
            throw new VersionParseException(input, error);
        }
        return version;
    }
}
