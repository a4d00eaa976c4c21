package com.semver.version;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.semver.version.ParseError.Reason;
import com.semver.version.ParseError.Section;

/*

Grammar accepted by this parser (Semantic Versioning 2.0, with permissive identifiers):

<valid semver>   ::= <version core>
                   | <version core> "-" <pre-release>
                   | <version core> "+" <build>
                   | <version core> "-" <pre-release> "+" <build>
<version core>   ::= <numeric identifier> "." <numeric identifier> "." <numeric identifier>
<pre-release>    ::= <identifier> | <identifier> "." <pre-release>
<build>          ::= <identifier> | <identifier> "." <build>
<identifier>     ::= one or more of [0-9A-Za-z-]
<numeric identifier> ::= "0" | <positive digit> | <positive digit> <digits>

*/

/**
 * Hand-written recursive-descent parser for semantic versions.
 *
 * <p>The input is scanned once, left to right, with a single character of lookahead. The first
 * grammar violation ends the parse and is reported with its exact offset. Instances hold no
 * state and may be shared between threads.
 */
public class VersionParser {
    private static final Logger log = LoggerFactory.getLogger(VersionParser.class);
    private static final VersionParser STANDARD = new VersionParser();

    public static VersionParser standard() {
        return STANDARD;
    }

    public ParseResult parse(String input) {
        Objects.requireNonNull(input, "input");
        try {
            Version version = new Cursor(input).validSemver();
            return ParseResult.success(input, version);
        } catch (VersionParseException e) {
            ParseError error = e.error();
            log.debug("version.rejected input='{}' position={} section={} reason={}",
                    input, error.position(), error.section(), error.reason());
            return ParseResult.failure(input, error);
        }
    }

    public boolean isValid(String input) {
        return parse(input).isSuccess();
    }

    private static final class Cursor {
        private final String input;
        private int pos;

        Cursor(String input) {
            this.input = input;
        }

        Version validSemver() {
            long major = numericIdentifier(Section.MAJOR);
            separator(Section.MINOR);
            long minor = numericIdentifier(Section.MINOR);
            separator(Section.PATCH);
            long patch = numericIdentifier(Section.PATCH);

            String preRelease = null;
            if (match('-')) {
                pos++;
                preRelease = dotSeparatedIdentifiers(Section.PRE_RELEASE);
            }
            String build = null;
            if (match('+')) {
                pos++;
                build = dotSeparatedIdentifiers(Section.BUILD);
            }
            if (!atEnd()) {
                throw fail(Section.TRAILING, Reason.TRAILING_CHARACTERS,
                        "unexpected trailing characters: \"" + input.substring(pos) + "\"");
            }
            return new Version(major, minor, patch, preRelease, build);
        }

        private long numericIdentifier(Section section) {
            if (atEnd()) {
                throw fail(section, Reason.UNEXPECTED_END, "unexpected end of input");
            }
            if (match('0')) {
                pos++;
                if (matchDigit()) {
                    throw fail(section, Reason.LEADING_ZERO, "leading zero is not allowed");
                }
                return 0L;
            }

            int start = pos;
            char first = input.charAt(pos);
            if (first < '1' || first > '9') {
                throw fail(section, Reason.UNEXPECTED_CHARACTER, "expected positive digit, got " + current());
            }

            long value = 0L;
            while (matchDigit()) {
                int digit = input.charAt(pos) - '0';
                if (value > (Long.MAX_VALUE - digit) / 10) {
                    throw new VersionParseException(input, new ParseError(start, section, Reason.NUMBER_OUT_OF_RANGE,
                            "numeric identifier exceeds " + Long.MAX_VALUE));
                }
                value = value * 10 + digit;
                pos++;
            }
            return value;
        }

        private void separator(Section next) {
            if (!match('.')) {
                throw fail(next, Reason.MISSING_SEPARATOR, "missing dot separator");
            }
            pos++;
        }

        private String dotSeparatedIdentifiers(Section section) {
            int start = pos;
            identifier(section);
            while (match('.')) {
                pos++;
                identifier(section);
            }
            return input.substring(start, pos);
        }

        private void identifier(Section section) {
            int start = pos;
            while (!atEnd() && isIdentifierCharacter(input.charAt(pos))) {
                pos++;
            }
            if (pos == start) {
                throw fail(section, Reason.EMPTY_IDENTIFIER, "expected alphanumeric identifier, got " + current());
            }
        }

        private VersionParseException fail(Section section, Reason reason, String message) {
            return new VersionParseException(input, new ParseError(pos, section, reason, message));
        }

        private boolean atEnd() {
            return pos >= input.length();
        }

        private boolean match(char expected) {
            return !atEnd() && input.charAt(pos) == expected;
        }

        private boolean matchDigit() {
            return !atEnd() && isDigit(input.charAt(pos));
        }

        private String current() {
            return atEnd() ? "end of input" : "'" + input.charAt(pos) + "'";
        }
    }

    static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    static boolean isLetter(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
    }

    static boolean isIdentifierCharacter(char c) {
        return isDigit(c) || isLetter(c) || c == '-';
    }
}
