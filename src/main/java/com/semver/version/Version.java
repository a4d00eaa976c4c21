package com.semver.version;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A parsed semantic version. Instances come only from {@link VersionParser}, so every
 * field has already passed grammar validation.
 *
 * <p>Equality follows precedence rules: build metadata is ignored, pre-release is compared
 * as a raw string.
 */
public final class Version {
    private final long major;
    private final long minor;
    private final long patch;
    private final String preRelease;
    private final String build;

    Version(long major, long minor, long patch, String preRelease, String build) {
        this.major = major;
        this.minor = minor;
        this.patch = patch;
        this.preRelease = preRelease;
        this.build = build;
    }

    /**
     * Parses {@code value} and throws when it is not a valid semantic version.
     *
     * @throws VersionParseException carrying the position and cause of the first violation
     */
    public static Version parse(String value) {
        return VersionParser.standard().parse(value).orElseThrow();
    }

    public long major() {
        return major;
    }

    public long minor() {
        return minor;
    }

    public long patch() {
        return patch;
    }

    public Optional<String> preRelease() {
        return Optional.ofNullable(preRelease);
    }

    public Optional<String> build() {
        return Optional.ofNullable(build);
    }

    public List<String> preReleaseIdentifiers() {
        return splitIdentifiers(preRelease);
    }

    public List<String> buildIdentifiers() {
        return splitIdentifiers(build);
    }

    public boolean isPreRelease() {
        return preRelease != null;
    }

    /**
     * Returns true when this version has strictly lower precedence than {@code other}.
     */
    public boolean before(Version other) {
        return Precedence.compare(this, other) < 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Version)) {
            return false;
        }
        Version other = (Version) o;
        return major == other.major
                && minor == other.minor
                && patch == other.patch
                && Objects.equals(preRelease, other.preRelease);
    }

    @Override
    public int hashCode() {
        return Objects.hash(major, minor, patch, preRelease);
    }

    @Override
    public String toString() {
        StringBuilder rendered = new StringBuilder()
                .append(major).append('.')
                .append(minor).append('.')
                .append(patch);
        if (preRelease != null) {
            rendered.append('-').append(preRelease);
        }
        if (build != null) {
            rendered.append('+').append(build);
        }
        return rendered.toString();
    }

    private static List<String> splitIdentifiers(String section) {
        if (section == null) {
            return List.of();
        }
        return List.of(section.split("\\.", -1));
    }
}
