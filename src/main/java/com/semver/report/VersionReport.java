package com.semver.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.semver.version.ParseError;
import com.semver.version.ParseResult;
import com.semver.version.Version;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record VersionReport(
        String input,
        boolean valid,
        Long major,
        Long minor,
        Long patch,
        String preRelease,
        String build,
        String version,
        ErrorDetail error) {

    public static VersionReport from(ParseResult result) {
        if (!result.isSuccess()) {
            ParseError error = result.error();
            return new VersionReport(result.input(), false, null, null, null, null, null, null,
                    new ErrorDetail(error.position(), error.section().name(), error.reason().name(), error.describe()));
        }
        Version version = result.version();
        return new VersionReport(
                result.input(),
                true,
                version.major(),
                version.minor(),
                version.patch(),
                version.preRelease().orElse(null),
                version.build().orElse(null),
                version.toString(),
                null);
    }

    public record ErrorDetail(int position, String section, String reason, String message) {
    }
}
