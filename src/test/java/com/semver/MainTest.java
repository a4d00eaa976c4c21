package com.semver;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import picocli.CommandLine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MainTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @Test
    void shouldPrintParsedFields() {
        int exitCode = execute("--mode", "parse", "1.2.3-rc.1+42");

        assertEquals(Main.EXIT_OK, exitCode);
        assertEquals("1.2.3-rc.1+42: major=1 minor=2 patch=3 preRelease=rc.1 build=42 version=1.2.3-rc.1+42",
                out.toString().trim());
    }

    @Test
    void shouldReportDiagnosticAndFailForInvalidVersion() {
        int exitCode = execute("1.0.0", "1.00.0");

        assertEquals(Main.EXIT_INVALID_VERSION, exitCode);
        String output = out.toString();
        assertTrue(output.contains("1.0.0: major=1"));
        assertTrue(output.contains("1.00.0: invalid version core: minor: leading zero is not allowed (at position 3)"));
    }

    @Test
    void shouldValidateEachArgument() {
        int exitCode = execute("--mode", "validate", "1.0.0-alpha", "1.0.");

        assertEquals(Main.EXIT_INVALID_VERSION, exitCode);
        String[] lines = out.toString().trim().split("\\R");
        assertEquals("1.0.0-alpha: valid", lines[0]);
        assertEquals("1.0.: invalid (invalid version core: patch: unexpected end of input (at position 4))", lines[1]);
    }

    @Test
    void shouldCompareTwoVersionsByPrecedence() {
        assertEquals(Main.EXIT_OK, execute("--mode", "compare", "1.0.0-rc.1", "1.0.0"));
        assertEquals("1.0.0-rc.1 < 1.0.0", out.toString().trim());
    }

    @Test
    void shouldReportEqualPrecedenceRegardlessOfBuild() {
        assertEquals(Main.EXIT_OK, execute("--mode", "compare", "1.0.0+build2", "1.0.0+build1"));
        assertEquals("1.0.0+build2 == 1.0.0+build1", out.toString().trim());
    }

    @Test
    void shouldFailCompareWhenEitherSideIsInvalid() {
        int exitCode = execute("--mode", "compare", "1.0.0", "1.0.0-");

        assertEquals(Main.EXIT_INVALID_VERSION, exitCode);
        assertTrue(err.toString().contains("1.0.0-: invalid pre-release: expected alphanumeric identifier"));
    }

    @Test
    void shouldRequireExactlyTwoVersionsInCompareMode() {
        assertEquals(Main.EXIT_USAGE_ERROR, execute("--mode", "compare", "1.0.0"));
    }

    @Test
    void shouldRequireAtLeastOneVersion() {
        assertEquals(Main.EXIT_USAGE_ERROR, execute("--mode", "parse"));
    }

    @Test
    void shouldRenderJsonReports() throws IOException {
        int exitCode = execute("--format", "json", "1.0.0-alpha.1+001", "01.0.0");

        assertEquals(Main.EXIT_INVALID_VERSION, exitCode);
        JsonNode reports = new ObjectMapper().readTree(out.toString());
        assertEquals(2, reports.size());

        JsonNode valid = reports.get(0);
        assertTrue(valid.get("valid").asBoolean());
        assertEquals(1, valid.get("major").asInt());
        assertEquals("alpha.1", valid.get("preRelease").asText());
        assertEquals("001", valid.get("build").asText());
        assertFalse(valid.has("error"));

        JsonNode invalid = reports.get(1);
        assertFalse(invalid.get("valid").asBoolean());
        assertEquals(1, invalid.get("error").get("position").asInt());
        assertEquals("MAJOR", invalid.get("error").get("section").asText());
        assertEquals("LEADING_ZERO", invalid.get("error").get("reason").asText());
    }

    @Test
    void shouldTakeOutputFormatFromConfig() throws IOException {
        Path configPath = tempDir.resolve("semver.yml");
        Files.writeString(configPath, """
                output:
                  format: json
                  prettyPrint: false
                """);

        int exitCode = execute("--config", configPath.toString(), "--mode", "compare", "1.0.0-beta.2", "1.0.0-beta.11");

        assertEquals(Main.EXIT_OK, exitCode);
        String output = out.toString().trim();
        assertFalse(output.contains("\n"));
        JsonNode report = new ObjectMapper().readTree(output);
        assertEquals("<", report.get("relation").asText());
        assertTrue(report.get("before").asBoolean());
        assertFalse(report.get("equal").asBoolean());
    }

    @Test
    void shouldLetFormatFlagOverrideConfig() throws IOException {
        Path configPath = tempDir.resolve("semver.yml");
        Files.writeString(configPath, """
                output:
                  format: json
                """);

        int exitCode = execute("--config", configPath.toString(), "--format", "text", "2.0.0");

        assertEquals(Main.EXIT_OK, exitCode);
        assertTrue(out.toString().startsWith("2.0.0: major=2"));
    }

    @Test
    void shouldRejectUnknownOutputFormatInConfig() throws IOException {
        Path configPath = tempDir.resolve("semver.yml");
        Files.writeString(configPath, """
                output:
                  format: xml
                """);

        assertEquals(Main.EXIT_CONFIG_ERROR, execute("--config", configPath.toString(), "1.0.0"));
    }

    @Test
    void shouldReturnConfigErrorWhenConfigCannotBeRead() throws IOException {
        Path configPath = tempDir.resolve("broken.yml");
        Files.writeString(configPath, "output: [unclosed\n");

        assertEquals(Main.EXIT_CONFIG_ERROR, execute("--config", configPath.toString(), "1.0.0"));
        assertEquals("", out.toString());
    }

    private int execute(String... args) {
        CommandLine commandLine = new CommandLine(new Main());
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        String[] withConfig = args;
        if (!String.join(" ", args).contains("--config")) {
            withConfig = new String[args.length + 2];
            withConfig[0] = "--config";
            withConfig[1] = tempDir.resolve("missing.yml").toString();
            System.arraycopy(args, 0, withConfig, 2, args.length);
        }
        return commandLine.execute(withConfig);
    }
}
