package com.semver;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.semver.report.ComparisonReport;
import com.semver.report.VersionReport;
import com.semver.runtime.CliConfig;
import com.semver.version.ParseResult;
import com.semver.version.VersionParser;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

@Command(
        name = "semver",
        mixinStandardHelpOptions = true,
        version = "semver 0.1.0",
        description = "Parse, validate and compare Semantic Versioning 2.0 version strings.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_INVALID_VERSION = 1;
    static final int EXIT_USAGE_ERROR = 2;
    static final int EXIT_CONFIG_ERROR = 3;

    @Spec
    CommandSpec spec;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "semver.yml")
    Path configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "parse")
    Mode mode;

    @Option(names = "--format", description = "Output format: ${COMPLETION-CANDIDATES} (overrides output.format from config)")
    OutputFormat format;

    @Parameters(arity = "0..*", paramLabel = "VERSION", description = "Version strings to process")
    List<String> versions = new ArrayList<>();

    private final VersionParser parser = VersionParser.standard();

    enum Mode {
        parse,
        validate,
        compare
    }

    enum OutputFormat {
        text,
        json
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        CliConfig config;
        try {
            config = loadConfig(configPath);
        } catch (IOException e) {
            log.error("Unable to read config file {}: {}", configPath, e.getMessage());
            return EXIT_CONFIG_ERROR;
        }

        OutputFormat outputFormat;
        try {
            outputFormat = resolveFormat(config);
        } catch (IllegalArgumentException e) {
            log.error("Unsupported output.format '{}' in {}", config.getOutput().getFormat(), configPath);
            return EXIT_CONFIG_ERROR;
        }
        if (versions == null || versions.isEmpty()) {
            log.error("At least one VERSION argument is required in {} mode", mode);
            return EXIT_USAGE_ERROR;
        }
        log.debug("Running mode={} format={} inputs={}", mode, outputFormat, versions.size());

        try {
            if (mode == Mode.compare) {
                return runCompare(outputFormat, config);
            }
            return runParse(outputFormat, config);
        } catch (JsonProcessingException e) {
            log.error("Failed to render output", e);
            return CommandLine.ExitCode.SOFTWARE;
        }
    }

    private int runParse(OutputFormat outputFormat, CliConfig config) throws JsonProcessingException {
        PrintWriter out = spec.commandLine().getOut();
        List<VersionReport> reports = new ArrayList<>();
        boolean allValid = true;
        for (String input : versions) {
            ParseResult result = parser.parse(input);
            if (!result.isSuccess()) {
                allValid = false;
                log.warn("Rejected version '{}': {}", input, result.error().describe());
            }
            reports.add(VersionReport.from(result));
        }

        if (outputFormat == OutputFormat.json) {
            out.println(jsonWriter(config).writeValueAsString(reports));
        } else {
            for (VersionReport report : reports) {
                out.println(mode == Mode.validate ? describeValidity(report) : describeFields(report));
            }
        }
        out.flush();
        return allValid ? EXIT_OK : EXIT_INVALID_VERSION;
    }

    private int runCompare(OutputFormat outputFormat, CliConfig config) throws JsonProcessingException {
        PrintWriter out = spec.commandLine().getOut();
        if (versions.size() != 2) {
            log.error("compare mode requires exactly two versions, got {}", versions.size());
            return EXIT_USAGE_ERROR;
        }

        ParseResult left = parser.parse(versions.get(0));
        ParseResult right = parser.parse(versions.get(1));
        if (!left.isSuccess() || !right.isSuccess()) {
            PrintWriter err = spec.commandLine().getErr();
            for (ParseResult result : List.of(left, right)) {
                if (!result.isSuccess()) {
                    err.println(result.input() + ": " + result.error().describe());
                }
            }
            err.flush();
            return EXIT_INVALID_VERSION;
        }

        ComparisonReport report = ComparisonReport.of(left.version(), right.version());
        if (outputFormat == OutputFormat.json) {
            out.println(jsonWriter(config).writeValueAsString(report));
        } else {
            out.println(report.describe());
        }
        out.flush();
        return EXIT_OK;
    }

    CliConfig loadConfig(Path config) throws IOException {
        if (config == null || !Files.exists(config)) {
            return new CliConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        CliConfig loaded = mapper.readValue(config.toFile(), CliConfig.class);
        return loaded == null ? new CliConfig() : loaded;
    }

    private OutputFormat resolveFormat(CliConfig config) {
        if (format != null) {
            return format;
        }
        return OutputFormat.valueOf(config.getOutput().getFormat().trim().toLowerCase(Locale.ROOT));
    }

    private ObjectWriter jsonWriter(CliConfig config) {
        ObjectMapper mapper = JsonMapper.builder().build();
        return config.getOutput().isPrettyPrint() ? mapper.writerWithDefaultPrettyPrinter() : mapper.writer();
    }

    private static String describeFields(VersionReport report) {
        if (!report.valid()) {
            return report.input() + ": " + report.error().message();
        }
        return report.input() + ": major=" + report.major()
                + " minor=" + report.minor()
                + " patch=" + report.patch()
                + " preRelease=" + (report.preRelease() == null ? "" : report.preRelease())
                + " build=" + (report.build() == null ? "" : report.build())
                + " version=" + report.version();
    }

    private static String describeValidity(VersionReport report) {
        if (!report.valid()) {
            return report.input() + ": invalid (" + report.error().message() + ")";
        }
        return report.input() + ": valid";
    }
}
