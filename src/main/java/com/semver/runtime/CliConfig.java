package com.semver.runtime;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class CliConfig {
    private OutputConfig output = new OutputConfig();

    public OutputConfig getOutput() {
        return output;
    }

    public void setOutput(OutputConfig output) {
        this.output = output == null ? new OutputConfig() : output;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class OutputConfig {
        private String format = "text";
        private boolean prettyPrint = true;

        public String getFormat() {
            return format;
        }

        public void setFormat(String format) {
            this.format = format == null || format.isBlank() ? "text" : format;
        }

        public boolean isPrettyPrint() {
            return prettyPrint;
        }

        public void setPrettyPrint(boolean prettyPrint) {
            this.prettyPrint = prettyPrint;
        }
    }
}
