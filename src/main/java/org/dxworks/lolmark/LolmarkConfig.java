package org.dxworks.lolmark;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.lolmark.generator.VariableResolution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

public class LolmarkConfig {

    private static final Logger logger = LoggerFactory.getLogger(LolmarkConfig.class);

    private static final String CONFIG_FILE_NAME = "lolmark-config.yml";
    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    private static final VariableResolution DEFAULT_VARIABLE_RESOLUTION = VariableResolution.SCOPED;
    private static final boolean DEFAULT_OPEN_IN_BROWSER = false;
    private static final boolean DEFAULT_WRITE_REPORT = false;

    private final int maxFileLines;
    private final VariableResolution variableResolution;
    private final boolean openInBrowser;
    private final boolean writeReport;

    private LolmarkConfig(int maxFileLines, VariableResolution variableResolution,
                          boolean openInBrowser, boolean writeReport) {
        this.maxFileLines = maxFileLines;
        this.variableResolution = variableResolution;
        this.openInBrowser = openInBrowser;
        this.writeReport = writeReport;
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    public VariableResolution getVariableResolution() {
        return variableResolution;
    }

    public boolean isOpenInBrowser() {
        return openInBrowser;
    }

    public boolean isWriteReport() {
        return writeReport;
    }

    public static LolmarkConfig defaults() {
        return new LolmarkConfig(DEFAULT_MAX_FILE_LINES, DEFAULT_VARIABLE_RESOLUTION,
                DEFAULT_OPEN_IN_BROWSER, DEFAULT_WRITE_REPORT);
    }

    public static LolmarkConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static LolmarkConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                int effectiveMaxFileLines = (yamlConfig.maxFileLines != null && yamlConfig.maxFileLines > 0)
                        ? yamlConfig.maxFileLines
                        : DEFAULT_MAX_FILE_LINES;
                boolean effectiveOpenInBrowser = (yamlConfig.openInBrowser != null)
                        ? yamlConfig.openInBrowser
                        : DEFAULT_OPEN_IN_BROWSER;
                boolean effectiveWriteReport = (yamlConfig.writeReport != null)
                        ? yamlConfig.writeReport
                        : DEFAULT_WRITE_REPORT;

                return new LolmarkConfig(effectiveMaxFileLines,
                        parseResolution(yamlConfig.variableResolution),
                        effectiveOpenInBrowser, effectiveWriteReport);
            }
        } catch (IOException e) {
            logger.warn("Could not read {}, using defaults: {}", configPath, e.getMessage());
        }

        return defaults();
    }

    public static LolmarkConfig with(int maxFileLines, VariableResolution variableResolution,
                                     boolean openInBrowser, boolean writeReport) {
        int effectiveMaxFileLines = maxFileLines > 0 ? maxFileLines : DEFAULT_MAX_FILE_LINES;
        VariableResolution effectiveResolution = variableResolution != null
                ? variableResolution
                : DEFAULT_VARIABLE_RESOLUTION;
        return new LolmarkConfig(effectiveMaxFileLines, effectiveResolution, openInBrowser, writeReport);
    }

    private static VariableResolution parseResolution(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT_VARIABLE_RESOLUTION;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return VariableResolution.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            logger.warn("Unknown variableResolution '{}', using {}", value, DEFAULT_VARIABLE_RESOLUTION);
            return DEFAULT_VARIABLE_RESOLUTION;
        }
    }

    private static class YamlConfig {
        public Integer maxFileLines;
        public String variableResolution;
        public Boolean openInBrowser;
        public Boolean writeReport;
    }
}
