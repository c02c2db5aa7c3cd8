package com.cnj.saude.command;

import com.cnj.saude.config.PipelineConfig;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Options shared by every subcommand: the YAML file and the directory overrides.
 */
public class ConfigOptions {

    @Option(names = {"-f", "--config-file"}, description = "YAML configuration file")
    String configFile;

    @Option(names = {"-i", "--input-dir"}, description = "Root directory holding one subdirectory per region")
    Path inputDir;

    @Option(names = {"-r", "--regional-dir"}, description = "Directory for the per-region files")
    Path regionalDir;

    @Option(names = {"-o", "--output-dir"}, description = "Directory for the consolidated file")
    Path outputDir;

    @Option(names = {"--reports-dir"}, description = "Directory for CSV and PDF reports")
    Path reportsDir;

    @Option(names = {"-q", "--quiet"}, description = "Print compact results only", defaultValue = "false")
    boolean quiet;

    PipelineConfig buildConfig() throws IOException {
        PipelineConfig config = configFile != null ? PipelineConfig.fromYaml(configFile) : new PipelineConfig();

        // CLI options override config file
        if (inputDir != null) {
            config.setInputRoot(inputDir);
        }
        if (regionalDir != null) {
            config.setRegionalOutputDir(regionalDir);
        }
        if (outputDir != null) {
            config.setOutputDir(outputDir);
        }
        if (reportsDir != null) {
            config.setReportsDir(reportsDir);
        }
        config.setQuiet(quiet);
        return config;
    }
}
