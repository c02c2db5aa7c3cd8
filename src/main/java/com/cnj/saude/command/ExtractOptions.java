package com.cnj.saude.command;

import com.cnj.saude.config.PipelineConfig;
import picocli.CommandLine.Option;

import java.util.List;

public class ExtractOptions {

    @Option(names = {"--regions"}, split = ",", description = "Regions to process, e.g. NE,SE")
    List<String> regions;

    @Option(names = {"--strict-schema"}, description = "Skip tabular files that lack a projected column")
    boolean strictSchema;

    void applyTo(PipelineConfig config) {
        if (regions != null && !regions.isEmpty()) {
            config.setRegions(regions);
        }
        if (strictSchema) {
            config.setStrictSchema(true);
        }
    }
}
