package com.cnj.saude.analysis;

import com.cnj.saude.config.PipelineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs pipeline 2 over the files pipeline 1 persisted: the national file first, then each
 * regional file when regional analysis is enabled.
 */
public class AnalysisPipeline {

    private static final Logger log = LoggerFactory.getLogger(AnalysisPipeline.class);

    public static final String NATIONAL_CONTEXT = "Brasil Consolidado";
    public static final String REGIONAL_CONTEXT_PREFIX = "Regional ";

    private final PipelineConfig config;
    private final FrequencyAnalyzer analyzer;

    public AnalysisPipeline(PipelineConfig config) {
        this.config = config;
        this.analyzer = new FrequencyAnalyzer(config);
    }

    /**
     * @throws com.cnj.saude.config.ConfigurationException if the national file does not exist
     */
    public AnalysisReport run() throws IOException {
        config.validateForAnalysis();

        List<AnalysisResult> results = new ArrayList<>();
        results.add(analyzer.analyze(NATIONAL_CONTEXT, config.getConsolidatedFile()));

        if (config.isIncludeRegional()) {
            List<Path> regionalFiles = config.listRegionalFiles();
            if (regionalFiles.isEmpty()) {
                log.warn("No regional file found in {} for regional analysis", config.getRegionalOutputDir());
            }
            for (Path file : regionalFiles) {
                String context = REGIONAL_CONTEXT_PREFIX + PipelineConfig.groupNameOf(file);
                results.add(analyzer.analyze(context, file));
            }
        }

        AnalysisReport report = AnalysisReport.of(results);
        log.info("Analysis produced {} section(s), {} table(s)", report.getSections().size(), report.getTables().size());
        return report;
    }
}
