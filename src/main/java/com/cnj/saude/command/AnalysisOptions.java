package com.cnj.saude.command;

import com.cnj.saude.config.PipelineConfig;
import picocli.CommandLine.Option;

public class AnalysisOptions {

    @Option(names = {"--include-regional"}, description = "Also analyse each regional file")
    boolean includeRegional;

    @Option(names = {"-n", "--top-n"}, description = "Values listed per table before the 'Outros' row")
    Integer topN;

    @Option(names = {"--multi-valued"}, description = "Count each item of a multi-valued cell separately")
    boolean multiValued;

    @Option(names = {"--skip-pdf"}, description = "Do not write the PDF report")
    boolean skipPdf;

    void applyTo(PipelineConfig config) {
        if (includeRegional) {
            config.setIncludeRegional(true);
        }
        if (topN != null) {
            config.setTopN(topN);
        }
        if (multiValued) {
            config.setMultiValued(true);
        }
        if (skipPdf) {
            config.setPdfEnabled(false);
        }
    }
}
