package com.cnj.saude.command;

import com.cnj.saude.analysis.AnalysisPipeline;
import com.cnj.saude.analysis.AnalysisReport;
import com.cnj.saude.config.PipelineConfig;
import com.cnj.saude.report.ConsoleReporter;
import com.cnj.saude.report.CsvReportSink;
import com.cnj.saude.report.PdfReportSink;
import com.cnj.saude.report.ReportSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "analyze",
    description = "Compute frequency tables over the consolidated file and write the reports",
    mixinStandardHelpOptions = true
)
public class AnalyzeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeCommand.class);

    @Mixin
    ConfigOptions configOptions;

    @Mixin
    AnalysisOptions analysisOptions;

    @Override
    public Integer call() {
        try {
            PipelineConfig config = configOptions.buildConfig();
            analysisOptions.applyTo(config);
            analyze(config);
            return ExitCodes.OK;
        } catch (Exception e) {
            return ExitCodes.fail(e, log);
        }
    }

    static AnalysisReport analyze(PipelineConfig config) throws IOException {
        AnalysisReport report = new AnalysisPipeline(config).run();
        for (ReportSink sink : sinksFor(config)) {
            sink.publish(report);
        }
        return report;
    }

    static List<ReportSink> sinksFor(PipelineConfig config) {
        List<ReportSink> sinks = new ArrayList<>();
        sinks.add(new ConsoleReporter(config.isQuiet(), config.getTopN()));
        sinks.add(new CsvReportSink(config));
        if (config.isPdfEnabled()) {
            sinks.add(new PdfReportSink(config));
        }
        return sinks;
    }
}
