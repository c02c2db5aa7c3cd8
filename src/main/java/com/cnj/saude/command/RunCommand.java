package com.cnj.saude.command;

import com.cnj.saude.config.PipelineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.util.concurrent.Callable;

@Command(
    name = "run",
    description = "Run extraction followed by analysis",
    mixinStandardHelpOptions = true
)
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    @Mixin
    ConfigOptions configOptions;

    @Mixin
    ExtractOptions extractOptions;

    @Mixin
    AnalysisOptions analysisOptions;

    @Override
    public Integer call() {
        try {
            PipelineConfig config = configOptions.buildConfig();
            extractOptions.applyTo(config);
            analysisOptions.applyTo(config);

            ExtractCommand.extract(config);
            AnalyzeCommand.analyze(config);
            return ExitCodes.OK;
        } catch (Exception e) {
            return ExitCodes.fail(e, log);
        }
    }
}
