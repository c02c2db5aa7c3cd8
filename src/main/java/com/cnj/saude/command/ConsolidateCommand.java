package com.cnj.saude.command;

import com.cnj.saude.config.PipelineConfig;
import com.cnj.saude.extract.ConsolidationResult;
import com.cnj.saude.extract.Consolidator;
import com.cnj.saude.report.ConsoleReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.util.concurrent.Callable;

@Command(
    name = "consolidate",
    description = "Merge the persisted regional files into the national file",
    mixinStandardHelpOptions = true
)
public class ConsolidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ConsolidateCommand.class);

    @Mixin
    ConfigOptions configOptions;

    @Override
    public Integer call() {
        try {
            PipelineConfig config = configOptions.buildConfig();
            config.validateForConsolidation();

            ConsolidationResult result = new Consolidator(config).consolidateDirectory();
            new ConsoleReporter(config.isQuiet(), config.getTopN()).printConsolidation(result);
            return ExitCodes.OK;
        } catch (Exception e) {
            return ExitCodes.fail(e, log);
        }
    }
}
