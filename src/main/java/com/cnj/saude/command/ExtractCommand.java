package com.cnj.saude.command;

import com.cnj.saude.config.PipelineConfig;
import com.cnj.saude.extract.ArchiveLocator;
import com.cnj.saude.extract.ExtractionPipeline;
import com.cnj.saude.extract.ExtractionSummary;
import com.cnj.saude.extract.SourceGroup;
import com.cnj.saude.report.ConsoleReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Command(
    name = "extract",
    description = "Filter health cases out of the regional archives and consolidate them",
    mixinStandardHelpOptions = true
)
public class ExtractCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ExtractCommand.class);

    @Mixin
    ConfigOptions configOptions;

    @Mixin
    ExtractOptions extractOptions;

    @Option(names = {"--dry-run"}, description = "List the archives that would be read without reading them",
        defaultValue = "false")
    boolean dryRun;

    @Override
    public Integer call() {
        try {
            PipelineConfig config = configOptions.buildConfig();
            extractOptions.applyTo(config);

            if (dryRun) {
                printDryRun(config);
                return ExitCodes.OK;
            }

            extract(config);
            return ExitCodes.OK;
        } catch (Exception e) {
            return ExitCodes.fail(e, log);
        }
    }

    static ExtractionSummary extract(PipelineConfig config) throws IOException {
        ConsoleReporter reporter = new ConsoleReporter(config.isQuiet(), config.getTopN());
        reporter.printExtractionHeader(config);
        ExtractionSummary summary = new ExtractionPipeline(config, reporter).run();
        reporter.printExtractionResults(summary);
        return summary;
    }

    private void printDryRun(PipelineConfig config) {
        System.out.println("\n=== DRY RUN - No archive will be read ===\n");
        System.out.println("Configuration:");
        System.out.printf("  Input:           %s%n", config.getInputRoot().toAbsolutePath());
        System.out.printf("  Regions:         %s%n", String.join(", ", config.getRegions()));
        System.out.printf("  Subject codes:   %d%n", config.getSubjectCodes().size());
        System.out.printf("  Strict schema:   %s%n", config.isStrictSchema());
        System.out.printf("  Regional output: %s%n", config.getRegionalOutputDir());
        System.out.printf("  Consolidated:    %s%n", config.getConsolidatedFile());

        List<SourceGroup> groups;
        try (Stream<SourceGroup> located = new ArchiveLocator(config).locate()) {
            groups = located.collect(Collectors.toList());
        }
        System.out.println("\nArchives to read:");
        int total = 0;
        for (SourceGroup group : groups) {
            System.out.printf("  %-6s %d archive(s) in %s%n", group.name(), group.archives().size(), group.directory());
            total += group.archives().size();
        }
        System.out.printf("  TOTAL:  %d%n", total);
    }
}
