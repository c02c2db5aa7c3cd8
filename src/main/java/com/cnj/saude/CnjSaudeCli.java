package com.cnj.saude;

import ch.qos.logback.classic.Level;
import com.cnj.saude.command.AnalyzeCommand;
import com.cnj.saude.command.ConsolidateCommand;
import com.cnj.saude.command.ExtractCommand;
import com.cnj.saude.command.RunCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

@Command(
    name = "cnj-saude",
    mixinStandardHelpOptions = true,
    version = "cnj-saude 1.0.0",
    description = "Extracts health-litigation cases from CNJ court exports and reports frequency statistics",
    subcommands = {
        ExtractCommand.class,
        ConsolidateCommand.class,
        AnalyzeCommand.class,
        RunCommand.class
    }
)
public class CnjSaudeCli implements Callable<Integer> {

    static final String BASE_LOGGER = "com.cnj.saude";

    public static void main(String[] args) {
        System.exit(newCommandLine().execute(args));
    }

    public static CommandLine newCommandLine() {
        return new CommandLine(new CnjSaudeCli())
            .setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Option(names = {"-v", "--verbose"}, description = "Enable debug logging")
    void setVerbose(boolean verbose) {
        if (verbose) {
            Logger logger = LoggerFactory.getLogger(BASE_LOGGER);
            if (logger instanceof ch.qos.logback.classic.Logger) {
                ((ch.qos.logback.classic.Logger) logger).setLevel(Level.DEBUG);
            }
        }
    }

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }
}
