package com.cnj.saude.command;

import com.cnj.saude.config.ConfigurationException;
import com.cnj.saude.extract.ConsolidationException;
import org.slf4j.Logger;

/**
 * Process exit statuses of the subcommands.
 */
public final class ExitCodes {

    public static final int OK = 0;
    public static final int FAILURE = 1;
    public static final int CONFIGURATION_ERROR = 2;
    public static final int CONSOLIDATION_ERROR = 3;

    private ExitCodes() {
    }

    public static int forException(Exception e) {
        if (e instanceof ConfigurationException) {
            return CONFIGURATION_ERROR;
        }
        if (e instanceof ConsolidationException) {
            return CONSOLIDATION_ERROR;
        }
        return FAILURE;
    }

    /**
     * Prints the failure to stderr and maps it to an exit status.
     */
    static int fail(Exception e, Logger log) {
        System.err.println("Error: " + e.getMessage());
        log.debug("Command failed", e);
        return forException(e);
    }
}
