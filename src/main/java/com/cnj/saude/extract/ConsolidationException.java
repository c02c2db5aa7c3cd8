package com.cnj.saude.extract;

import com.cnj.saude.PipelineException;

/**
 * Thrown when there is nothing to consolidate. An empty national file would look like a
 * successful run to the analysis step, so this is fatal.
 */
public class ConsolidationException extends PipelineException {

    public ConsolidationException(String message) {
        super(message);
    }
}
