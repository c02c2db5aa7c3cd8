package com.cnj.saude.tabular;

import com.cnj.saude.PipelineException;

/**
 * The content of a tabular file could not be parsed from {@link #getLine()} on: a record the
 * lenient dialect still rejects, or bytes that are not valid in the configured encoding.
 * Failures of the underlying stream are not reported this way.
 */
public class MalformedTableException extends PipelineException {

    private final long line;

    public MalformedTableException(long line, Throwable cause) {
        super("Malformed content near line " + line + ": " + cause.getMessage(), cause);
        this.line = line;
    }

    public long getLine() {
        return line;
    }
}
