package com.cnj.saude;

/**
 * Base class for failures raised by the extraction and analysis pipelines.
 */
public class PipelineException extends RuntimeException {

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
