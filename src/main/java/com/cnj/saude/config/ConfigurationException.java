package com.cnj.saude.config;

import com.cnj.saude.PipelineException;

/**
 * Thrown when a configured directory or file is missing or unusable.
 * Always fatal: raised before any processing starts.
 */
public class ConfigurationException extends PipelineException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
