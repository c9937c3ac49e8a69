package com.boxoffice.config;

/**
 * Raised when the pipeline configuration is missing a required value or holds an
 * out-of-range one. Always fatal.
 */
public class PipelineConfigurationException extends RuntimeException {

    public PipelineConfigurationException(String message) {
        super(message);
    }

    public PipelineConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
