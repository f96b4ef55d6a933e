package com.releasefeed.pipeline.config;

public class PipelineConfigurationException extends RuntimeException {
    public PipelineConfigurationException(String message) {
        super(message);
    }
}
