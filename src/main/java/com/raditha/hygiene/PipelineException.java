package com.raditha.hygiene;

/**
 * Base class for every failure the normalization pipeline can raise.
 * A pass that merely fails to match never throws; these exceptions signal bugs in the pipeline.
 */
public class PipelineException extends RuntimeException {

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
