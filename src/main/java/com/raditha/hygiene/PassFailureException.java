package com.raditha.hygiene;

/**
 * Raised by the pipeline driver when a pass throws. Carries the pass name so the failure can be
 * located without a debugger.
 */
public class PassFailureException extends PipelineException {

    private final String passName;
    private final int iteration;

    public PassFailureException(String passName, int iteration, Throwable cause) {
        super(String.format("Pass '%s' failed in iteration %d: %s", passName, iteration, cause.getMessage()), cause);
        this.passName = passName;
        this.iteration = iteration;
    }

    public String passName() {
        return passName;
    }

    public int iteration() {
        return iteration;
    }
}
