package com.clouddeploy.exception;

/**
 * Fault raised inside a deployment run. Never leaves the run; the lifecycle
 * turns it into a failed deployment.
 */
public class PipelineFaultException extends RuntimeException {

    public PipelineFaultException(String message) {
        super(message);
    }
}
