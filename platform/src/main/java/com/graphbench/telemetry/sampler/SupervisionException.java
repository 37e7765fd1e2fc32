package com.graphbench.telemetry.sampler;

/**
 * A supervised run could not be carried to completion: the command did not launch,
 * the supervising thread was interrupted, or the run directory could not be written.
 */
public class SupervisionException extends RuntimeException {

    public SupervisionException(String message, Throwable cause) {
        super(message, cause);
    }

    public SupervisionException(String message) {
        super(message);
    }
}
