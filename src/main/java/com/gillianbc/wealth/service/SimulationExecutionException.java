package com.gillianbc.wealth.service;

/**
 * A worker thread failed, or the caller was interrupted, while a simulation was running.
 */
public class SimulationExecutionException extends RuntimeException {

    public SimulationExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
