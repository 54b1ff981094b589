package com.gillianbc.wealth.service;

/**
 * A {@link com.gillianbc.wealth.model.SimulationConfig} that cannot be simulated. Raised before any
 * work starts, so no partial result exists.
 */
public class InvalidSimulationConfigException extends IllegalArgumentException {

    public InvalidSimulationConfigException(String message) {
        super(message);
    }
}
