package com.trace.lifecycle.health;

/**
 * Checks one background component of the tracer.
 *
 * @param <T> the report type of the component
 */
@FunctionalInterface
public interface ComponentHealthCheck<T extends ComponentHealth> {

    T check();
}
