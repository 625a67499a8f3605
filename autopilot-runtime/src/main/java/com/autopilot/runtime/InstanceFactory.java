package com.autopilot.runtime;

/**
 * Builds a fully wired, not yet started instance for an id.
 */
@FunctionalInterface
public interface InstanceFactory {

    TradingInstance create(String instanceId);
}
