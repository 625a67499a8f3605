module com.autopilot.core {
    // Exports - all public packages
    exports com.autopilot.core.model;
    exports com.autopilot.core.indicators;
    exports com.autopilot.core.strategy;

    // Logging
    requires org.slf4j;

    // Strategy and order models are bound from YAML by the exchange config loader
    opens com.autopilot.core.model;
    opens com.autopilot.core.strategy;
}
