module com.autopilot.execution {
    // Exports
    exports com.autopilot.execution.config;
    exports com.autopilot.execution.harness;
    exports com.autopilot.execution.journal;
    exports com.autopilot.execution.notify;
    exports com.autopilot.execution.order;
    exports com.autopilot.execution.position;
    exports com.autopilot.execution.risk;
    exports com.autopilot.execution.spi;

    // Dependencies
    requires transitive com.autopilot.core;
    requires transitive com.autopilot.exchange;
    requires com.fasterxml.jackson.databind;
    requires com.fasterxml.jackson.datatype.jsr310;
    requires org.slf4j;

    // Jackson needs reflection access
    opens com.autopilot.execution.journal to com.fasterxml.jackson.databind;
    opens com.autopilot.execution.order to com.fasterxml.jackson.databind;
    opens com.autopilot.execution.position to com.fasterxml.jackson.databind;
    opens com.autopilot.execution.spi to com.fasterxml.jackson.databind;
}
