module com.autopilot.runtime {
    // Exports
    exports com.autopilot.runtime;
    exports com.autopilot.runtime.watchdog;

    // Java modules
    requires java.management;
    requires jdk.management;  // For com.sun.management.OperatingSystemMXBean

    // Dependencies
    requires transitive com.autopilot.execution;
    requires com.fasterxml.jackson.databind;
    requires org.slf4j;
}
