module com.autopilot.exchange {
    // Exports
    exports com.autopilot.exchange;
    exports com.autopilot.exchange.dialect;
    exports com.autopilot.exchange.exception;
    exports com.autopilot.exchange.feed;
    exports com.autopilot.exchange.http;
    exports com.autopilot.exchange.model;
    exports com.autopilot.exchange.pionex;

    // Dependencies
    requires transitive com.autopilot.core;
    requires okhttp3;
    requires com.fasterxml.jackson.databind;
    requires com.fasterxml.jackson.dataformat.yaml;
    requires org.java_websocket;
    requires org.bouncycastle.provider;
    requires org.slf4j;

    // Jackson needs reflection access to models
    opens com.autopilot.exchange.model to com.fasterxml.jackson.databind;
}
