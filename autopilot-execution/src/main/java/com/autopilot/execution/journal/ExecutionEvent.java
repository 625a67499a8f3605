package com.autopilot.execution.journal;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.Instant;

/**
 * Base type of every journal line. The {@code eventType} property selects the subtype on read.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "eventType")
@JsonSubTypes({
    @JsonSubTypes.Type(value = OrderEvent.class, name = "order"),
    @JsonSubTypes.Type(value = PositionEvent.class, name = "position"),
    @JsonSubTypes.Type(value = TradeEvent.class, name = "trade"),
    @JsonSubTypes.Type(value = LogEvent.class, name = "log")
})
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class ExecutionEvent {

    @JsonProperty
    private Instant timestamp;

    protected ExecutionEvent() {
        this.timestamp = Instant.now();
    }

    protected ExecutionEvent(Instant timestamp) {
        this.timestamp = timestamp != null ? timestamp : Instant.now();
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @JsonIgnore
    public abstract String getEventType();

    public abstract String getSummary();
}
