package com.linlay.assistantgw.ingest.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum IngestJobStatus {
    RUNNING,
    DONE,
    ERROR,
    CANCELED;

    public boolean isTerminal() {
        return this != RUNNING;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
