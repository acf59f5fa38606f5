package com.linlay.assistantgw.ingest.model;

import java.nio.charset.StandardCharsets;

public record Blob(byte[] data, String name, String mimeType) {

    public Blob {
        if (data == null) {
            throw new IllegalArgumentException("data must not be null");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (mimeType == null || mimeType.isBlank()) {
            throw new IllegalArgumentException("mimeType must not be null or blank");
        }
    }

    public int size() {
        return data.length;
    }

    public String asString() {
        return new String(data, StandardCharsets.UTF_8);
    }
}
