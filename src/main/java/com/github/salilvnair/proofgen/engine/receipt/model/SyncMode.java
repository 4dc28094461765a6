package com.github.salilvnair.proofgen.engine.receipt.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SyncMode {
    PREVIEW,
    APPLY;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
