package com.github.salilvnair.proofgen.engine.receipt.model;

public enum OutputStatus {
    CREATED,
    UPDATED,
    UNCHANGED,
    PREVIEW
}
