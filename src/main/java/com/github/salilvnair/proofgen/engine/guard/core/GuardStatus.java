package com.github.salilvnair.proofgen.engine.guard.core;

public enum GuardStatus {
    PASS,
    FAIL,
    SKIP
}
