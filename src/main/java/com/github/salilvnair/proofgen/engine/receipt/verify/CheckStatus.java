package com.github.salilvnair.proofgen.engine.receipt.verify;

public enum CheckStatus {
    PASS,
    FAIL,
    SKIP
}
