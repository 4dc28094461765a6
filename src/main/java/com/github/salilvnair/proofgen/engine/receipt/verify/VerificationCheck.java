package com.github.salilvnair.proofgen.engine.receipt.verify;

import com.fasterxml.jackson.annotation.JsonProperty;

public record VerificationCheck(
        @JsonProperty("check_id") String checkId,
        @JsonProperty("name") String name,
        @JsonProperty("verdict") CheckStatus status,
        @JsonProperty("message") String message
) {

    public static VerificationCheck pass(String checkId, String name, String message) {
        return new VerificationCheck(checkId, name, CheckStatus.PASS, message);
    }

    public static VerificationCheck fail(String checkId, String name, String message) {
        return new VerificationCheck(checkId, name, CheckStatus.FAIL, message);
    }

    public static VerificationCheck skip(String checkId, String name, String message) {
        return new VerificationCheck(checkId, name, CheckStatus.SKIP, message);
    }
}
