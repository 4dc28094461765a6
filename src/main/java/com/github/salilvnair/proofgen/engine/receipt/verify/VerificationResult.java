package com.github.salilvnair.proofgen.engine.receipt.verify;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

public record VerificationResult(
        @JsonProperty("receipt_path") String receiptPath,
        @JsonProperty("checks") List<VerificationCheck> checks,
        @JsonProperty("result") Outcome result
) {

    public enum Outcome {
        VERIFIED,
        FAILED
    }

    public VerificationResult {
        checks = List.copyOf(checks);
    }

    /** VERIFIED iff every check that ran passed. */
    public static VerificationResult of(String receiptPath, List<VerificationCheck> checks) {
        boolean verified = checks.stream()
                .filter(c -> c.status() != CheckStatus.SKIP)
                .allMatch(c -> c.status() == CheckStatus.PASS);
        return new VerificationResult(receiptPath, checks, verified ? Outcome.VERIFIED : Outcome.FAILED);
    }

    @JsonIgnore
    public boolean verified() {
        return result == Outcome.VERIFIED;
    }

    public Optional<VerificationCheck> check(String checkId) {
        return checks.stream().filter(c -> c.checkId().equals(checkId)).findFirst();
    }

    @JsonIgnore
    public List<VerificationCheck> failures() {
        return checks.stream().filter(c -> c.status() == CheckStatus.FAIL).toList();
    }
}
