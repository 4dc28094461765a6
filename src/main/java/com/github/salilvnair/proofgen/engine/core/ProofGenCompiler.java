package com.github.salilvnair.proofgen.engine.core;

import com.github.salilvnair.proofgen.engine.model.CompilationSummary;
import com.github.salilvnair.proofgen.engine.model.GenerateCommand;
import com.github.salilvnair.proofgen.engine.receipt.verify.VerificationResult;

import java.nio.file.Path;

public interface ProofGenCompiler {
    CompilationSummary generate(GenerateCommand command);

    VerificationResult verify(Path receiptPath);
}
