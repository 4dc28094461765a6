package com.github.salilvnair.proofgen.api.controller;

import com.github.salilvnair.proofgen.api.dto.GenerateRequest;
import com.github.salilvnair.proofgen.api.dto.VerifyRequest;
import com.github.salilvnair.proofgen.engine.core.ProofGenCompiler;
import com.github.salilvnair.proofgen.engine.exception.ProofGenErrorCode;
import com.github.salilvnair.proofgen.engine.exception.ProofGenException;
import com.github.salilvnair.proofgen.engine.model.CompilationSummary;
import com.github.salilvnair.proofgen.engine.model.GenerateCommand;
import com.github.salilvnair.proofgen.engine.receipt.verify.VerificationResult;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;

@RestController
@RequestMapping("/api/v1/proofgen")
@RequiredArgsConstructor
public class ProofGenController {

    private final ProofGenCompiler compiler;

    @PostMapping("/generate")
    public CompilationSummary generate(@RequestBody GenerateRequest request) {
        if (request.getWorkspaceRoot() == null || request.getWorkspaceRoot().isBlank()) {
            throw new ProofGenException(ProofGenErrorCode.WORKSPACE_NOT_FOUND, "workspaceRoot is required");
        }
        GenerateCommand command = GenerateCommand.builder()
                .workspaceRoot(Path.of(request.getWorkspaceRoot()))
                .preview(!Boolean.FALSE.equals(request.getPreview()))
                .force(Boolean.TRUE.equals(request.getForce()))
                .validate(!Boolean.FALSE.equals(request.getValidate()))
                .validateOnly(Boolean.TRUE.equals(request.getValidateOnly()))
                .build();
        return compiler.generate(command);
    }

    @PostMapping("/verify")
    public VerificationResult verify(@RequestBody VerifyRequest request) {
        if (request.getReceiptPath() == null || request.getReceiptPath().isBlank()) {
            throw new ProofGenException(ProofGenErrorCode.RECEIPT_READ_FAILED, "receiptPath is required");
        }
        return compiler.verify(Path.of(request.getReceiptPath()));
    }
}
