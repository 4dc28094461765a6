package com.github.salilvnair.proofgen.api.controller;

import com.github.salilvnair.proofgen.api.dto.ErrorResponse;
import com.github.salilvnair.proofgen.api.dto.GenerateRequest;
import com.github.salilvnair.proofgen.api.dto.VerifyRequest;
import com.github.salilvnair.proofgen.engine.core.ProofGenCompiler;
import com.github.salilvnair.proofgen.engine.exception.GuardFailureException;
import com.github.salilvnair.proofgen.engine.exception.ProofGenErrorCode;
import com.github.salilvnair.proofgen.engine.exception.ProofGenException;
import com.github.salilvnair.proofgen.engine.guard.core.GuardStatus;
import com.github.salilvnair.proofgen.engine.guard.core.GuardVerdict;
import com.github.salilvnair.proofgen.engine.guard.core.GuardViolation;
import com.github.salilvnair.proofgen.engine.model.CompilationSummary;
import com.github.salilvnair.proofgen.engine.model.GenerateCommand;
import com.github.salilvnair.proofgen.engine.model.RunStatus;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ProofGenControllerTest {

    private final ProofGenCompiler compiler = mock(ProofGenCompiler.class);
    private final ProofGenController controller = new ProofGenController(compiler);
    private final ProofGenExceptionHandler handler = new ProofGenExceptionHandler();

    @Test
    void generateDefaultsToPreviewWithValidation() {
        CompilationSummary summary = CompilationSummary.builder().runId("r1").status(RunStatus.COMPLETED).build();
        when(compiler.generate(any())).thenReturn(summary);
        GenerateRequest request = new GenerateRequest();
        request.setWorkspaceRoot("/tmp/ws");

        assertSame(summary, controller.generate(request));

        ArgumentCaptor<GenerateCommand> captor = ArgumentCaptor.forClass(GenerateCommand.class);
        verify(compiler).generate(captor.capture());
        GenerateCommand command = captor.getValue();
        assertEquals(Path.of("/tmp/ws"), command.getWorkspaceRoot());
        assertTrue(command.isPreview());
        assertTrue(command.isValidate());
        assertFalse(command.isForce());
        assertFalse(command.isValidateOnly());
    }

    @Test
    void generateHonoursExplicitFlags() {
        GenerateRequest request = new GenerateRequest();
        request.setWorkspaceRoot("/tmp/ws");
        request.setPreview(false);
        request.setForce(true);
        request.setValidate(false);

        controller.generate(request);

        ArgumentCaptor<GenerateCommand> captor = ArgumentCaptor.forClass(GenerateCommand.class);
        verify(compiler).generate(captor.capture());
        assertFalse(captor.getValue().isPreview());
        assertTrue(captor.getValue().isForce());
        assertFalse(captor.getValue().isValidate());
    }

    @Test
    void blankWorkspaceIsRejectedBeforeCompiling() {
        ProofGenException ex = assertThrows(ProofGenException.class, () -> controller.generate(new GenerateRequest()));

        assertEquals(ProofGenErrorCode.WORKSPACE_NOT_FOUND.name(), ex.getErrorCode());
        verifyNoInteractions(compiler);
    }

    @Test
    void verifyRequiresReceiptPath() {
        VerifyRequest request = new VerifyRequest();
        request.setReceiptPath(" ");

        assertThrows(ProofGenException.class, () -> controller.verify(request));
        verifyNoInteractions(compiler);
    }

    @Test
    void guardFailureMapsToUnprocessableEntityWithVerdicts() {
        GuardVerdict failed = new GuardVerdict("G1", "Path Safety", GuardStatus.FAIL, "Unsafe paths", "fix",
                GuardViolation.PATH_SAFETY_VIOLATION, Map.of());

        ResponseEntity<ErrorResponse> response = handler.guardFailure(new GuardFailureException("G1", List.of(failed)));

        assertEquals(HttpStatus.UNPROCESSABLE_ENTITY, response.getStatusCode());
        assertEquals("G1", response.getBody().getFailedGuardId());
        assertEquals(List.of(failed), response.getBody().getVerdicts());
        assertEquals(ProofGenErrorCode.GUARD_FAILURE.name(), response.getBody().getErrorCode());
    }

    @Test
    void clientErrorsMapToBadRequest() {
        ProofGenException ex = new ProofGenException(ProofGenErrorCode.OUTPUT_VALIDATION_FAILED, "bad output")
                .withMetaData(Map.of("issues", List.of("out/a.rs:2: unclosed '{'")));

        ResponseEntity<ErrorResponse> response = handler.proofGenFailure(ex);

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals(Map.of("issues", List.of("out/a.rs:2: unclosed '{'")), response.getBody().getMetaData());
    }

    @Test
    void otherFailuresMapToServerError() {
        ResponseEntity<ErrorResponse> response = handler.proofGenFailure(
                new ProofGenException(ProofGenErrorCode.RECEIPT_WRITE_FAILED, "disk full"));

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertTrue(response.getBody().isRecoverable());
    }
}
