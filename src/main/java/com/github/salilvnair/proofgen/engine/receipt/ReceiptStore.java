package com.github.salilvnair.proofgen.engine.receipt;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.salilvnair.proofgen.config.ProofGenConfig;
import com.github.salilvnair.proofgen.engine.exception.ProofGenErrorCode;
import com.github.salilvnair.proofgen.engine.exception.ProofGenException;
import com.github.salilvnair.proofgen.engine.exception.ReceiptIntegrityException;
import com.github.salilvnair.proofgen.engine.hash.ContentHasher;
import com.github.salilvnair.proofgen.engine.receipt.model.GenerationReceipt;
import com.github.salilvnair.proofgen.engine.writer.AtomicFileWriter;
import com.github.salilvnair.proofgen.util.JsonUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

@Slf4j
@RequiredArgsConstructor
@Component
public class ReceiptStore {

    private static final ObjectMapper READER = JsonUtil.mapper().copy()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_AS_NULL, true);

    private final ProofGenConfig config;
    private final AtomicFileWriter writer;
    private final ContentHasher hasher;

    public Path pathFor(Path workspaceRoot, String receiptId) {
        return workspaceRoot.toAbsolutePath().normalize()
                .resolve(config.getWorkspace().getReceiptsDir())
                .resolve(receiptId + ".json");
    }

    public Path save(Path workspaceRoot, GenerationReceipt receipt) {
        Path target = pathFor(workspaceRoot, receipt.receiptId());
        try {
            writer.write(target, JsonUtil.toPrettyJson(receipt).getBytes(StandardCharsets.UTF_8));
        }
        catch (IOException e) {
            throw new ProofGenException(ProofGenErrorCode.RECEIPT_WRITE_FAILED,
                    "Failed to write receipt " + target + ": " + e.getMessage(), e);
        }
        log.info("Receipt {} written to {}", receipt.receiptId(), target);
        return target;
    }

    public GenerationReceipt load(Path receiptPath) {
        try {
            GenerationReceipt receipt = READER.readValue(Files.readAllBytes(receiptPath), GenerationReceipt.class);
            if (receipt == null) {
                throw new ProofGenException(ProofGenErrorCode.RECEIPT_READ_FAILED, "Receipt is empty: " + receiptPath);
            }
            return receipt;
        }
        catch (IOException e) {
            throw new ProofGenException(ProofGenErrorCode.RECEIPT_READ_FAILED,
                    "Failed to read receipt " + receiptPath + ": " + e.getMessage(), e);
        }
    }

    /** Loads and rejects a receipt whose id no longer matches its content. */
    public GenerationReceipt loadVerified(Path receiptPath) {
        GenerationReceipt receipt = load(receiptPath);
        String computed = ReceiptIds.compute(hasher, receipt);
        if (!computed.equals(receipt.receiptId())) {
            throw new ReceiptIntegrityException(receipt.receiptId(), computed);
        }
        return receipt;
    }
}
