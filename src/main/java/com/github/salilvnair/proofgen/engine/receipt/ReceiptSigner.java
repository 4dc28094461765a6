package com.github.salilvnair.proofgen.engine.receipt;

import com.github.salilvnair.proofgen.config.ProofGenConfig;
import lombok.RequiredArgsConstructor;
import org.apache.commons.codec.digest.HmacAlgorithms;
import org.apache.commons.codec.digest.HmacUtils;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * HMAC-SHA256 over the receipt id, keyed by {@code proofgen.receipt.signing-key}.
 */
@RequiredArgsConstructor
@Component
public class ReceiptSigner {

    private final ProofGenConfig config;

    public boolean hasKey() {
        String key = config.getReceipt().getSigningKey();
        return key != null && !key.isBlank();
    }

    /** @return hex signature, or {@code null} when no key is configured */
    public String sign(String receiptId) {
        if (!hasKey()) {
            return null;
        }
        return new HmacUtils(HmacAlgorithms.HMAC_SHA_256, config.getReceipt().getSigningKey()).hmacHex(receiptId);
    }

    public boolean matches(String receiptId, String signature) {
        String expected = sign(receiptId);
        if (expected == null || signature == null || receiptId == null) {
            return false;
        }
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                signature.getBytes(StandardCharsets.UTF_8));
    }
}
